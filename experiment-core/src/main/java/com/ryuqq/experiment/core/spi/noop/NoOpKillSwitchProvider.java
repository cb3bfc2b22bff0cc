package com.ryuqq.experiment.core.spi.noop;

import com.ryuqq.experiment.core.spi.KillSwitchProvider;

/**
 * Kill Switch NoOp 구현.
 *
 * <p>아무 것도 비활성화하지 않습니다. Kill Switch가 설정되지 않은 Registry의 기본값입니다.</p>
 *
 * <ul>
 *   <li>isExperimentDisabled() / isTrialDisabled(): 항상 false</li>
 *   <li>disable*() / enable*(): {@link UnsupportedOperationException} (토글이 조용히 무시되지 않도록)</li>
 * </ul>
 *
 * @author Experiment Dispatch Team
 * @since 1.0.0
 */
public final class NoOpKillSwitchProvider implements KillSwitchProvider {

    @Override
    public boolean isExperimentDisabled(Class<?> serviceType) {
        return false;
    }

    @Override
    public boolean isTrialDisabled(Class<?> serviceType, String trialKey) {
        return false;
    }

    @Override
    public void disableExperiment(Class<?> serviceType) {
        throw unsupported();
    }

    @Override
    public void enableExperiment(Class<?> serviceType) {
        throw unsupported();
    }

    @Override
    public void disableTrial(Class<?> serviceType, String trialKey) {
        throw unsupported();
    }

    @Override
    public void enableTrial(Class<?> serviceType, String trialKey) {
        throw unsupported();
    }

    private static UnsupportedOperationException unsupported() {
        return new UnsupportedOperationException("No kill switch provider configured for this registry");
    }
}
