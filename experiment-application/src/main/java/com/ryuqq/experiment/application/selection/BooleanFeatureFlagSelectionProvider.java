package com.ryuqq.experiment.application.selection;

import com.ryuqq.experiment.core.model.SelectionMode;
import com.ryuqq.experiment.core.naming.NamingConvention;
import com.ryuqq.experiment.core.spi.FeatureFlagSource;
import com.ryuqq.experiment.core.spi.SelectionContext;
import com.ryuqq.experiment.core.spi.SelectionModeProvider;

import java.util.Optional;

/**
 * {@code BooleanFeatureFlag} 모드.
 *
 * <p>플래그 값을 Trial Key {@code "true"} / {@code "false"}로 변환합니다.
 * 해당 Key가 등록되어 있지 않으면 기본 Trial을 사용합니다.</p>
 *
 * @author Experiment Dispatch Team
 * @since 1.0.0
 */
public final class BooleanFeatureFlagSelectionProvider implements SelectionModeProvider {

    private final FeatureFlagSource featureFlagSource;

    public BooleanFeatureFlagSelectionProvider(FeatureFlagSource featureFlagSource) {
        if (featureFlagSource == null) {
            throw new IllegalArgumentException("featureFlagSource cannot be null");
        }
        this.featureFlagSource = featureFlagSource;
    }

    @Override
    public String modeIdentifier() {
        return SelectionMode.BOOLEAN_FEATURE_FLAG.builtInIdentifier();
    }

    @Override
    public Optional<String> selectTrialKey(SelectionContext context) {
        boolean enabled = featureFlagSource.isEnabled(context.selectorName(), context.resolutionContext());
        String key = Boolean.toString(enabled);
        return context.trialKeys().contains(key) ? Optional.of(key) : Optional.empty();
    }

    @Override
    public String defaultSelectorName(Class<?> serviceType, NamingConvention convention) {
        return convention.featureFlagNameFor(serviceType);
    }
}
