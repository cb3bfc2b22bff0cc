package com.ryuqq.experiment.core.spi;

import com.ryuqq.experiment.core.context.ResolutionContext;

/**
 * Boolean feature flag lookup used by the {@code BooleanFeatureFlag} selection mode.
 *
 * @author Experiment Dispatch Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface FeatureFlagSource {

    /**
     * Evaluates a boolean flag.
     *
     * @param flagName the flag name
     * @param context the current call's resolution context
     * @return flag value
     */
    boolean isEnabled(String flagName, ResolutionContext context);
}
