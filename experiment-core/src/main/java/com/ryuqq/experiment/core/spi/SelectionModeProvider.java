package com.ryuqq.experiment.core.spi;

import com.ryuqq.experiment.core.naming.NamingConvention;

import java.util.Optional;

/**
 * Selection Mode SPI.
 *
 * <p>Built-in modes and custom modes share this contract. Custom providers are registered by
 * {@link #modeIdentifier()} when the registry is built; an experiment that references an
 * unregistered identifier fails the build, never the call.</p>
 *
 * <p><strong>Failure semantics:</strong> a provider may throw or return {@link Optional#empty()}.
 * Either way the dispatcher routes the call to the default trial and records the reason;
 * nothing reaches the caller.</p>
 *
 * @author Experiment Dispatch Team
 * @since 1.0.0
 */
public interface SelectionModeProvider {

    /**
     * The identifier experiments use to reference this provider.
     *
     * @return mode identifier (case-sensitive)
     */
    String modeIdentifier();

    /**
     * Resolves the trial key for the current call.
     *
     * @param context selection input
     * @return the trial key, or empty to use the default trial
     */
    Optional<String> selectTrialKey(SelectionContext context);

    /**
     * Selector name used when the experiment does not declare one.
     *
     * @param serviceType the experiment's service interface
     * @param convention the registry's naming convention
     * @return default selector name
     */
    default String defaultSelectorName(Class<?> serviceType, NamingConvention convention) {
        return convention.featureFlagNameFor(serviceType);
    }
}
