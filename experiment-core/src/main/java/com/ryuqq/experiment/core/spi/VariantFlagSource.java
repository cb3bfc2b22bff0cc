package com.ryuqq.experiment.core.spi;

import com.ryuqq.experiment.core.context.ResolutionContext;

import java.util.Optional;

/**
 * Variant flag lookup used by the {@code VariantFlag} selection mode.
 *
 * @author Experiment Dispatch Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface VariantFlagSource {

    /**
     * Evaluates a variant flag.
     *
     * @param flagName the flag name
     * @param context the current call's resolution context
     * @return variant name used verbatim as the trial key, empty if no variant is assigned
     */
    Optional<String> variantOf(String flagName, ResolutionContext context);
}
