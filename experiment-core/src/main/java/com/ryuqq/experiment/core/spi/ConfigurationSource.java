package com.ryuqq.experiment.core.spi;

import java.util.Optional;

/**
 * Configuration value lookup used by the {@code ConfigurationValue} selection mode.
 *
 * @author Experiment Dispatch Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ConfigurationSource {

    /**
     * Reads a raw string value.
     *
     * @param key configuration key (e.g. {@code "Experiments:TaxProvider"})
     * @return the value, empty if absent
     */
    Optional<String> valueOf(String key);
}
