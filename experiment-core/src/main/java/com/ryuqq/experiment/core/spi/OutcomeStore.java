package com.ryuqq.experiment.core.spi;

import com.ryuqq.experiment.core.outcome.ExperimentOutcome;

/**
 * Storage SPI for outcome records produced by the outcome collection decorator.
 *
 * <p>Implementations must be thread-safe. Failures are logged by the caller and do not affect the
 * decorated call.</p>
 *
 * @author Experiment Dispatch Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface OutcomeStore {

    /**
     * Stores one outcome.
     *
     * @param outcome the outcome record
     */
    void record(ExperimentOutcome outcome);
}
