package com.ryuqq.experiment.core.spi;

import com.ryuqq.experiment.core.context.TrialAssignment;

/**
 * Receives one {@link TrialAssignment} per completed call.
 *
 * <p>Fire-and-forget: the dispatcher catches anything thrown here, so a sink can never change a
 * call's result. Implementations that do I/O should hand the event off instead of blocking the
 * calling thread.</p>
 *
 * @author Experiment Dispatch Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface AuditSink {

    /**
     * Records a completed call.
     *
     * @param assignment the routing and outcome of the call
     */
    void record(TrialAssignment assignment);
}
