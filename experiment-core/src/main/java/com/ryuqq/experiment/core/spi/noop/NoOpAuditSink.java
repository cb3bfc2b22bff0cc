package com.ryuqq.experiment.core.spi.noop;

import com.ryuqq.experiment.core.context.TrialAssignment;
import com.ryuqq.experiment.core.spi.AuditSink;

/**
 * Audit Sink NoOp 구현.
 *
 * <p>모든 이벤트를 버립니다. Audit Sink가 설정되지 않은 Registry의 기본값입니다.</p>
 *
 * @author Experiment Dispatch Team
 * @since 1.0.0
 */
public final class NoOpAuditSink implements AuditSink {

    @Override
    public void record(TrialAssignment assignment) {
        // NoOp
    }
}
