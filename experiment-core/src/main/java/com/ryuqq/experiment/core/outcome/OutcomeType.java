package com.ryuqq.experiment.core.outcome;

/**
 * Outcome 측정값의 종류.
 *
 * @author Experiment Dispatch Team
 * @since 1.0.0
 */
public enum OutcomeType {

    /**
     * 성공/실패 (1.0 / 0.0).
     */
    BINARY,

    /**
     * 연속 값 (예: 금액, 점수).
     */
    CONTINUOUS,

    /**
     * 발생 횟수.
     */
    COUNT,

    /**
     * 소요 시간 (밀리초).
     */
    DURATION
}
