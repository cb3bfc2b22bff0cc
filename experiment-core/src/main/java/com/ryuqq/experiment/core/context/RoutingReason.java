package com.ryuqq.experiment.core.context;

/**
 * 호출이 특정 Trial로 라우팅된 이유.
 *
 * @author Experiment Dispatch Team
 * @since 1.0.0
 */
public enum RoutingReason {

    /**
     * Selection Mode가 결정한 Trial을 그대로 사용.
     */
    SELECTED,

    /**
     * 활성 구간 밖이거나 Activation Predicate가 false → 기본 Trial.
     */
    INACTIVE,

    /**
     * Experiment 전체가 Kill Switch로 비활성화 → 기본 Trial.
     */
    EXPERIMENT_DISABLED,

    /**
     * 선택된 Trial만 Kill Switch로 비활성화 → 기본 Trial.
     */
    TRIAL_DISABLED,

    /**
     * Selection Provider 실패 (예외, 소스 도달 불가) → 기본 Trial.
     */
    SELECTION_FAILED,

    /**
     * Selection 결과가 등록되지 않은 Trial Key → 기본 Trial.
     */
    UNKNOWN_TRIAL;

    /**
     * 기본 Trial로 강제된 경우인지 확인.
     *
     * @return SELECTED가 아니면 true
     */
    public boolean isForcedToDefault() {
        return this != SELECTED;
    }
}
