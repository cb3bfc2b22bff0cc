package com.ryuqq.experiment.core.model;

import java.util.Set;

/**
 * Kill Switch 상태 스냅샷 (불변).
 *
 * <p>영속화 어댑터가 저장/복원하는 단위입니다.</p>
 *
 * @param disabledExperiments 전체 비활성화된 Experiment의 서비스 타입
 * @param disabledTrials 개별 비활성화된 Trial
 *
 * @author Experiment Dispatch Team
 * @since 1.0.0
 */
public record KillSwitchState(
    Set<Class<?>> disabledExperiments,
    Set<DisabledTrial> disabledTrials
) {

    /**
     * 아무 것도 비활성화되지 않은 상태.
     */
    public static final KillSwitchState EMPTY = new KillSwitchState(Set.of(), Set.of());

    public KillSwitchState {
        if (disabledExperiments == null) {
            throw new IllegalArgumentException("disabledExperiments cannot be null");
        }
        if (disabledTrials == null) {
            throw new IllegalArgumentException("disabledTrials cannot be null");
        }
        disabledExperiments = Set.copyOf(disabledExperiments);
        disabledTrials = Set.copyOf(disabledTrials);
    }

    public boolean isEmpty() {
        return disabledExperiments.isEmpty() && disabledTrials.isEmpty();
    }
}
