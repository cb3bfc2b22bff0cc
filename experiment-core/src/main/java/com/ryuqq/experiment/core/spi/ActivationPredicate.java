package com.ryuqq.experiment.core.spi;

import com.ryuqq.experiment.core.context.ResolutionContext;

/**
 * 사용자 정의 활성화 조건.
 *
 * <p>활성 시간 구간과 AND로 결합됩니다. false를 반환하면 해당 호출은 기본 Trial로 라우팅됩니다.</p>
 *
 * @author Experiment Dispatch Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ActivationPredicate {

    /**
     * 활성 여부 판단.
     *
     * @param context 현재 호출의 Resolution Context
     * @return 활성이면 true
     */
    boolean isActive(ResolutionContext context);
}
