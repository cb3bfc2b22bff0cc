package com.ryuqq.experiment.core.model;

import com.ryuqq.experiment.core.context.ResolutionContext;

/**
 * Trial 구현체 생성 함수.
 *
 * <p>매 호출 시도마다 호출되며, 전달된 {@link ResolutionContext}를 통해
 * 호출 범위에 맞는 인스턴스를 만들 수 있습니다. 싱글턴 구현체를 반환해도 무방합니다.</p>
 *
 * @param <S> 서비스 인터페이스 타입
 * @author Experiment Dispatch Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface TrialFactory<S> {

    /**
     * 구현체 생성.
     *
     * @param context 현재 호출의 Resolution Context
     * @return 서비스 구현체 (null 불가)
     * @throws Exception 생성 실패 시 (해당 시도의 실패로 처리됨)
     */
    S create(ResolutionContext context) throws Exception;

    /**
     * 항상 같은 인스턴스를 반환하는 Factory.
     *
     * @param instance 구현체
     * @param <S> 서비스 타입
     * @return TrialFactory
     */
    static <S> TrialFactory<S> singleton(S instance) {
        if (instance == null) {
            throw new IllegalArgumentException("instance cannot be null");
        }
        return context -> instance;
    }
}
