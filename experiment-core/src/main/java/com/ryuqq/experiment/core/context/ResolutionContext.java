package com.ryuqq.experiment.core.context;

import java.util.Map;
import java.util.Optional;

/**
 * Trial 구현체와 Provider가 호출 범위의 협력 객체를 조회하는 창구.
 *
 * <p>DI 컨테이너의 요청 스코프, 테스트 하네스의 Fixture 등 호스트가 제공하는
 * 범위를 추상화합니다. 조회 실패는 예외가 아니라 빈 Optional로 표현합니다.</p>
 *
 * @author Experiment Dispatch Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ResolutionContext {

    /**
     * 타입으로 협력 객체 조회.
     *
     * @param type 조회할 타입
     * @param <T> 타입
     * @return 등록된 객체 (없으면 empty)
     */
    <T> Optional<T> lookup(Class<T> type);

    /**
     * 아무 것도 제공하지 않는 Context.
     *
     * @return 빈 ResolutionContext
     */
    static ResolutionContext empty() {
        return SimpleResolutionContext.EMPTY;
    }

    /**
     * 타입 → 객체 Map 기반 Context.
     *
     * @param entries 등록할 객체
     * @return ResolutionContext
     */
    static ResolutionContext of(Map<Class<?>, Object> entries) {
        return new SimpleResolutionContext(entries);
    }
}
