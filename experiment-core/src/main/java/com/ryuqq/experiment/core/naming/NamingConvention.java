package com.ryuqq.experiment.core.naming;

/**
 * 서비스 타입에서 기본 Selector 이름을 도출하는 규칙.
 *
 * <p>Experiment 정의에 Selector 이름이 명시되지 않은 경우에만 사용됩니다.
 * 구현은 순수 함수여야 합니다.</p>
 *
 * @author Experiment Dispatch Team
 * @since 1.0.0
 */
public interface NamingConvention {

    /**
     * Boolean Feature Flag 이름.
     *
     * @param serviceType 서비스 인터페이스 타입
     * @return 플래그 이름
     */
    String featureFlagNameFor(Class<?> serviceType);

    /**
     * Variant Flag 이름.
     *
     * @param serviceType 서비스 인터페이스 타입
     * @return 플래그 이름
     */
    String variantFlagNameFor(Class<?> serviceType);

    /**
     * 설정 키.
     *
     * @param serviceType 서비스 인터페이스 타입
     * @return 설정 키
     */
    String configurationKeyFor(Class<?> serviceType);
}
