package com.ryuqq.experiment.core.naming;

/**
 * 기본 명명 규칙.
 *
 * <ul>
 *   <li>Feature Flag / Variant Flag: 서비스 타입의 단순 이름 (예: {@code "TaxProvider"})</li>
 *   <li>설정 키: {@code "Experiments:" + 단순 이름} (예: {@code "Experiments:TaxProvider"})</li>
 * </ul>
 *
 * @author Experiment Dispatch Team
 * @since 1.0.0
 */
public final class DefaultNamingConvention implements NamingConvention {

    public static final String CONFIGURATION_PREFIX = "Experiments:";

    @Override
    public String featureFlagNameFor(Class<?> serviceType) {
        return requireType(serviceType).getSimpleName();
    }

    @Override
    public String variantFlagNameFor(Class<?> serviceType) {
        return requireType(serviceType).getSimpleName();
    }

    @Override
    public String configurationKeyFor(Class<?> serviceType) {
        return CONFIGURATION_PREFIX + requireType(serviceType).getSimpleName();
    }

    private static Class<?> requireType(Class<?> serviceType) {
        if (serviceType == null) {
            throw new IllegalArgumentException("serviceType cannot be null");
        }
        return serviceType;
    }
}
