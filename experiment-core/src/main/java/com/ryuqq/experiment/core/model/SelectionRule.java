package com.ryuqq.experiment.core.model;

/**
 * Experiment의 Trial 선택 규칙.
 *
 * <p>{@code selectorName}이 null이면 Registry 빌드 시점에
 * {@link com.ryuqq.experiment.core.naming.NamingConvention}으로 기본 이름이 결정됩니다.</p>
 *
 * @param mode 선택 모드
 * @param modeIdentifier Custom 모드 Provider 식별자 (내장 모드는 해당 모드의 내장 식별자)
 * @param selectorName 플래그 이름 또는 설정 키 (null 가능)
 *
 * @author Experiment Dispatch Team
 * @since 1.0.0
 */
public record SelectionRule(
    SelectionMode mode,
    String modeIdentifier,
    String selectorName
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException mode가 null이거나, CUSTOM 모드에 식별자가 없는 경우
     */
    public SelectionRule {
        if (mode == null) {
            throw new IllegalArgumentException("mode cannot be null");
        }
        if (mode.isBuiltIn()) {
            modeIdentifier = mode.builtInIdentifier();
        } else if (modeIdentifier == null || modeIdentifier.isBlank()) {
            throw new IllegalArgumentException("modeIdentifier cannot be null or blank for CUSTOM mode");
        }
        if (selectorName != null && selectorName.isBlank()) {
            selectorName = null;
        }
    }

    public static SelectionRule featureFlag(String flagName) {
        return new SelectionRule(SelectionMode.BOOLEAN_FEATURE_FLAG, null, flagName);
    }

    public static SelectionRule configurationValue(String configurationKey) {
        return new SelectionRule(SelectionMode.CONFIGURATION_VALUE, null, configurationKey);
    }

    public static SelectionRule variantFlag(String flagName) {
        return new SelectionRule(SelectionMode.VARIANT_FLAG, null, flagName);
    }

    public static SelectionRule stickyRouting(String selectorName) {
        return new SelectionRule(SelectionMode.STICKY_ROUTING, null, selectorName);
    }

    public static SelectionRule custom(String modeIdentifier, String selectorName) {
        return new SelectionRule(SelectionMode.CUSTOM, modeIdentifier, selectorName);
    }

    /**
     * selectorName이 명시되었는지 확인.
     *
     * @return 명시된 경우 true
     */
    public boolean hasSelectorName() {
        return selectorName != null;
    }
}
