package com.ryuqq.experiment.core.model;

/**
 * 호출 시점에 Trial Key를 계산하는 방식.
 *
 * <p>내장 모드는 각각 고정된 식별자를 가지며, {@link #CUSTOM}은
 * {@link SelectionRule#modeIdentifier()}에 지정된 외부 Provider로 위임합니다.</p>
 *
 * <ul>
 *   <li>{@link #BOOLEAN_FEATURE_FLAG}: 플래그 true → {@code "true"}, false → {@code "false"}</li>
 *   <li>{@link #CONFIGURATION_VALUE}: 설정 값 문자열을 그대로 Trial Key로 사용</li>
 *   <li>{@link #VARIANT_FLAG}: 플래그 평가 결과(Variant 이름)를 그대로 Trial Key로 사용</li>
 *   <li>{@link #STICKY_ROUTING}: Subject 식별자 해시로 결정적 분배</li>
 *   <li>{@link #CUSTOM}: 등록된 Provider에 위임</li>
 * </ul>
 *
 * @author Experiment Dispatch Team
 * @since 1.0.0
 */
public enum SelectionMode {

    BOOLEAN_FEATURE_FLAG("BooleanFeatureFlag"),
    CONFIGURATION_VALUE("ConfigurationValue"),
    VARIANT_FLAG("VariantFlag"),
    STICKY_ROUTING("StickyRouting"),
    CUSTOM(null);

    private final String builtInIdentifier;

    SelectionMode(String builtInIdentifier) {
        this.builtInIdentifier = builtInIdentifier;
    }

    /**
     * 내장 모드의 Provider 식별자 조회.
     *
     * @return 내장 식별자, {@link #CUSTOM}인 경우 null
     */
    public String builtInIdentifier() {
        return builtInIdentifier;
    }

    /**
     * 내장 모드 여부 확인.
     *
     * @return {@link #CUSTOM}이 아니면 true
     */
    public boolean isBuiltIn() {
        return this != CUSTOM;
    }
}
