package com.ryuqq.experiment.core.model;

/**
 * Experiment에 등록된 하나의 후보 구현 (Trial).
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>key: null 또는 빈 문자열 불가, 대소문자 구분</li>
 *   <li>factory: null 불가</li>
 * </ul>
 *
 * @param <S> 서비스 인터페이스 타입
 * @author Experiment Dispatch Team
 * @since 1.0.0
 */
public final class TrialDefinition<S> {

    private final String key;
    private final TrialFactory<S> factory;
    private final boolean defaultTrial;

    private TrialDefinition(String key, TrialFactory<S> factory, boolean defaultTrial) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("trial key cannot be null or empty");
        }
        if (factory == null) {
            throw new IllegalArgumentException("factory cannot be null (trial: " + key + ")");
        }
        this.key = key;
        this.factory = factory;
        this.defaultTrial = defaultTrial;
    }

    /**
     * 기본(Control) Trial 생성.
     *
     * @param key Trial Key
     * @param factory 구현체 Factory
     * @param <S> 서비스 타입
     * @return TrialDefinition
     */
    public static <S> TrialDefinition<S> control(String key, TrialFactory<S> factory) {
        return new TrialDefinition<>(key, factory, true);
    }

    /**
     * 일반 Trial 생성.
     *
     * @param key Trial Key
     * @param factory 구현체 Factory
     * @param <S> 서비스 타입
     * @return TrialDefinition
     */
    public static <S> TrialDefinition<S> condition(String key, TrialFactory<S> factory) {
        return new TrialDefinition<>(key, factory, false);
    }

    /**
     * Trial 생성 (설정 로더 용).
     *
     * @param key Trial Key
     * @param factory 구현체 Factory
     * @param defaultTrial 기본 Trial 여부
     * @param <S> 서비스 타입
     * @return TrialDefinition
     */
    public static <S> TrialDefinition<S> of(String key, TrialFactory<S> factory, boolean defaultTrial) {
        return new TrialDefinition<>(key, factory, defaultTrial);
    }

    public String getKey() {
        return key;
    }

    public TrialFactory<S> getFactory() {
        return factory;
    }

    public boolean isDefault() {
        return defaultTrial;
    }

    @Override
    public String toString() {
        return "TrialDefinition{" + key + (defaultTrial ? ", default" : "") + '}';
    }
}
