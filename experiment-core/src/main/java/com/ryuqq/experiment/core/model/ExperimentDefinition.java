package com.ryuqq.experiment.core.model;

import com.ryuqq.experiment.core.policy.ErrorPolicy;
import com.ryuqq.experiment.core.spi.ActivationPredicate;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Experiment 정의 (작성 시점 모델).
 *
 * <p>하나의 서비스 인터페이스에 대해 등록된 Trial 목록, 선택 규칙, 오류 정책, 활성 조건을 담습니다.
 * 생성 후에는 불변입니다.</p>
 *
 * <p><strong>검증 범위:</strong></p>
 * <ul>
 *   <li>생성 시: name, serviceType, 필수 필드의 null 여부만 확인</li>
 *   <li>Registry 빌드 시: 기본 Trial 개수, Trial Key 중복, 정책이 참조하는 Key 등 구조 검증</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * ExperimentDefinition<TaxProvider> definition = ExperimentDefinition
 *     .builder("checkout-v2", TaxProvider.class)
 *     .control("control", ctx -> new LegacyTaxProvider())
 *     .condition("true", ctx -> new NewTaxProvider())
 *     .usingFeatureFlag("UseV2")
 *     .onErrorRedirectAndReplayDefault()
 *     .build();
 * }</pre>
 *
 * @param <S> 서비스 인터페이스 타입
 * @author Experiment Dispatch Team
 * @since 1.0.0
 */
public final class ExperimentDefinition<S> {

    private final String name;
    private final Class<S> serviceType;
    private final List<TrialDefinition<S>> trials;
    private final SelectionRule selectionRule;
    private final ErrorPolicy errorPolicy;
    private final ActivationWindow activationWindow;
    private final ActivationPredicate activationPredicate;
    private final Map<String, String> metadata;

    private ExperimentDefinition(Builder<S> builder) {
        this.name = builder.name;
        this.serviceType = builder.serviceType;
        this.trials = List.copyOf(builder.trials);
        this.selectionRule = builder.selectionRule;
        this.errorPolicy = builder.errorPolicy;
        this.activationWindow = builder.activationWindow;
        this.activationPredicate = builder.activationPredicate;
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
    }

    /**
     * Builder 생성.
     *
     * @param name Experiment 이름 (Registry 내 고유)
     * @param serviceType 서비스 인터페이스 타입
     * @param <S> 서비스 타입
     * @return Builder
     * @throws IllegalArgumentException name이 비어 있거나 serviceType이 null인 경우
     */
    public static <S> Builder<S> builder(String name, Class<S> serviceType) {
        return new Builder<>(name, serviceType);
    }

    public String getName() {
        return name;
    }

    public Class<S> getServiceType() {
        return serviceType;
    }

    /**
     * 등록 순서의 Trial 목록.
     *
     * @return 불변 List
     */
    public List<TrialDefinition<S>> getTrials() {
        return trials;
    }

    /**
     * 등록 순서의 Trial Key 목록.
     *
     * @return 불변 List
     */
    public List<String> getTrialKeys() {
        List<String> keys = new ArrayList<>(trials.size());
        for (TrialDefinition<S> trial : trials) {
            keys.add(trial.getKey());
        }
        return List.copyOf(keys);
    }

    /**
     * Key로 Trial 조회.
     *
     * @param key Trial Key (대소문자 구분)
     * @return 첫 번째로 일치하는 Trial
     */
    public Optional<TrialDefinition<S>> findTrial(String key) {
        for (TrialDefinition<S> trial : trials) {
            if (trial.getKey().equals(key)) {
                return Optional.of(trial);
            }
        }
        return Optional.empty();
    }

    /**
     * 기본 Trial 조회.
     *
     * <p>검증 전 정의에는 기본 Trial이 없거나 여러 개일 수 있으므로 첫 번째 것을 반환합니다.</p>
     *
     * @return 기본 Trial
     */
    public Optional<TrialDefinition<S>> findDefaultTrial() {
        return trials.stream().filter(TrialDefinition::isDefault).findFirst();
    }

    public SelectionRule getSelectionRule() {
        return selectionRule;
    }

    public ErrorPolicy getErrorPolicy() {
        return errorPolicy;
    }

    public ActivationWindow getActivationWindow() {
        return activationWindow;
    }

    public Optional<ActivationPredicate> getActivationPredicate() {
        return Optional.ofNullable(activationPredicate);
    }

    /**
     * 자유 형식 메타데이터 (owner, ticket, rollback 메모 등). Core는 해석하지 않습니다.
     *
     * @return 불변 Map (삽입 순서 유지)
     */
    public Map<String, String> getMetadata() {
        return metadata;
    }

    @Override
    public String toString() {
        return "ExperimentDefinition{"
            + "name='" + name + '\''
            + ", serviceType=" + serviceType.getName()
            + ", trials=" + getTrialKeys()
            + ", selection=" + selectionRule.modeIdentifier()
            + ", errorPolicy=" + errorPolicy.policyName()
            + '}';
    }

    /**
     * ExperimentDefinition Fluent Builder.
     *
     * <p>선택 규칙 기본값은 {@code BooleanFeatureFlag} (이름은 Naming Convention),
     * 오류 정책 기본값은 {@code Throw}입니다.</p>
     *
     * @param <S> 서비스 인터페이스 타입
     */
    public static final class Builder<S> {

        private final String name;
        private final Class<S> serviceType;
        private final List<TrialDefinition<S>> trials = new ArrayList<>();
        private final Map<String, String> metadata = new LinkedHashMap<>();
        private SelectionRule selectionRule = SelectionRule.featureFlag(null);
        private ErrorPolicy errorPolicy = ErrorPolicy.throwing();
        private ActivationWindow activationWindow = ActivationWindow.ALWAYS;
        private ActivationPredicate activationPredicate;

        private Builder(String name, Class<S> serviceType) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("name cannot be null or blank");
            }
            if (serviceType == null) {
                throw new IllegalArgumentException("serviceType cannot be null");
            }
            this.name = name;
            this.serviceType = serviceType;
        }

        /**
         * 기본(Control) Trial 등록.
         */
        public Builder<S> control(String key, TrialFactory<S> factory) {
            return trial(TrialDefinition.control(key, factory));
        }

        /**
         * 일반 Trial 등록.
         */
        public Builder<S> condition(String key, TrialFactory<S> factory) {
            return trial(TrialDefinition.condition(key, factory));
        }

        /**
         * 미리 만들어진 Trial 등록 (설정 로더 용).
         */
        public Builder<S> trial(TrialDefinition<S> trial) {
            if (trial == null) {
                throw new IllegalArgumentException("trial cannot be null");
            }
            trials.add(trial);
            return this;
        }

        public Builder<S> usingFeatureFlag() {
            return selection(SelectionRule.featureFlag(null));
        }

        public Builder<S> usingFeatureFlag(String flagName) {
            return selection(SelectionRule.featureFlag(flagName));
        }

        public Builder<S> usingConfigurationKey() {
            return selection(SelectionRule.configurationValue(null));
        }

        public Builder<S> usingConfigurationKey(String configurationKey) {
            return selection(SelectionRule.configurationValue(configurationKey));
        }

        public Builder<S> usingVariantFlag() {
            return selection(SelectionRule.variantFlag(null));
        }

        public Builder<S> usingVariantFlag(String flagName) {
            return selection(SelectionRule.variantFlag(flagName));
        }

        public Builder<S> usingStickyRouting() {
            return selection(SelectionRule.stickyRouting(null));
        }

        public Builder<S> usingStickyRouting(String selectorName) {
            return selection(SelectionRule.stickyRouting(selectorName));
        }

        /**
         * Custom Selection Mode 사용.
         *
         * @param modeIdentifier 등록된 Provider 식별자
         * @param selectorName Provider에 전달할 이름 (null이면 Provider 기본값)
         * @return this
         */
        public Builder<S> usingCustomMode(String modeIdentifier, String selectorName) {
            return selection(SelectionRule.custom(modeIdentifier, selectorName));
        }

        public Builder<S> selection(SelectionRule rule) {
            if (rule == null) {
                throw new IllegalArgumentException("selectionRule cannot be null");
            }
            this.selectionRule = rule;
            return this;
        }

        public Builder<S> onErrorThrow() {
            return onError(ErrorPolicy.throwing());
        }

        public Builder<S> onErrorRedirectAndReplayDefault() {
            return onError(ErrorPolicy.redirectAndReplayDefault());
        }

        public Builder<S> onErrorRedirectAndReplayAny() {
            return onError(ErrorPolicy.redirectAndReplayAny());
        }

        public Builder<S> onErrorRedirectAndReplay(String fallbackKey) {
            return onError(ErrorPolicy.redirectAndReplay(fallbackKey));
        }

        public Builder<S> onErrorRedirectAndReplayOrdered(String... fallbackKeys) {
            if (fallbackKeys == null) {
                throw new IllegalArgumentException("fallbackKeys cannot be null");
            }
            return onError(ErrorPolicy.redirectAndReplayOrdered(Arrays.asList(fallbackKeys)));
        }

        public Builder<S> onError(ErrorPolicy policy) {
            if (policy == null) {
                throw new IllegalArgumentException("errorPolicy cannot be null");
            }
            this.errorPolicy = policy;
            return this;
        }

        public Builder<S> activeFrom(Instant activeFrom) {
            this.activationWindow = activationWindow.withActiveFrom(activeFrom);
            return this;
        }

        public Builder<S> activeUntil(Instant activeUntil) {
            this.activationWindow = activationWindow.withActiveUntil(activeUntil);
            return this;
        }

        /**
         * 사용자 정의 활성화 조건. 시간 구간과 AND로 결합됩니다.
         */
        public Builder<S> activeWhen(ActivationPredicate predicate) {
            this.activationPredicate = predicate;
            return this;
        }

        public Builder<S> metadata(String key, String value) {
            if (key == null || value == null) {
                throw new IllegalArgumentException("metadata key and value cannot be null");
            }
            metadata.put(key, value);
            return this;
        }

        public ExperimentDefinition<S> build() {
            return new ExperimentDefinition<>(this);
        }
    }
}
