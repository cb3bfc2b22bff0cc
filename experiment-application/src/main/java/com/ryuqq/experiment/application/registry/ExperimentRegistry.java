package com.ryuqq.experiment.application.registry;

import com.ryuqq.experiment.application.activation.ActivationGate;
import com.ryuqq.experiment.application.decorator.DecoratorChain;
import com.ryuqq.experiment.application.selection.BooleanFeatureFlagSelectionProvider;
import com.ryuqq.experiment.application.selection.ConfigurationValueSelectionProvider;
import com.ryuqq.experiment.application.selection.SelectionModeEvaluator;
import com.ryuqq.experiment.application.selection.StickyRoutingSelectionProvider;
import com.ryuqq.experiment.application.selection.VariantFlagSelectionProvider;
import com.ryuqq.experiment.core.context.ResolutionContext;
import com.ryuqq.experiment.core.decorator.ExperimentDecorator;
import com.ryuqq.experiment.core.decorator.ExperimentDecoratorFactory;
import com.ryuqq.experiment.core.exception.ExperimentConfigurationException;
import com.ryuqq.experiment.core.exception.ValidationFinding;
import com.ryuqq.experiment.core.model.ExperimentDefinition;
import com.ryuqq.experiment.core.model.SelectionMode;
import com.ryuqq.experiment.core.model.SelectionRule;
import com.ryuqq.experiment.core.naming.DefaultNamingConvention;
import com.ryuqq.experiment.core.naming.NamingConvention;
import com.ryuqq.experiment.core.spi.AuditSink;
import com.ryuqq.experiment.core.spi.ConfigurationSource;
import com.ryuqq.experiment.core.spi.FeatureFlagSource;
import com.ryuqq.experiment.core.spi.KillSwitchProvider;
import com.ryuqq.experiment.core.spi.SelectionModeProvider;
import com.ryuqq.experiment.core.spi.SubjectIdentityProvider;
import com.ryuqq.experiment.core.spi.VariantFlagSource;
import com.ryuqq.experiment.core.spi.noop.NoOpAuditSink;
import com.ryuqq.experiment.core.spi.noop.NoOpKillSwitchProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Experiment Registry.
 *
 * <p>서비스 타입 → {@link ExperimentRegistration}의 불변 Map입니다. {@link Builder#build()}에서
 * 한 번 만들어지며, 이후 호출 경로의 모든 조회는 잠금 없이 동시에 수행됩니다.</p>
 *
 * <p><strong>빌드 시 수행:</strong></p>
 * <ol>
 *   <li>설정된 입력 소스로 내장 Selection Provider 구성</li>
 *   <li>모든 정의 검증 ({@link ExperimentValidator}), 오류가 있으면 전부 모아
 *       {@link ExperimentConfigurationException}</li>
 *   <li>Decorator Factory를 등록 순서대로 적용하여 {@link DecoratorChain} 생성</li>
 *   <li>정의마다 Provider와 Selector 이름을 확정하여 Registration 생성</li>
 * </ol>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * ExperimentRegistry registry = ExperimentRegistry.builder()
 *     .featureFlagSource(flags)
 *     .killSwitchProvider(killSwitch)
 *     .auditSink(auditSink)
 *     .add(checkoutExperiment)
 *     .build();
 * }</pre>
 *
 * @author Experiment Dispatch Team
 * @since 1.0.0
 */
public final class ExperimentRegistry {

    private static final Logger log = LoggerFactory.getLogger(ExperimentRegistry.class);

    private final Map<Class<?>, ExperimentRegistration<?>> registrations;
    private final List<ExperimentRegistration<?>> orderedRegistrations;
    private final SelectionModeEvaluator selectionEvaluator;
    private final ActivationGate activationGate;
    private final DecoratorChain decoratorChain;
    private final KillSwitchProvider killSwitchProvider;
    private final AuditSink auditSink;
    private final NamingConvention namingConvention;
    private final ResolutionContext resolutionContext;
    private final Clock clock;

    private ExperimentRegistry(
            List<ExperimentRegistration<?>> orderedRegistrations,
            SelectionModeEvaluator selectionEvaluator,
            DecoratorChain decoratorChain,
            Builder builder) {
        Map<Class<?>, ExperimentRegistration<?>> byType = new LinkedHashMap<>();
        for (ExperimentRegistration<?> registration : orderedRegistrations) {
            byType.put(registration.getServiceType(), registration);
        }
        this.registrations = Map.copyOf(byType);
        this.orderedRegistrations = List.copyOf(orderedRegistrations);
        this.selectionEvaluator = selectionEvaluator;
        this.activationGate = new ActivationGate(builder.clock);
        this.decoratorChain = decoratorChain;
        this.killSwitchProvider = builder.killSwitchProvider;
        this.auditSink = builder.auditSink;
        this.namingConvention = builder.namingConvention;
        this.resolutionContext = builder.resolutionContext;
        this.clock = builder.clock;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 서비스 타입으로 Registration 조회.
     *
     * @param serviceType 서비스 인터페이스 타입
     * @param <S> 서비스 타입
     * @return Registration (등록되지 않았으면 empty)
     */
    public <S> Optional<ExperimentRegistration<S>> find(Class<S> serviceType) {
        ExperimentRegistration<?> registration = registrations.get(serviceType);
        return registration == null ? Optional.empty() : Optional.of(narrow(registration, serviceType));
    }

    /**
     * 서비스 타입으로 Registration 조회.
     *
     * @param serviceType 서비스 인터페이스 타입
     * @param <S> 서비스 타입
     * @return Registration
     * @throws IllegalArgumentException 등록되지 않은 타입인 경우
     */
    public <S> ExperimentRegistration<S> getRegistration(Class<S> serviceType) {
        return find(serviceType).orElseThrow(() -> new IllegalArgumentException(
            "No experiment registered for " + (serviceType == null ? "null" : serviceType.getName())));
    }

    public boolean isRegistered(Class<?> serviceType) {
        return registrations.containsKey(serviceType);
    }

    // registrations는 getServiceType()을 Key로 저장하므로 Key와 타입 인자가 항상 일치
    private static <S> ExperimentRegistration<S> narrow(ExperimentRegistration<?> registration, Class<S> serviceType) {
        if (registration.getServiceType() != serviceType) {
            throw new IllegalStateException("Registration for " + registration.getServiceType().getName()
                + " stored under " + serviceType.getName());
        }
        return (ExperimentRegistration<S>) registration;
    }

    /**
     * 등록 순서의 Registration 목록.
     *
     * @return 불변 List
     */
    public List<ExperimentRegistration<?>> getRegistrations() {
        return orderedRegistrations;
    }

    public int size() {
        return orderedRegistrations.size();
    }

    public SelectionModeEvaluator getSelectionEvaluator() {
        return selectionEvaluator;
    }

    public ActivationGate getActivationGate() {
        return activationGate;
    }

    public DecoratorChain getDecoratorChain() {
        return decoratorChain;
    }

    public KillSwitchProvider getKillSwitchProvider() {
        return killSwitchProvider;
    }

    public AuditSink getAuditSink() {
        return auditSink;
    }

    public NamingConvention getNamingConvention() {
        return namingConvention;
    }

    /**
     * 호출자가 별도로 지정하지 않았을 때 사용하는 Resolution Context.
     *
     * @return 루트 ResolutionContext
     */
    public ResolutionContext getResolutionContext() {
        return resolutionContext;
    }

    public Clock getClock() {
        return clock;
    }

    /**
     * ExperimentRegistry Builder.
     *
     * <p>Builder 자체는 thread-safe하지 않습니다. 애플리케이션 시작 시 한 스레드에서 사용하십시오.</p>
     */
    public static final class Builder {

        private final List<ExperimentDefinition<?>> definitions = new ArrayList<>();
        private final List<SelectionModeProvider> customProviders = new ArrayList<>();
        private final List<ExperimentDecoratorFactory> decoratorFactories = new ArrayList<>();
        private NamingConvention namingConvention = new DefaultNamingConvention();
        private Clock clock = Clock.systemUTC();
        private FeatureFlagSource featureFlagSource;
        private VariantFlagSource variantFlagSource;
        private ConfigurationSource configurationSource;
        private SubjectIdentityProvider subjectIdentityProvider;
        private KillSwitchProvider killSwitchProvider = new NoOpKillSwitchProvider();
        private AuditSink auditSink = new NoOpAuditSink();
        private ResolutionContext resolutionContext = ResolutionContext.empty();

        private Builder() {
        }

        public Builder add(ExperimentDefinition<?> definition) {
            definitions.add(requireNonNull(definition, "definition"));
            return this;
        }

        public Builder addAll(List<? extends ExperimentDefinition<?>> definitions) {
            requireNonNull(definitions, "definitions").forEach(this::add);
            return this;
        }

        public Builder namingConvention(NamingConvention namingConvention) {
            this.namingConvention = requireNonNull(namingConvention, "namingConvention");
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = requireNonNull(clock, "clock");
            return this;
        }

        public Builder featureFlagSource(FeatureFlagSource featureFlagSource) {
            this.featureFlagSource = requireNonNull(featureFlagSource, "featureFlagSource");
            return this;
        }

        public Builder variantFlagSource(VariantFlagSource variantFlagSource) {
            this.variantFlagSource = requireNonNull(variantFlagSource, "variantFlagSource");
            return this;
        }

        public Builder configurationSource(ConfigurationSource configurationSource) {
            this.configurationSource = requireNonNull(configurationSource, "configurationSource");
            return this;
        }

        public Builder subjectIdentityProvider(SubjectIdentityProvider subjectIdentityProvider) {
            this.subjectIdentityProvider = requireNonNull(subjectIdentityProvider, "subjectIdentityProvider");
            return this;
        }

        /**
         * Custom Selection Mode Provider 등록.
         */
        public Builder selectionModeProvider(SelectionModeProvider provider) {
            customProviders.add(requireNonNull(provider, "selectionModeProvider"));
            return this;
        }

        /**
         * Decorator Factory 등록. 등록 순서가 Chain의 바깥에서 안쪽 순서입니다.
         */
        public Builder decoratorFactory(ExperimentDecoratorFactory factory) {
            decoratorFactories.add(requireNonNull(factory, "decoratorFactory"));
            return this;
        }

        public Builder decoratorFactories(List<? extends ExperimentDecoratorFactory> factories) {
            requireNonNull(factories, "decoratorFactories").forEach(this::decoratorFactory);
            return this;
        }

        public Builder killSwitchProvider(KillSwitchProvider killSwitchProvider) {
            this.killSwitchProvider = requireNonNull(killSwitchProvider, "killSwitchProvider");
            return this;
        }

        public Builder auditSink(AuditSink auditSink) {
            this.auditSink = requireNonNull(auditSink, "auditSink");
            return this;
        }

        public Builder resolutionContext(ResolutionContext resolutionContext) {
            this.resolutionContext = requireNonNull(resolutionContext, "resolutionContext");
            return this;
        }

        /**
         * Registry 빌드.
         *
         * @return 불변 Registry
         * @throws ExperimentConfigurationException 설정 오류가 하나 이상 있는 경우
         */
        public ExperimentRegistry build() {
            SelectionModeEvaluator evaluator = new SelectionModeEvaluator(builtInProviders(), customProviderMap());

            List<ValidationFinding> findings = new ArrayList<>(
                new ExperimentValidator().validate(definitions, customProviders, evaluator));
            List<ExperimentDecorator> decorators = createDecorators(findings);

            if (!findings.isEmpty()) {
                ExperimentConfigurationException exception = new ExperimentConfigurationException(findings);
                log.error("Experiment registry build failed: {}", exception.getMessage());
                throw exception;
            }

            List<ExperimentRegistration<?>> registrations = new ArrayList<>(definitions.size());
            for (ExperimentDefinition<?> definition : definitions) {
                registrations.add(register(definition, evaluator));
            }

            ExperimentRegistry registry =
                new ExperimentRegistry(registrations, evaluator, new DecoratorChain(decorators), this);
            log.info("Experiment registry built: {} experiment(s), {} decorator(s), kill switch: {}",
                registry.size(), decorators.size(), killSwitchProvider.getClass().getSimpleName());
            for (ExperimentRegistration<?> registration : registrations) {
                log.debug("Registered {}", registration);
            }
            return registry;
        }

        private <S> ExperimentRegistration<S> register(ExperimentDefinition<S> definition, SelectionModeEvaluator evaluator) {
            SelectionRule rule = definition.getSelectionRule();
            SelectionModeProvider provider = evaluator.providerFor(rule)
                .orElseThrow(() -> new IllegalStateException("validated provider missing for " + definition.getName()));
            String selectorName = rule.hasSelectorName()
                ? rule.selectorName()
                : provider.defaultSelectorName(definition.getServiceType(), namingConvention);
            return new ExperimentRegistration<>(definition, provider, selectorName);
        }

        private Map<SelectionMode, SelectionModeProvider> builtInProviders() {
            Map<SelectionMode, SelectionModeProvider> providers = new EnumMap<>(SelectionMode.class);
            if (featureFlagSource != null) {
                providers.put(SelectionMode.BOOLEAN_FEATURE_FLAG, new BooleanFeatureFlagSelectionProvider(featureFlagSource));
            }
            if (configurationSource != null) {
                providers.put(SelectionMode.CONFIGURATION_VALUE, new ConfigurationValueSelectionProvider(configurationSource));
            }
            if (variantFlagSource != null) {
                providers.put(SelectionMode.VARIANT_FLAG, new VariantFlagSelectionProvider(variantFlagSource));
            }
            if (subjectIdentityProvider != null) {
                providers.put(SelectionMode.STICKY_ROUTING, new StickyRoutingSelectionProvider(subjectIdentityProvider));
            }
            return providers;
        }

        private Map<String, SelectionModeProvider> customProviderMap() {
            Map<String, SelectionModeProvider> providers = new HashMap<>();
            for (SelectionModeProvider provider : customProviders) {
                String identifier = provider.modeIdentifier();
                if (identifier != null && !identifier.isBlank()) {
                    providers.putIfAbsent(identifier, provider);
                }
            }
            return providers;
        }

        private List<ExperimentDecorator> createDecorators(List<ValidationFinding> findings) {
            List<ExperimentDecorator> decorators = new ArrayList<>(decoratorFactories.size());
            for (ExperimentDecoratorFactory factory : decoratorFactories) {
                String factoryName = factory.getClass().getName();
                try {
                    ExperimentDecorator decorator = factory.create(resolutionContext);
                    if (decorator == null) {
                        findings.add(new ValidationFinding(null, "Decorator factory " + factoryName + " returned null"));
                    } else {
                        decorators.add(decorator);
                    }
                } catch (RuntimeException e) {
                    log.error("Decorator factory {} failed", factoryName, e);
                    findings.add(new ValidationFinding(null,
                        "Decorator factory " + factoryName + " failed: " + e.getMessage()));
                }
            }
            return decorators;
        }

        private static <T> T requireNonNull(T value, String name) {
            if (value == null) {
                throw new IllegalArgumentException(name + " cannot be null");
            }
            return value;
        }
    }
}
