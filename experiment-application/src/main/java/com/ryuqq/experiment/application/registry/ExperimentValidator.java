package com.ryuqq.experiment.application.registry;

import com.ryuqq.experiment.application.selection.SelectionModeEvaluator;
import com.ryuqq.experiment.core.exception.ValidationFinding;
import com.ryuqq.experiment.core.model.ExperimentDefinition;
import com.ryuqq.experiment.core.model.SelectionMode;
import com.ryuqq.experiment.core.model.SelectionRule;
import com.ryuqq.experiment.core.model.TrialDefinition;
import com.ryuqq.experiment.core.policy.ErrorPolicy;
import com.ryuqq.experiment.core.policy.RedirectAndReplay;
import com.ryuqq.experiment.core.policy.RedirectAndReplayAny;
import com.ryuqq.experiment.core.policy.RedirectAndReplayOrdered;
import com.ryuqq.experiment.core.spi.SelectionModeProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Registry 빌드 시점 설정 검증기.
 *
 * <p>첫 오류에서 멈추지 않고 모든 오류를 {@link ValidationFinding}으로 모아 반환합니다.
 * 호출 시점의 동작에는 관여하지 않습니다.</p>
 *
 * <p><strong>오류 (빌드 실패):</strong></p>
 * <ul>
 *   <li>Custom Selection Provider 식별자 누락 / 중복</li>
 *   <li>서비스 타입 중복 등록, Experiment 이름 중복</li>
 *   <li>Trial 없음, Trial Key 중복, 기본 Trial 개수가 1이 아님</li>
 *   <li>등록되지 않은 Custom 모드 식별자, 내장 모드의 입력 소스 미설정</li>
 *   <li>Fallback 정책이 등록되지 않은 Trial Key를 참조</li>
 * </ul>
 *
 * <p><strong>경고 (WARN 로그만):</strong> Trial이 하나뿐인 RedirectAndReplayAny,
 * {@code "true"} / {@code "false"} Trial이 없는 BooleanFeatureFlag.</p>
 *
 * @author Experiment Dispatch Team
 * @since 1.0.0
 */
public final class ExperimentValidator {

    private static final Logger log = LoggerFactory.getLogger(ExperimentValidator.class);

    /**
     * 정의 목록 검증.
     *
     * @param definitions 등록 순서의 정의
     * @param customProviders 등록된 Custom Selection Provider (등록 순서)
     * @param evaluator 내장 / Custom Provider 조회용
     * @return 발견된 오류 (없으면 빈 List)
     */
    public List<ValidationFinding> validate(
            List<ExperimentDefinition<?>> definitions,
            List<SelectionModeProvider> customProviders,
            SelectionModeEvaluator evaluator) {
        List<ValidationFinding> findings = new ArrayList<>();

        validateCustomProviders(customProviders, findings);

        Set<Class<?>> serviceTypes = new HashSet<>();
        Set<String> names = new HashSet<>();
        for (ExperimentDefinition<?> definition : definitions) {
            String name = definition.getName();
            if (!serviceTypes.add(definition.getServiceType())) {
                findings.add(new ValidationFinding(name,
                    "Service type " + definition.getServiceType().getName() + " is registered more than once"));
            }
            if (!names.add(name)) {
                findings.add(new ValidationFinding(name, "Experiment name is used more than once"));
            }
            validateTrials(definition, findings);
            validateSelection(definition, evaluator, findings);
            validateErrorPolicy(definition, findings);
        }
        return findings;
    }

    private void validateCustomProviders(List<SelectionModeProvider> customProviders, List<ValidationFinding> findings) {
        Set<String> identifiers = new HashSet<>();
        for (SelectionModeProvider provider : customProviders) {
            String identifier = provider.modeIdentifier();
            if (identifier == null || identifier.isBlank()) {
                findings.add(new ValidationFinding(null,
                    "Selection mode provider " + provider.getClass().getName() + " has no mode identifier"));
            } else if (!identifiers.add(identifier)) {
                findings.add(new ValidationFinding(null,
                    "Selection mode '" + identifier + "' is registered more than once"));
            }
        }
    }

    private void validateTrials(ExperimentDefinition<?> definition, List<ValidationFinding> findings) {
        String name = definition.getName();
        List<? extends TrialDefinition<?>> trials = definition.getTrials();
        if (trials.isEmpty()) {
            findings.add(new ValidationFinding(name, "No trials registered"));
            return;
        }

        Set<String> keys = new HashSet<>();
        List<String> defaults = new ArrayList<>();
        for (TrialDefinition<?> trial : trials) {
            if (!keys.add(trial.getKey())) {
                findings.add(new ValidationFinding(name,
                    "Trial key '" + trial.getKey() + "' is registered more than once"));
            }
            if (trial.isDefault()) {
                defaults.add(trial.getKey());
            }
        }

        if (defaults.isEmpty()) {
            findings.add(new ValidationFinding(name, "No trial is marked as default"));
        } else if (defaults.size() > 1) {
            findings.add(new ValidationFinding(name,
                "Exactly one default trial is required, found " + defaults.size() + ": " + defaults));
        }
    }

    private void validateSelection(
            ExperimentDefinition<?> definition,
            SelectionModeEvaluator evaluator,
            List<ValidationFinding> findings) {
        SelectionRule rule = definition.getSelectionRule();
        if (evaluator.providerFor(rule).isEmpty()) {
            String message = rule.mode() == SelectionMode.CUSTOM
                ? "Custom selection mode '" + rule.modeIdentifier() + "' is not registered"
                : "Selection mode '" + rule.modeIdentifier() + "' requires a " + requiredSource(rule.mode())
                    + " but none is configured";
            findings.add(new ValidationFinding(definition.getName(), message));
        }

        if (rule.mode() == SelectionMode.BOOLEAN_FEATURE_FLAG) {
            List<String> keys = definition.getTrialKeys();
            if (!keys.contains("true") && !keys.contains("false")) {
                log.warn("Experiment '{}' uses BooleanFeatureFlag but registers neither a 'true' nor a 'false' trial; "
                    + "every call will use the default trial", definition.getName());
            }
        }
    }

    private void validateErrorPolicy(ExperimentDefinition<?> definition, List<ValidationFinding> findings) {
        ErrorPolicy policy = definition.getErrorPolicy();
        List<String> keys = definition.getTrialKeys();

        if (policy instanceof RedirectAndReplay redirect) {
            requireTrial(definition, redirect.fallbackKey(), findings);
        } else if (policy instanceof RedirectAndReplayOrdered ordered) {
            for (String fallbackKey : ordered.fallbackKeys()) {
                requireTrial(definition, fallbackKey, findings);
            }
        } else if (policy instanceof RedirectAndReplayAny && keys.size() == 1) {
            log.warn("Experiment '{}' uses RedirectAndReplayAny with a single trial; failures will not be redirected",
                definition.getName());
        }
    }

    private void requireTrial(ExperimentDefinition<?> definition, String key, List<ValidationFinding> findings) {
        if (!definition.getTrialKeys().contains(key)) {
            findings.add(new ValidationFinding(definition.getName(),
                definition.getErrorPolicy().policyName() + " references unknown trial '" + key + "'"));
        }
    }

    private static String requiredSource(SelectionMode mode) {
        return switch (mode) {
            case BOOLEAN_FEATURE_FLAG -> "FeatureFlagSource";
            case CONFIGURATION_VALUE -> "ConfigurationSource";
            case VARIANT_FLAG -> "VariantFlagSource";
            case STICKY_ROUTING -> "SubjectIdentityProvider";
            case CUSTOM -> "SelectionModeProvider";
        };
    }
}
