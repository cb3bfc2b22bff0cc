package com.ryuqq.experiment.application.selection;

import com.ryuqq.experiment.core.context.RoutingReason;
import com.ryuqq.experiment.core.model.SelectionMode;
import com.ryuqq.experiment.core.model.SelectionRule;
import com.ryuqq.experiment.core.spi.SelectionContext;
import com.ryuqq.experiment.core.spi.SelectionModeProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;

/**
 * Selection Mode Evaluator.
 *
 * <p>Experiment의 선택 규칙에 맞는 Provider를 찾고, 호출마다 Trial Key를 계산합니다.</p>
 *
 * <p><strong>보장:</strong> {@link #evaluate}는 호출자에게 예외를 던지지 않습니다.</p>
 * <ul>
 *   <li>Provider가 empty 반환 → 기본 Trial ({@link RoutingReason#SELECTED})</li>
 *   <li>Provider 예외 → 기본 Trial ({@link RoutingReason#SELECTION_FAILED}) + WARN 로그</li>
 *   <li>등록되지 않은 Key 반환 → 기본 Trial ({@link RoutingReason#UNKNOWN_TRIAL}) + WARN 로그</li>
 * </ul>
 *
 * <p>Provider 목록은 생성 시점에 고정되므로 평가 경로에 잠금이 없습니다.</p>
 *
 * @author Experiment Dispatch Team
 * @since 1.0.0
 */
public final class SelectionModeEvaluator {

    private static final Logger log = LoggerFactory.getLogger(SelectionModeEvaluator.class);

    private final Map<SelectionMode, SelectionModeProvider> builtInProviders;
    private final Map<String, SelectionModeProvider> customProviders;

    /**
     * 생성자.
     *
     * @param builtInProviders 설정된 내장 모드 Provider (소스가 없는 모드는 생략)
     * @param customProviders 식별자 → Custom Provider
     * @throws IllegalArgumentException 인자가 null이거나 CUSTOM 키가 내장 Map에 포함된 경우
     */
    public SelectionModeEvaluator(
            Map<SelectionMode, SelectionModeProvider> builtInProviders,
            Map<String, SelectionModeProvider> customProviders) {
        if (builtInProviders == null || customProviders == null) {
            throw new IllegalArgumentException("provider maps cannot be null");
        }
        if (builtInProviders.containsKey(SelectionMode.CUSTOM)) {
            throw new IllegalArgumentException("CUSTOM mode providers must be registered by identifier");
        }
        this.builtInProviders = Map.copyOf(builtInProviders);
        this.customProviders = Map.copyOf(customProviders);
    }

    /**
     * 선택 규칙에 해당하는 Provider 조회 (Registry 빌드 시점에 사용).
     *
     * @param rule 선택 규칙
     * @return Provider (설정되지 않았으면 empty)
     */
    public Optional<SelectionModeProvider> providerFor(SelectionRule rule) {
        if (rule.mode() == SelectionMode.CUSTOM) {
            return Optional.ofNullable(customProviders.get(rule.modeIdentifier()));
        }
        return Optional.ofNullable(builtInProviders.get(rule.mode()));
    }

    /**
     * Trial Key 계산.
     *
     * @param provider Registry 빌드 시 결정된 Provider
     * @param context 선택 입력
     * @return 항상 등록된 Trial Key를 담은 결과
     */
    public SelectionResult evaluate(SelectionModeProvider provider, SelectionContext context) {
        Optional<String> selected;
        try {
            selected = provider.selectTrialKey(context);
        } catch (RuntimeException e) {
            log.warn("Selection provider '{}' failed for {} (selector: {}), routing to default trial '{}'",
                provider.modeIdentifier(), context.serviceType().getName(), context.selectorName(),
                context.defaultKey(), e);
            return new SelectionResult(context.defaultKey(), RoutingReason.SELECTION_FAILED);
        }

        if (selected == null || selected.isEmpty()) {
            return SelectionResult.selected(context.defaultKey());
        }

        String key = selected.get();
        if (!context.trialKeys().contains(key)) {
            log.warn("Selection provider '{}' returned unknown trial key '{}' for {}, routing to default trial '{}'",
                provider.modeIdentifier(), key, context.serviceType().getName(), context.defaultKey());
            return new SelectionResult(context.defaultKey(), RoutingReason.UNKNOWN_TRIAL);
        }
        return SelectionResult.selected(key);
    }
}
