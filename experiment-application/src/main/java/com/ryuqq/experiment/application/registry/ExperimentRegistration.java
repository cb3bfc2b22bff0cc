package com.ryuqq.experiment.application.registry;

import com.ryuqq.experiment.core.context.ResolutionContext;
import com.ryuqq.experiment.core.model.ActivationWindow;
import com.ryuqq.experiment.core.model.ExperimentDefinition;
import com.ryuqq.experiment.core.model.TrialDefinition;
import com.ryuqq.experiment.core.policy.ErrorPolicy;
import com.ryuqq.experiment.core.spi.ActivationPredicate;
import com.ryuqq.experiment.core.spi.SelectionContext;
import com.ryuqq.experiment.core.spi.SelectionModeProvider;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Experiment Registration (런타임 모델).
 *
 * <p>Registry 빌드 시 정의 하나당 정확히 한 번 만들어지며 이후 변경되지 않습니다.
 * 선택 모드는 구체 Provider로, Selector 이름은 Naming Convention 적용 결과로 확정되어 있습니다.</p>
 *
 * <p>검증을 통과한 정의로만 만들어지므로 기본 Trial은 항상 정확히 하나입니다.</p>
 *
 * @param <S> 서비스 인터페이스 타입
 * @author Experiment Dispatch Team
 * @since 1.0.0
 */
public final class ExperimentRegistration<S> {

    private final ExperimentDefinition<S> definition;
    private final SelectionModeProvider selectionProvider;
    private final String selectorName;
    private final String defaultKey;
    private final List<String> trialKeys;
    private final Map<String, TrialDefinition<S>> trialsByKey;

    ExperimentRegistration(
            ExperimentDefinition<S> definition,
            SelectionModeProvider selectionProvider,
            String selectorName) {
        if (definition == null) {
            throw new IllegalArgumentException("definition cannot be null");
        }
        if (selectionProvider == null) {
            throw new IllegalArgumentException("selectionProvider cannot be null");
        }
        if (selectorName == null || selectorName.isBlank()) {
            throw new IllegalArgumentException("selectorName cannot be null or blank");
        }
        this.definition = definition;
        this.selectionProvider = selectionProvider;
        this.selectorName = selectorName;
        this.defaultKey = definition.findDefaultTrial()
            .map(TrialDefinition::getKey)
            .orElseThrow(() -> new IllegalArgumentException(
                "definition has no default trial: " + definition.getName()));
        this.trialKeys = definition.getTrialKeys();

        Map<String, TrialDefinition<S>> byKey = new LinkedHashMap<>();
        for (TrialDefinition<S> trial : definition.getTrials()) {
            byKey.put(trial.getKey(), trial);
        }
        this.trialsByKey = Collections.unmodifiableMap(byKey);
    }

    /**
     * Trial 구현체 생성.
     *
     * @param trialKey Trial Key
     * @param context 현재 호출의 Resolution Context
     * @return 구현체
     * @throws IllegalArgumentException 등록되지 않은 Key인 경우
     * @throws IllegalStateException Factory가 null을 반환한 경우
     * @throws Exception Factory가 던진 예외
     */
    public S createTrial(String trialKey, ResolutionContext context) throws Exception {
        TrialDefinition<S> trial = trialsByKey.get(trialKey);
        if (trial == null) {
            throw new IllegalArgumentException(
                "Unknown trial '" + trialKey + "' for experiment " + definition.getName());
        }
        S instance = trial.getFactory().create(context);
        if (instance == null) {
            throw new IllegalStateException(
                "Factory for trial '" + trialKey + "' of experiment " + definition.getName() + " returned null");
        }
        return instance;
    }

    /**
     * 이번 호출의 Selection 입력 생성.
     *
     * @param context 현재 호출의 Resolution Context
     * @return SelectionContext
     */
    public SelectionContext selectionContext(ResolutionContext context) {
        return new SelectionContext(getServiceType(), selectorName, trialKeys, defaultKey, context);
    }

    public boolean hasTrial(String trialKey) {
        return trialsByKey.containsKey(trialKey);
    }

    public ExperimentDefinition<S> getDefinition() {
        return definition;
    }

    public String getName() {
        return definition.getName();
    }

    public Class<S> getServiceType() {
        return definition.getServiceType();
    }

    public SelectionModeProvider getSelectionProvider() {
        return selectionProvider;
    }

    public String getSelectorName() {
        return selectorName;
    }

    public String getDefaultKey() {
        return defaultKey;
    }

    /**
     * 등록 순서의 Trial Key.
     *
     * @return 불변 List
     */
    public List<String> getTrialKeys() {
        return trialKeys;
    }

    public ErrorPolicy getErrorPolicy() {
        return definition.getErrorPolicy();
    }

    public ActivationWindow getActivationWindow() {
        return definition.getActivationWindow();
    }

    /**
     * 사용자 정의 활성화 조건.
     *
     * @return 조건 (없으면 null)
     */
    public ActivationPredicate getActivationPredicate() {
        return definition.getActivationPredicate().orElse(null);
    }

    @Override
    public String toString() {
        return "ExperimentRegistration{"
            + "name='" + getName() + '\''
            + ", serviceType=" + getServiceType().getName()
            + ", selection=" + selectionProvider.modeIdentifier() + "(" + selectorName + ")"
            + ", default='" + defaultKey + '\''
            + ", trials=" + trialKeys
            + '}';
    }
}
