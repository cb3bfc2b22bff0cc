package com.ryuqq.experiment.core.policy;

import java.util.List;

/**
 * 재시도 없음. 선택된 Trial의 예외를 그대로 전파합니다.
 *
 * @author Experiment Dispatch Team
 * @since 1.0.0
 */
public record Throw() implements ErrorPolicy {

    static final Throw INSTANCE = new Throw();

    @Override
    public List<String> candidateKeys(String preferredKey, String defaultKey, List<String> trialKeys) {
        return List.of(preferredKey);
    }

    @Override
    public String policyName() {
        return "Throw";
    }
}
