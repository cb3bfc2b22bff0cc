package com.ryuqq.experiment.core.policy;

import java.util.ArrayList;
import java.util.List;

/**
 * 선택된 Trial 실패 시 나머지 Trial을 등록 순서대로 시도.
 *
 * <p>첫 성공에서 멈추며, 모두 실패하면 마지막으로 시도한 Trial의 예외가 전파됩니다.</p>
 *
 * @author Experiment Dispatch Team
 * @since 1.0.0
 */
public record RedirectAndReplayAny() implements ErrorPolicy {

    static final RedirectAndReplayAny INSTANCE = new RedirectAndReplayAny();

    @Override
    public List<String> candidateKeys(String preferredKey, String defaultKey, List<String> trialKeys) {
        List<String> candidates = new ArrayList<>(trialKeys.size());
        candidates.add(preferredKey);
        for (String key : trialKeys) {
            if (!key.equals(preferredKey)) {
                candidates.add(key);
            }
        }
        return List.copyOf(candidates);
    }

    @Override
    public String policyName() {
        return "RedirectAndReplayAny";
    }
}
