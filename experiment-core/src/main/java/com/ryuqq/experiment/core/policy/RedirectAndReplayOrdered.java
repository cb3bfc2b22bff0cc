package com.ryuqq.experiment.core.policy;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 선택된 Trial 실패 시 지정된 Trial 목록을 순서대로 시도.
 *
 * <p>목록에 선택된 Trial이 포함되어 있어도 다시 시도하지 않습니다.</p>
 *
 * @param fallbackKeys 시도 순서 (비어 있으면 안 됨, Registry 빌드 시 등록 여부 검증)
 *
 * @author Experiment Dispatch Team
 * @since 1.0.0
 */
public record RedirectAndReplayOrdered(List<String> fallbackKeys) implements ErrorPolicy {

    public RedirectAndReplayOrdered {
        if (fallbackKeys == null || fallbackKeys.isEmpty()) {
            throw new IllegalArgumentException("fallbackKeys cannot be null or empty");
        }
        for (String key : fallbackKeys) {
            if (key == null || key.isEmpty()) {
                throw new IllegalArgumentException("fallbackKeys cannot contain null or empty keys");
            }
        }
        fallbackKeys = List.copyOf(fallbackKeys);
    }

    @Override
    public List<String> candidateKeys(String preferredKey, String defaultKey, List<String> trialKeys) {
        Set<String> candidates = new LinkedHashSet<>();
        candidates.add(preferredKey);
        candidates.addAll(fallbackKeys);
        return List.copyOf(candidates);
    }

    @Override
    public String policyName() {
        return "RedirectAndReplayOrdered";
    }
}
