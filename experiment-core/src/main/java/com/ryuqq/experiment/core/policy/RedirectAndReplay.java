package com.ryuqq.experiment.core.policy;

import java.util.List;

/**
 * 선택된 Trial 실패 시 지정된 Trial로 한 번 재시도.
 *
 * @param fallbackKey 재시도할 Trial Key (등록된 Trial이어야 함, Registry 빌드 시 검증)
 *
 * @author Experiment Dispatch Team
 * @since 1.0.0
 */
public record RedirectAndReplay(String fallbackKey) implements ErrorPolicy {

    public RedirectAndReplay {
        if (fallbackKey == null || fallbackKey.isEmpty()) {
            throw new IllegalArgumentException("fallbackKey cannot be null or empty");
        }
    }

    @Override
    public List<String> candidateKeys(String preferredKey, String defaultKey, List<String> trialKeys) {
        if (preferredKey.equals(fallbackKey)) {
            return List.of(preferredKey);
        }
        return List.of(preferredKey, fallbackKey);
    }

    @Override
    public String policyName() {
        return "RedirectAndReplay";
    }
}
