package com.ryuqq.experiment.core.policy;

import java.util.List;

/**
 * 선택된 Trial 실패 시 기본 Trial로 정확히 한 번 재시도.
 *
 * <p>기본 Trial도 실패하면 기본 Trial의 예외가 전파됩니다.
 * 선택된 Trial이 이미 기본 Trial이면 재시도하지 않습니다.</p>
 *
 * @author Experiment Dispatch Team
 * @since 1.0.0
 */
public record RedirectAndReplayDefault() implements ErrorPolicy {

    static final RedirectAndReplayDefault INSTANCE = new RedirectAndReplayDefault();

    @Override
    public List<String> candidateKeys(String preferredKey, String defaultKey, List<String> trialKeys) {
        if (preferredKey.equals(defaultKey)) {
            return List.of(preferredKey);
        }
        return List.of(preferredKey, defaultKey);
    }

    @Override
    public String policyName() {
        return "RedirectAndReplayDefault";
    }
}
