package com.ryuqq.experiment.core.policy;

import java.util.List;

/**
 * 선택된 Trial 실행이 실패했을 때의 복구 규칙.
 *
 * <p>각 정책은 시도할 Trial Key 순서({@link #candidateKeys})만 정의합니다.
 * 실행 자체는 Error Policy Executor가 담당하며, 모든 정책에서 같은 Trial을 두 번 시도하지 않습니다.</p>
 *
 * <ul>
 *   <li>{@link Throw}: 선택된 Trial만 시도, 실패 시 그대로 전파</li>
 *   <li>{@link RedirectAndReplayDefault}: 실패 시 기본 Trial로 한 번 재시도</li>
 *   <li>{@link RedirectAndReplayAny}: 실패 시 나머지 Trial을 등록 순서대로 시도</li>
 *   <li>{@link RedirectAndReplay}: 실패 시 지정된 Trial로 한 번 재시도</li>
 *   <li>{@link RedirectAndReplayOrdered}: 실패 시 지정된 Trial 목록을 순서대로 시도</li>
 * </ul>
 *
 * @author Experiment Dispatch Team
 * @since 1.0.0
 */
public sealed interface ErrorPolicy
    permits Throw, RedirectAndReplayDefault, RedirectAndReplayAny, RedirectAndReplay, RedirectAndReplayOrdered {

    /**
     * 시도할 Trial Key 목록 계산.
     *
     * <p>첫 원소는 항상 {@code preferredKey}이며 중복은 없습니다.</p>
     *
     * @param preferredKey 처음 실행할 Key
     * @param defaultKey 기본 Trial Key
     * @param trialKeys 등록 순서의 전체 Trial Key
     * @return 시도 순서
     */
    List<String> candidateKeys(String preferredKey, String defaultKey, List<String> trialKeys);

    /**
     * 정책 이름 (로그, 진단용).
     *
     * @return 정책 이름
     */
    String policyName();

    static ErrorPolicy throwing() {
        return Throw.INSTANCE;
    }

    static ErrorPolicy redirectAndReplayDefault() {
        return RedirectAndReplayDefault.INSTANCE;
    }

    static ErrorPolicy redirectAndReplayAny() {
        return RedirectAndReplayAny.INSTANCE;
    }

    static ErrorPolicy redirectAndReplay(String fallbackKey) {
        return new RedirectAndReplay(fallbackKey);
    }

    static ErrorPolicy redirectAndReplayOrdered(List<String> fallbackKeys) {
        return new RedirectAndReplayOrdered(fallbackKeys);
    }
}
