package com.ryuqq.experiment.application.dispatch;

import com.ryuqq.experiment.core.context.RoutingReason;

/**
 * 호출 한 건의 라우팅 결정.
 *
 * @param selectedKey Audit에 기록되는 선택 Key
 * @param preferredKey 첫 시도에 실행할 Key
 * @param reason 라우팅 이유
 *
 * @author Experiment Dispatch Team
 * @since 1.0.0
 */
public record RoutingDecision(String selectedKey, String preferredKey, RoutingReason reason) {

    public RoutingDecision {
        if (selectedKey == null || preferredKey == null) {
            throw new IllegalArgumentException("selectedKey and preferredKey cannot be null");
        }
        if (reason == null) {
            throw new IllegalArgumentException("reason cannot be null");
        }
    }

    /**
     * Kill Switch / Gate / 선택 실패로 기본 Trial에 강제로 배정되었는지 확인.
     *
     * @return 강제 배정이면 true
     */
    public boolean isForcedToDefault() {
        return reason.isForcedToDefault();
    }
}
