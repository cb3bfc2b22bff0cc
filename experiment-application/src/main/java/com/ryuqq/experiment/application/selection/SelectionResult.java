package com.ryuqq.experiment.application.selection;

import com.ryuqq.experiment.core.context.RoutingReason;

/**
 * Selection Mode 평가 결과.
 *
 * @param trialKey 실행할 Trial Key (항상 등록된 Key)
 * @param reason {@link RoutingReason#SELECTED}, {@link RoutingReason#SELECTION_FAILED},
 *               {@link RoutingReason#UNKNOWN_TRIAL} 중 하나
 *
 * @author Experiment Dispatch Team
 * @since 1.0.0
 */
public record SelectionResult(String trialKey, RoutingReason reason) {

    public SelectionResult {
        if (trialKey == null || trialKey.isEmpty()) {
            throw new IllegalArgumentException("trialKey cannot be null or empty");
        }
        if (reason == null) {
            throw new IllegalArgumentException("reason cannot be null");
        }
    }

    public static SelectionResult selected(String trialKey) {
        return new SelectionResult(trialKey, RoutingReason.SELECTED);
    }

    /**
     * 평가에 실패했는지 확인 (기본 Trial로 대체된 경우).
     *
     * @return SELECTION_FAILED 또는 UNKNOWN_TRIAL 이면 true
     */
    public boolean isRecovered() {
        return reason != RoutingReason.SELECTED;
    }
}
