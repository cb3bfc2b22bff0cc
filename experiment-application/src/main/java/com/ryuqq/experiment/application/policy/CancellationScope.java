package com.ryuqq.experiment.application.policy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 호출 한 건의 취소 범위.
 *
 * <p>현재 진행 중인 시도의 Stage를 추적하다가 호출자가 취소하면 그 Stage들에 취소를 전달합니다.
 * 취소된 이후에는 {@link ErrorPolicyExecutor}가 다음 Fallback 시도를 시작하지 않습니다.</p>
 *
 * <p>Trial 자체가 {@link java.util.concurrent.CancellationException}으로 실패한 경우
 * (예: Timeout Decorator가 원본을 취소) 이 Scope는 취소 상태가 되지 않으므로
 * 정책상 일반 실패로 처리됩니다.</p>
 *
 * @author Experiment Dispatch Team
 * @since 1.0.0
 */
public final class CancellationScope {

    private static final Logger log = LoggerFactory.getLogger(CancellationScope.class);

    private final Set<CompletionStage<?>> inFlight = ConcurrentHashMap.newKeySet();
    private volatile boolean cancelled;

    /**
     * 시도 중인 Stage 등록. 완료되면 자동으로 제거됩니다.
     *
     * <p>이미 취소된 Scope에 등록하면 즉시 취소를 전달합니다.</p>
     *
     * @param stage 추적할 Stage
     */
    public void track(CompletionStage<?> stage) {
        if (stage == null) {
            return;
        }
        inFlight.add(stage);
        stage.whenComplete((value, error) -> inFlight.remove(stage));
        if (cancelled) {
            cancelStage(stage);
        }
    }

    /**
     * 호출자 취소.
     */
    public void cancel() {
        cancelled = true;
        for (CompletionStage<?> stage : inFlight) {
            cancelStage(stage);
        }
    }

    public boolean isCancelled() {
        return cancelled;
    }

    private static void cancelStage(CompletionStage<?> stage) {
        try {
            stage.toCompletableFuture().cancel(true);
        } catch (UnsupportedOperationException e) {
            log.debug("Stage {} does not support cancellation", stage.getClass().getName(), e);
        }
    }
}
