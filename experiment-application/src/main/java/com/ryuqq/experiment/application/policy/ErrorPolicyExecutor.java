package com.ryuqq.experiment.application.policy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;

/**
 * Error Policy Executor.
 *
 * <p>{@link com.ryuqq.experiment.core.policy.ErrorPolicy}가 계산한 후보 Key 목록을 순서대로 시도하고
 * 첫 성공에서 멈춥니다. 각 시도는 독립된 Stage이며 Decorator Chain은 시도마다 한 번씩 감쌉니다.</p>
 *
 * <p><strong>상태 전이 (시도 i):</strong></p>
 * <ol>
 *   <li>성공 → {@link PolicyOutcome.Succeeded}</li>
 *   <li>실패 + 남은 후보 없음 → {@link PolicyOutcome.Failed} (이번 시도의 예외)</li>
 *   <li>실패 + 호출자 취소됨 → {@link PolicyOutcome.Failed} (다음 시도를 시작하지 않음)</li>
 *   <li>실패 + 남은 후보 있음 → 시도 i+1</li>
 * </ol>
 *
 * <p>동기 Trial은 호출 스레드에서 즉시 완료되므로 전체 시퀀스도 호출 스레드에서 끝납니다.
 * 비동기 Trial은 이전 시도가 완료된 스레드에서 다음 시도가 시작됩니다.</p>
 *
 * <p>Thread-safe: 상태를 갖지 않습니다.</p>
 *
 * @author Experiment Dispatch Team
 * @since 1.0.0
 */
public final class ErrorPolicyExecutor {

    private static final Logger log = LoggerFactory.getLogger(ErrorPolicyExecutor.class);

    /**
     * 후보 목록 실행.
     *
     * @param candidates 시도 순서 (비어 있을 수 없음, 중복 없음)
     * @param attemptFunction 시도 함수
     * @param scope 호출 취소 범위
     * @return 항상 정상 완료되는 결과 Stage
     * @throws IllegalArgumentException 인자가 null이거나 candidates가 비어 있는 경우
     */
    public CompletionStage<PolicyOutcome> execute(
            List<String> candidates,
            AttemptFunction attemptFunction,
            CancellationScope scope) {
        if (candidates == null || candidates.isEmpty()) {
            throw new IllegalArgumentException("candidates cannot be null or empty");
        }
        if (attemptFunction == null) {
            throw new IllegalArgumentException("attemptFunction cannot be null");
        }
        if (scope == null) {
            throw new IllegalArgumentException("scope cannot be null");
        }

        CompletableFuture<PolicyOutcome> result = new CompletableFuture<>();
        if (scope.isCancelled()) {
            result.complete(new PolicyOutcome.Failed(
                candidates.get(0), new CancellationException("Invocation cancelled before first attempt"), 0));
            return result;
        }
        attempt(0, candidates, attemptFunction, scope, result);
        return result;
    }

    private void attempt(
            int index,
            List<String> candidates,
            AttemptFunction attemptFunction,
            CancellationScope scope,
            CompletableFuture<PolicyOutcome> result) {
        String key = candidates.get(index);
        int attemptNumber = index + 1;

        CompletionStage<Object> stage;
        try {
            stage = attemptFunction.attempt(key, attemptNumber);
        } catch (Throwable e) {
            stage = CompletableFuture.failedFuture(e);
        }
        if (stage == null) {
            stage = CompletableFuture.failedFuture(
                new IllegalStateException("Attempt for trial '" + key + "' returned no stage"));
        }
        scope.track(stage);

        stage.whenComplete((value, error) -> {
            try {
                onAttemptComplete(index, candidates, attemptFunction, scope, result, value, error);
            } catch (Throwable e) {
                // result는 어떤 경우에도 완료되어야 함
                result.complete(new PolicyOutcome.Failed(key, e, attemptNumber));
            }
        });
    }

    private void onAttemptComplete(
            int index,
            List<String> candidates,
            AttemptFunction attemptFunction,
            CancellationScope scope,
            CompletableFuture<PolicyOutcome> result,
            Object value,
            Throwable error) {
        String key = candidates.get(index);
        int attemptNumber = index + 1;

        if (error == null) {
            result.complete(new PolicyOutcome.Succeeded(key, value, attemptNumber));
            return;
        }

        Throwable cause = unwrap(error);
        boolean last = attemptNumber >= candidates.size();
        if (last || scope.isCancelled()) {
            result.complete(new PolicyOutcome.Failed(key, cause, attemptNumber));
            return;
        }

        String next = candidates.get(index + 1);
        log.debug("Trial '{}' failed on attempt {} ({}), redirecting to '{}'",
            key, attemptNumber, cause.toString(), next);
        attempt(index + 1, candidates, attemptFunction, scope, result);
    }

    /**
     * {@link CompletionException} / {@link ExecutionException} 래핑 제거.
     *
     * @param error Stage가 전달한 예외
     * @return 원래 예외
     */
    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
