package com.ryuqq.experiment.adapter.runtime.decorator;

import com.ryuqq.experiment.core.context.ResolutionContext;
import com.ryuqq.experiment.core.decorator.ExperimentDecorator;
import com.ryuqq.experiment.core.decorator.ExperimentDecoratorFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 시도별 제한 시간 Decorator.
 *
 * <p>제한 시간 안에 완료되지 않은 시도를 {@link TimeoutException}으로 실패시키고 원래 Stage를 취소합니다.
 * 이 실패는 일반 시도 실패와 같으므로 Error Policy에 따라 Fallback이 이어질 수 있습니다.</p>
 *
 * <p>이미 완료된 Stage(동기 Trial)는 그대로 통과합니다. 동기 Trial은 호출 스레드를 점유하므로
 * 실행 도중 중단할 수 없습니다.</p>
 *
 * @author Experiment Dispatch Team
 * @since 1.0.0
 */
public final class TimeoutDecoratorFactory implements ExperimentDecoratorFactory {

    private static final Logger log = LoggerFactory.getLogger(TimeoutDecoratorFactory.class);

    private final Duration timeout;

    /**
     * 생성자.
     *
     * @param timeout 시도별 제한 시간
     * @throws IllegalArgumentException timeout이 null이거나 양수가 아닌 경우
     */
    public TimeoutDecoratorFactory(Duration timeout) {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive (current: " + timeout + ")");
        }
        this.timeout = timeout;
    }

    @Override
    public ExperimentDecorator create(ResolutionContext context) {
        long timeoutMillis = Math.max(1, timeout.toMillis());
        return (invocation, next) -> {
            CompletableFuture<Object> source = next.proceed().toCompletableFuture();
            if (source.isDone()) {
                return source;
            }

            CompletableFuture<Object> timed = source.copy().orTimeout(timeoutMillis, TimeUnit.MILLISECONDS);
            timed.whenComplete((value, error) -> {
                if (isTimeout(error)) {
                    log.warn("Experiment trial timed out after {}ms: {}.{} trial='{}' attempt={}",
                        timeoutMillis, invocation.experimentName(), invocation.methodName(),
                        invocation.trialKey(), invocation.attempt());
                    source.cancel(true);
                }
            });
            return timed;
        };
    }

    public Duration getTimeout() {
        return timeout;
    }

    private static boolean isTimeout(Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        return cause instanceof TimeoutException;
    }
}
