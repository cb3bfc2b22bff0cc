package com.ryuqq.experiment.adapter.runtime.decorator;

import com.ryuqq.experiment.core.context.InvocationContext;
import com.ryuqq.experiment.core.context.ResolutionContext;
import com.ryuqq.experiment.core.decorator.ExperimentDecorator;
import com.ryuqq.experiment.core.decorator.ExperimentDecoratorFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * 시도별 소요 시간 측정 Decorator.
 *
 * <p>시작 시각은 시도가 Chain에 들어온 시점, 종료 시각은 Stage가 완료된 시점입니다.
 * 비동기 Trial은 호출 스레드를 반환한 뒤에도 완료 시점까지 측정됩니다.</p>
 *
 * @author Experiment Dispatch Team
 * @since 1.0.0
 */
public final class BenchmarkDecoratorFactory implements ExperimentDecoratorFactory {

    private static final Logger log = LoggerFactory.getLogger(BenchmarkDecoratorFactory.class);

    /**
     * 측정 결과 수신자.
     */
    @FunctionalInterface
    public interface DurationListener {

        /**
         * 시도 완료 통지.
         *
         * @param context 시도의 InvocationContext
         * @param elapsed 소요 시간
         * @param succeeded 성공 여부
         */
        void onCompleted(InvocationContext context, Duration elapsed, boolean succeeded);
    }

    private final DurationListener listener;

    /**
     * 생성자 (INFO 로그로 기록).
     */
    public BenchmarkDecoratorFactory() {
        this(BenchmarkDecoratorFactory::logDuration);
    }

    /**
     * 생성자 (수신자 지정).
     *
     * @param listener 측정 결과 수신자
     * @throws IllegalArgumentException listener가 null인 경우
     */
    public BenchmarkDecoratorFactory(DurationListener listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        this.listener = listener;
    }

    @Override
    public ExperimentDecorator create(ResolutionContext context) {
        return (invocation, next) -> {
            long startNanos = System.nanoTime();
            return next.proceed().whenComplete((value, error) -> {
                Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
                try {
                    listener.onCompleted(invocation, elapsed, error == null);
                } catch (RuntimeException e) {
                    log.warn("Benchmark listener failed for {}.{}", invocation.experimentName(), invocation.methodName(), e);
                }
            });
        };
    }

    private static void logDuration(InvocationContext context, Duration elapsed, boolean succeeded) {
        log.info("Experiment call {}.{} trial='{}' attempt={} elapsedMs={} success={}",
            context.experimentName(), context.methodName(), context.trialKey(), context.attempt(),
            elapsed.toNanos() / 1_000_000.0, succeeded);
    }
}
