package com.ryuqq.experiment.adapter.runtime.decorator;

import com.ryuqq.experiment.core.decorator.ExperimentDecoratorFactory;
import com.ryuqq.experiment.core.spi.OutcomeStore;

import java.util.ArrayList;
import java.util.List;

/**
 * 내장 Decorator Factory 목록 생성.
 *
 * <p>순서 (바깥 → 안쪽): Benchmark, Error Logging, Outcome Collection, Timeout.
 * Timeout이 가장 안쪽이므로 시간 초과도 다른 Decorator에는 일반 실패로 보입니다.</p>
 *
 * <pre>{@code
 * ExperimentRegistry.builder()
 *     .decoratorFactories(StandardDecorators.factories(new DecoratorConfig().withTimeout(Duration.ofSeconds(2)), outcomeStore))
 *     ...
 * }</pre>
 *
 * @author Experiment Dispatch Team
 * @since 1.0.0
 */
public final class StandardDecorators {

    private StandardDecorators() {
    }

    /**
     * Outcome 수집 없이 Factory 목록 생성.
     *
     * @param config 설정
     * @return Factory 목록
     * @throws IllegalArgumentException outcomeCollectionEnabled인 경우
     */
    public static List<ExperimentDecoratorFactory> factories(DecoratorConfig config) {
        return factories(config, null);
    }

    /**
     * Factory 목록 생성.
     *
     * @param config 설정
     * @param outcomeStore Outcome 저장소 (outcomeCollectionEnabled가 아니면 null 가능)
     * @return 불변 Factory 목록
     * @throws IllegalArgumentException config가 null이거나, Outcome 수집이 켜져 있는데 store가 null인 경우
     */
    public static List<ExperimentDecoratorFactory> factories(DecoratorConfig config, OutcomeStore outcomeStore) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        List<ExperimentDecoratorFactory> factories = new ArrayList<>();
        if (config.benchmarkEnabled()) {
            factories.add(new BenchmarkDecoratorFactory());
        }
        if (config.errorLoggingEnabled()) {
            factories.add(new ErrorLoggingDecoratorFactory());
        }
        if (config.outcomeCollectionEnabled()) {
            if (outcomeStore == null) {
                throw new IllegalArgumentException("outcomeStore cannot be null when outcome collection is enabled");
            }
            factories.add(new OutcomeCollectionDecoratorFactory(outcomeStore));
        }
        if (config.hasTimeout()) {
            factories.add(new TimeoutDecoratorFactory(config.timeout()));
        }
        return List.copyOf(factories);
    }
}
