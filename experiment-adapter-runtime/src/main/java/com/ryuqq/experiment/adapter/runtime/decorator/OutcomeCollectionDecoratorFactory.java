package com.ryuqq.experiment.adapter.runtime.decorator;

import com.ryuqq.experiment.core.context.InvocationContext;
import com.ryuqq.experiment.core.context.ResolutionContext;
import com.ryuqq.experiment.core.decorator.ExperimentDecorator;
import com.ryuqq.experiment.core.decorator.ExperimentDecoratorFactory;
import com.ryuqq.experiment.core.outcome.ExperimentOutcome;
import com.ryuqq.experiment.core.outcome.OutcomeType;
import com.ryuqq.experiment.core.spi.OutcomeStore;
import com.ryuqq.experiment.core.spi.SubjectIdentityProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletionException;

/**
 * 시도 결과를 {@link ExperimentOutcome}으로 기록하는 Decorator.
 *
 * <p><strong>시도마다 기록되는 Outcome:</strong></p>
 * <ul>
 *   <li>BINARY {@code successMetricName}: 성공 1.0, 실패 0.0 (항상)</li>
 *   <li>DURATION {@code durationMetricName}: 소요 밀리초 (collectDuration)</li>
 *   <li>COUNT {@code errorMetricName}: 1.0 + 예외 타입 메타데이터 (collectErrors, 실패 시)</li>
 * </ul>
 *
 * <p>Subject ID는 시도가 Chain에 들어온 스레드에서 읽습니다. Provider가 없거나 Subject가 없으면
 * {@value ExperimentOutcome#ANONYMOUS_SUBJECT}입니다.</p>
 *
 * <p>Store 실패는 WARN 로그만 남기고 호출 결과에 영향을 주지 않습니다.</p>
 *
 * @author Experiment Dispatch Team
 * @since 1.0.0
 */
public final class OutcomeCollectionDecoratorFactory implements ExperimentDecoratorFactory {

    private static final Logger log = LoggerFactory.getLogger(OutcomeCollectionDecoratorFactory.class);

    private final OutcomeStore outcomeStore;
    private final OutcomeCollectionConfig config;
    private final Clock clock;

    public OutcomeCollectionDecoratorFactory(OutcomeStore outcomeStore) {
        this(outcomeStore, new OutcomeCollectionConfig(), Clock.systemUTC());
    }

    /**
     * 생성자.
     *
     * @param outcomeStore Outcome 저장소
     * @param config 수집 설정
     * @param clock 기록 시각 기준
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public OutcomeCollectionDecoratorFactory(OutcomeStore outcomeStore, OutcomeCollectionConfig config, Clock clock) {
        if (outcomeStore == null) {
            throw new IllegalArgumentException("outcomeStore cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.outcomeStore = outcomeStore;
        this.config = config;
        this.clock = clock;
    }

    /**
     * Decorator 생성.
     *
     * <p>Registry의 Resolution Context에 {@link SubjectIdentityProvider}가 있으면 Subject ID에 사용합니다.</p>
     */
    @Override
    public ExperimentDecorator create(ResolutionContext context) {
        SubjectIdentityProvider subjects = context.lookup(SubjectIdentityProvider.class).orElse(null);
        return (invocation, next) -> {
            String subjectId = currentSubject(subjects, context);
            long startNanos = System.nanoTime();
            return next.proceed().whenComplete((value, error) -> {
                double elapsedMillis = (System.nanoTime() - startNanos) / 1_000_000.0;
                collect(invocation, subjectId, elapsedMillis, error);
            });
        };
    }

    private void collect(InvocationContext invocation, String subjectId, double elapsedMillis, Throwable error) {
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("method", invocation.methodName());
        metadata.put("selectedKey", invocation.selectedKey());
        metadata.put("attempt", Integer.toString(invocation.attempt()));

        record(invocation, subjectId, config.successMetricName(), OutcomeType.BINARY, error == null ? 1.0 : 0.0, metadata);
        if (config.collectDuration()) {
            record(invocation, subjectId, config.durationMetricName(), OutcomeType.DURATION, elapsedMillis, metadata);
        }
        if (config.collectErrors() && error != null) {
            Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
            Map<String, String> errorMetadata = new LinkedHashMap<>(metadata);
            errorMetadata.put("exceptionType", cause.getClass().getName());
            record(invocation, subjectId, config.errorMetricName(), OutcomeType.COUNT, 1.0, errorMetadata);
        }
    }

    private void record(
            InvocationContext invocation,
            String subjectId,
            String metricName,
            OutcomeType type,
            double value,
            Map<String, String> metadata) {
        try {
            outcomeStore.record(ExperimentOutcome.of(
                invocation.experimentName(), invocation.trialKey(), subjectId,
                metricName, type, value, clock.instant(), metadata));
        } catch (RuntimeException e) {
            log.warn("Outcome store failed for {} metric '{}' (trial '{}')",
                invocation.experimentName(), metricName, invocation.trialKey(), e);
        }
    }

    private static String currentSubject(SubjectIdentityProvider subjects, ResolutionContext context) {
        if (subjects == null) {
            return ExperimentOutcome.ANONYMOUS_SUBJECT;
        }
        try {
            return subjects.currentSubjectId(context).orElse(ExperimentOutcome.ANONYMOUS_SUBJECT);
        } catch (RuntimeException e) {
            log.warn("Subject identity lookup failed, recording outcome as anonymous", e);
            return ExperimentOutcome.ANONYMOUS_SUBJECT;
        }
    }
}
