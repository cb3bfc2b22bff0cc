package com.ryuqq.experiment.testkit.support;

import com.ryuqq.experiment.core.context.InvocationContext;
import com.ryuqq.experiment.core.context.ResolutionContext;
import com.ryuqq.experiment.core.decorator.ExperimentDecorator;
import com.ryuqq.experiment.core.decorator.ExperimentDecoratorFactory;
import com.ryuqq.experiment.core.decorator.InvocationChain;

import java.util.List;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * 호출 흐름을 기록하는 테스트용 Decorator Factory.
 *
 * <p>시도마다 {@link Phase#BEFORE}와 {@link Phase#SUCCEEDED} / {@link Phase#FAILED} 이벤트를
 * 남깁니다. Chain 순서, 시도 횟수, Fallback 순서를 검증할 때 사용합니다.</p>
 *
 * <pre>{@code
 * TraceCapturingDecoratorFactory outer = new TraceCapturingDecoratorFactory("outer");
 * TraceCapturingDecoratorFactory inner = new TraceCapturingDecoratorFactory("inner", outer.sharedTrace());
 * }</pre>
 *
 * @author Experiment Dispatch Team
 * @since 1.0.0
 */
public final class TraceCapturingDecoratorFactory implements ExperimentDecoratorFactory {

    /**
     * 기록 단계.
     */
    public enum Phase {
        BEFORE,
        SUCCEEDED,
        FAILED
    }

    /**
     * 기록된 이벤트.
     *
     * @param decoratorName 기록한 Decorator 이름
     * @param phase 단계
     * @param trialKey 시도한 Trial Key
     * @param attempt 시도 번호 (1부터)
     * @param methodName 호출 메서드
     */
    public record TraceEvent(String decoratorName, Phase phase, String trialKey, int attempt, String methodName) {

        @Override
        public String toString() {
            return decoratorName + ":" + phase + ":" + trialKey + "#" + attempt;
        }
    }

    private final String name;
    private final List<TraceEvent> trace;
    private final AtomicInteger createCount = new AtomicInteger();

    public TraceCapturingDecoratorFactory(String name) {
        this(name, new CopyOnWriteArrayList<>());
    }

    /**
     * 다른 Factory와 기록을 공유하는 생성자.
     *
     * @param name Decorator 이름
     * @param sharedTrace 공유 기록 (thread-safe List)
     */
    public TraceCapturingDecoratorFactory(String name, List<TraceEvent> sharedTrace) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (sharedTrace == null) {
            throw new IllegalArgumentException("sharedTrace cannot be null");
        }
        this.name = name;
        this.trace = sharedTrace;
    }

    @Override
    public ExperimentDecorator create(ResolutionContext context) {
        createCount.incrementAndGet();
        return this::invoke;
    }

    private CompletionStage<Object> invoke(InvocationContext context, InvocationChain next) {
        record(Phase.BEFORE, context);
        return next.proceed().whenComplete((value, error) ->
            record(error == null ? Phase.SUCCEEDED : Phase.FAILED, context));
    }

    private void record(Phase phase, InvocationContext context) {
        trace.add(new TraceEvent(name, phase, context.trialKey(), context.attempt(), context.methodName()));
    }

    public List<TraceEvent> sharedTrace() {
        return trace;
    }

    /**
     * 기록된 이벤트 (복사본).
     *
     * @return 기록 순서의 이벤트
     */
    public List<TraceEvent> getEvents() {
        return List.copyOf(trace);
    }

    /**
     * 이 Decorator가 시도한 Trial Key 순서.
     *
     * @return BEFORE 이벤트의 Trial Key
     */
    public List<String> attemptedKeys() {
        return trace.stream()
            .filter(event -> event.decoratorName().equals(name) && event.phase() == Phase.BEFORE)
            .map(TraceEvent::trialKey)
            .collect(Collectors.toList());
    }

    public int getCreateCount() {
        return createCount.get();
    }

    public void clear() {
        trace.clear();
    }
}
