package com.ryuqq.experiment.application.decorator;

import com.ryuqq.experiment.core.context.InvocationContext;
import com.ryuqq.experiment.core.decorator.ExperimentDecorator;
import com.ryuqq.experiment.core.decorator.InvocationChain;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Decorator Chain.
 *
 * <p>Registry 빌드 시 한 번 만들어지고 모든 호출이 공유합니다. 등록 순서가 곧 바깥에서 안쪽 순서이며
 * 마지막 Decorator 다음에 실제 Trial 호출(terminal)이 실행됩니다.</p>
 *
 * <p>Decorator가 동기적으로 예외를 던지거나 null을 반환하면 해당 시도는 실패한 Stage로 변환됩니다.
 * Chain 자체는 호출자에게 예외를 던지지 않습니다.</p>
 *
 * @author Experiment Dispatch Team
 * @since 1.0.0
 */
public final class DecoratorChain {

    private static final DecoratorChain EMPTY = new DecoratorChain(List.of());

    private final List<ExperimentDecorator> decorators;

    /**
     * 생성자.
     *
     * @param decorators 등록 순서의 Decorator 목록
     * @throws IllegalArgumentException decorators가 null이거나 null 원소를 포함하는 경우
     */
    public DecoratorChain(List<ExperimentDecorator> decorators) {
        if (decorators == null) {
            throw new IllegalArgumentException("decorators cannot be null");
        }
        this.decorators = List.copyOf(decorators);
    }

    public static DecoratorChain empty() {
        return EMPTY;
    }

    /**
     * 시도 한 번을 Chain으로 감싸 실행.
     *
     * @param context 이번 시도의 InvocationContext
     * @param terminal 실제 Trial 호출
     * @return 시도 결과 Stage
     */
    public CompletionStage<Object> execute(InvocationContext context, InvocationChain terminal) {
        if (context == null || terminal == null) {
            throw new IllegalArgumentException("context and terminal cannot be null");
        }
        return proceed(0, context, terminal);
    }

    private CompletionStage<Object> proceed(int index, InvocationContext context, InvocationChain terminal) {
        try {
            CompletionStage<Object> stage = index == decorators.size()
                ? terminal.proceed()
                : decorators.get(index).invoke(context, () -> proceed(index + 1, context, terminal));
            if (stage == null) {
                return CompletableFuture.failedFuture(new IllegalStateException(
                    "Decorator chain link " + index + " returned null for " + context.methodName()));
            }
            return stage;
        } catch (Throwable e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    public List<ExperimentDecorator> getDecorators() {
        return decorators;
    }

    public int size() {
        return decorators.size();
    }
}
