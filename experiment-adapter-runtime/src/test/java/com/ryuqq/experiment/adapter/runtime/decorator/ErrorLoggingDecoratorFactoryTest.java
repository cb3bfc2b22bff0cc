package com.ryuqq.experiment.adapter.runtime.decorator;

import com.ryuqq.experiment.core.context.ResolutionContext;
import com.ryuqq.experiment.core.decorator.ExperimentDecorator;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;

import static com.ryuqq.experiment.adapter.runtime.decorator.DecoratorTestSupport.invocation;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ErrorLoggingDecoratorFactory 테스트.
 *
 * <p>로그만 남기고 결과나 예외를 바꾸지 않아야 합니다.</p>
 *
 * @author Experiment Dispatch Team
 * @since 1.0.0
 */
class ErrorLoggingDecoratorFactoryTest {

    private final ExperimentDecorator decorator = new ErrorLoggingDecoratorFactory().create(ResolutionContext.empty());

    @Test
    void 성공_결과_그대로_전달() {
        CompletionStage<Object> result = decorator.invoke(invocation("true", 1),
            () -> CompletableFuture.completedFuture("v2:cart-1"));

        assertThat(result.toCompletableFuture().join()).isEqualTo("v2:cart-1");
    }

    @Test
    void 실패_예외_그대로_전달() {
        // given
        IllegalStateException failure = new IllegalStateException("v2 broken");

        // when
        CompletionStage<Object> result = decorator.invoke(invocation("true", 1),
            () -> CompletableFuture.failedFuture(failure));

        // then
        assertThatThrownBy(() -> result.toCompletableFuture().join())
            .isInstanceOf(CompletionException.class)
            .hasCause(failure);
    }
}
