package com.ryuqq.experiment.adapter.runtime.decorator;

import com.ryuqq.experiment.core.context.InvocationContext;
import com.ryuqq.experiment.core.context.ResolutionContext;
import com.ryuqq.experiment.core.decorator.ExperimentDecorator;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

import static com.ryuqq.experiment.adapter.runtime.decorator.DecoratorTestSupport.invocation;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * BenchmarkDecoratorFactory 테스트.
 *
 * @author Experiment Dispatch Team
 * @since 1.0.0
 */
class BenchmarkDecoratorFactoryTest {

    record Measurement(InvocationContext context, Duration elapsed, boolean succeeded) {
    }

    @Test
    void 성공한_시도의_소요_시간_전달() {
        // given
        List<Measurement> measurements = new ArrayList<>();
        ExperimentDecorator decorator = new BenchmarkDecoratorFactory(
            (context, elapsed, succeeded) -> measurements.add(new Measurement(context, elapsed, succeeded)))
            .create(ResolutionContext.empty());
        InvocationContext invocation = invocation("true", 1);

        // when
        CompletionStage<Object> result = decorator.invoke(invocation,
            () -> CompletableFuture.completedFuture("v2:cart-1"));

        // then
        assertThat(result.toCompletableFuture().join()).isEqualTo("v2:cart-1");
        assertThat(measurements).singleElement().satisfies(m -> {
            assertThat(m.context()).isSameAs(invocation);
            assertThat(m.elapsed()).isNotNegative();
            assertThat(m.succeeded()).isTrue();
        });
    }

    @Test
    void 실패한_시도도_측정() {
        // given
        List<Measurement> measurements = new ArrayList<>();
        ExperimentDecorator decorator = new BenchmarkDecoratorFactory(
            (context, elapsed, succeeded) -> measurements.add(new Measurement(context, elapsed, succeeded)))
            .create(ResolutionContext.empty());

        // when
        CompletionStage<Object> result = decorator.invoke(invocation("true", 2),
            () -> CompletableFuture.failedFuture(new IllegalStateException("v2 broken")));

        // then
        assertThat(result.toCompletableFuture()).isCompletedExceptionally();
        assertThat(measurements).extracting(Measurement::succeeded).containsExactly(false);
    }

    @Test
    void Listener_예외는_결과에_영향_없음() {
        // given
        ExperimentDecorator decorator = new BenchmarkDecoratorFactory((context, elapsed, succeeded) -> {
            throw new IllegalStateException("metrics backend down");
        }).create(ResolutionContext.empty());

        // when
        CompletionStage<Object> result = decorator.invoke(invocation("true", 1),
            () -> CompletableFuture.completedFuture("v2:cart-1"));

        // then
        assertThat(result.toCompletableFuture().join()).isEqualTo("v2:cart-1");
    }

    @Test
    void 기본_Listener는_로그만_남김() {
        ExperimentDecorator decorator = new BenchmarkDecoratorFactory().create(ResolutionContext.empty());

        CompletionStage<Object> result = decorator.invoke(invocation("control", 1),
            () -> CompletableFuture.completedFuture("legacy:cart-1"));

        assertThat(result.toCompletableFuture().join()).isEqualTo("legacy:cart-1");
    }

    @Test
    void null_Listener는_예외() {
        assertThatThrownBy(() -> new BenchmarkDecoratorFactory(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("listener cannot be null");
    }
}
