package com.ryuqq.experiment.core.context;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ResolutionContext / SimpleResolutionContext 유닛 테스트.
 *
 * @author Experiment Dispatch Team
 * @since 1.0.0
 */
class ResolutionContextTest {

    interface Clock {
        long now();
    }

    @Test
    void 빈_Context는_항상_empty() {
        assertThat(ResolutionContext.empty().lookup(String.class)).isEmpty();
    }

    @Test
    void 정확한_타입_조회() {
        // given
        Clock clock = () -> 42L;
        ResolutionContext context = SimpleResolutionContext.builder()
            .register(Clock.class, clock)
            .register(String.class, "tenant-a")
            .build();

        // when & then
        assertThat(context.lookup(Clock.class)).containsSame(clock);
        assertThat(context.lookup(String.class)).contains("tenant-a");
        assertThat(context.lookup(Integer.class)).isEmpty();
    }

    @Test
    void 상위_타입으로도_조회() {
        ResolutionContext context = ResolutionContext.of(Map.of(String.class, "tenant-a"));

        assertThat(context.lookup(CharSequence.class)).contains("tenant-a");
    }

    @Test
    void 타입이_맞지_않는_항목은_거부() {
        assertThatThrownBy(() -> ResolutionContext.of(Map.of(Integer.class, "not a number")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("entry is not an instance of java.lang.Integer");
    }
}
