package com.ryuqq.experiment.application.activation;

import com.ryuqq.experiment.core.context.ResolutionContext;
import com.ryuqq.experiment.core.model.ActivationWindow;
import com.ryuqq.experiment.core.spi.ActivationPredicate;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ActivationGate 유닛 테스트.
 *
 * @author Experiment Dispatch Team
 * @since 1.0.0
 */
class ActivationGateTest {

    private static final Instant NOW = Instant.parse("2026-06-15T10:00:00Z");

    private final ActivationGate gate = new ActivationGate(Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    void 구간도_조건도_없으면_활성() {
        assertThat(gate.isActive(ActivationWindow.ALWAYS, null, ResolutionContext.empty())).isTrue();
    }

    @Test
    void 구간은_Clock_기준으로_판정() {
        ActivationWindow past = new ActivationWindow(null, NOW.minusSeconds(1));
        ActivationWindow future = new ActivationWindow(NOW.plusSeconds(1), null);
        ActivationWindow current = new ActivationWindow(NOW.minusSeconds(60), NOW.plusSeconds(60));

        assertThat(gate.isActive(past, null, ResolutionContext.empty())).isFalse();
        assertThat(gate.isActive(future, null, ResolutionContext.empty())).isFalse();
        assertThat(gate.isActive(current, null, ResolutionContext.empty())).isTrue();
    }

    @Test
    void 구간_밖이면_조건을_평가하지_않음() {
        // given
        AtomicInteger calls = new AtomicInteger();
        ActivationPredicate predicate = ctx -> {
            calls.incrementAndGet();
            return true;
        };

        // when
        boolean active = gate.isActive(new ActivationWindow(NOW.plusSeconds(1), null), predicate,
            ResolutionContext.empty());

        // then
        assertThat(active).isFalse();
        assertThat(calls).hasValue(0);
    }

    @Test
    void 조건과_구간은_AND() {
        assertThat(gate.isActive(ActivationWindow.ALWAYS, ctx -> false, ResolutionContext.empty())).isFalse();
        assertThat(gate.isActive(ActivationWindow.ALWAYS, ctx -> true, ResolutionContext.empty())).isTrue();
    }

    @Test
    void 조건_예외는_비활성으로_처리() {
        ActivationPredicate failing = ctx -> {
            throw new IllegalStateException("tenant lookup failed");
        };

        assertThat(gate.isActive(ActivationWindow.ALWAYS, failing, ResolutionContext.empty())).isFalse();
    }

    @Test
    void 명시적_시각_판정() {
        ActivationWindow window = new ActivationWindow(NOW, NOW.plusSeconds(10));

        assertThat(gate.isActive(window, null, NOW.plusSeconds(10), ResolutionContext.empty())).isTrue();
        assertThat(gate.isActive(window, null, NOW.plusSeconds(11), ResolutionContext.empty())).isFalse();
    }

    @Test
    void 필수_인자_검증() {
        assertThatThrownBy(() -> new ActivationGate(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("clock cannot be null");
        assertThatThrownBy(() -> gate.isActive(null, null, ResolutionContext.empty()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("window cannot be null");
    }
}
