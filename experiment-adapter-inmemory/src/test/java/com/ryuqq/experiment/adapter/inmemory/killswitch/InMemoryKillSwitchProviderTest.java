package com.ryuqq.experiment.adapter.inmemory.killswitch;

import com.ryuqq.experiment.core.model.DisabledTrial;
import com.ryuqq.experiment.core.model.KillSwitchState;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * InMemoryKillSwitchProvider 유닛 테스트 (Contract 외 동작).
 *
 * @author Experiment Dispatch Team
 * @since 1.0.0
 */
class InMemoryKillSwitchProviderTest {

    interface PaymentService {
    }

    interface ShippingService {
    }

    @Test
    void 초기_상태로_시작() {
        // given
        KillSwitchState initial = new KillSwitchState(
            Set.of(ShippingService.class),
            Set.of(new DisabledTrial(PaymentService.class, "v2")));

        // when
        InMemoryKillSwitchProvider provider = new InMemoryKillSwitchProvider(initial);

        // then
        assertThat(provider.isExperimentDisabled(ShippingService.class)).isTrue();
        assertThat(provider.isTrialDisabled(PaymentService.class, "v2")).isTrue();
        assertThat(provider.isTrialDisabled(PaymentService.class, "control")).isFalse();
    }

    @Test
    void Snapshot은_이후_변경에_영향받지_않음() {
        // given
        InMemoryKillSwitchProvider provider = new InMemoryKillSwitchProvider();
        provider.disableTrial(PaymentService.class, "v2");

        // when
        KillSwitchState snapshot = provider.snapshot();
        provider.disableExperiment(PaymentService.class);

        // then
        assertThat(snapshot.disabledExperiments()).isEmpty();
        assertThat(snapshot.disabledTrials()).containsExactly(new DisabledTrial(PaymentService.class, "v2"));
    }

    @Test
    void Restore는_기존_상태를_대체() {
        // given
        InMemoryKillSwitchProvider provider = new InMemoryKillSwitchProvider();
        provider.disableExperiment(PaymentService.class);

        // when
        provider.restore(new KillSwitchState(Set.of(ShippingService.class), Set.of()));

        // then
        assertThat(provider.isExperimentDisabled(PaymentService.class)).isFalse();
        assertThat(provider.isExperimentDisabled(ShippingService.class)).isTrue();
    }

    @Test
    void Clear_후_모두_활성() {
        InMemoryKillSwitchProvider provider = new InMemoryKillSwitchProvider();
        provider.disableExperiment(PaymentService.class);
        provider.disableTrial(ShippingService.class, "v2");

        provider.clear();

        assertThat(provider.snapshot().isEmpty()).isTrue();
    }

    @Test
    void 잘못된_인자로_조회하면_비활성화되지_않은_것으로_응답() {
        InMemoryKillSwitchProvider provider = new InMemoryKillSwitchProvider();

        assertThat(provider.isTrialDisabled(null, "v2")).isFalse();
        assertThat(provider.isTrialDisabled(PaymentService.class, "")).isFalse();
        assertThat(provider.isExperimentDisabled(null)).isFalse();
    }

    @Test
    void 잘못된_인자로_변경하면_예외() {
        InMemoryKillSwitchProvider provider = new InMemoryKillSwitchProvider();

        assertThatThrownBy(() -> provider.disableExperiment(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("serviceType cannot be null");
        assertThatThrownBy(() -> provider.disableTrial(PaymentService.class, ""))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> provider.restore(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("state cannot be null");
    }
}
