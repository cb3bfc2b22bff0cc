package com.ryuqq.experiment.application.dispatch;

import com.ryuqq.experiment.application.registry.ExperimentRegistry;
import com.ryuqq.experiment.core.context.InvocationContext;
import com.ryuqq.experiment.core.context.ResolutionContext;
import com.ryuqq.experiment.core.context.RoutingReason;
import com.ryuqq.experiment.core.context.TrialAssignment;
import com.ryuqq.experiment.core.model.ExperimentDefinition;
import com.ryuqq.experiment.core.routing.StickyTrialRouter;
import com.ryuqq.experiment.core.spi.KillSwitchProvider;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * DefaultExperimentDispatcher 유닛 테스트.
 *
 * <p>라우팅 우선순위 (Gate → Experiment Kill Switch → Selection → Trial Kill Switch),
 * Error Policy별 Fallback, Audit 기록, 비동기 취소를 검증합니다.</p>
 *
 * @author Experiment Dispatch Team
 * @since 1.0.0
 */
class DefaultExperimentDispatcherTest {

    interface CheckoutService {
        String total(String cartId) throws Exception;
    }

    interface AsyncQuoteService {
        CompletableFuture<String> quote(String sku);
    }

    record Subject(String id) {
    }

    private static final Instant NOW = Instant.parse("2026-06-15T10:00:00Z");

    private final Map<String, Boolean> flags = new ConcurrentHashMap<>();
    private final Map<String, String> variants = new ConcurrentHashMap<>();
    private final List<TrialAssignment> assignments = new CopyOnWriteArrayList<>();
    private final List<InvocationContext> observed = new CopyOnWriteArrayList<>();
    private final Map<String, AtomicInteger> invocations = new ConcurrentHashMap<>();
    private final SetBackedKillSwitchProvider killSwitch = new SetBackedKillSwitchProvider();

    // ============================================================
    // Fixtures
    // ============================================================

    private static final class SetBackedKillSwitchProvider implements KillSwitchProvider {

        private final Set<Class<?>> experiments = ConcurrentHashMap.newKeySet();
        private final Set<String> trials = ConcurrentHashMap.newKeySet();
        private volatile boolean failing;

        @Override
        public boolean isExperimentDisabled(Class<?> serviceType) {
            if (failing) {
                throw new IllegalStateException("kill switch store unreachable");
            }
            return experiments.contains(serviceType);
        }

        @Override
        public boolean isTrialDisabled(Class<?> serviceType, String trialKey) {
            if (failing) {
                throw new IllegalStateException("kill switch store unreachable");
            }
            return trials.contains(serviceType.getName() + "#" + trialKey);
        }

        @Override
        public void disableExperiment(Class<?> serviceType) {
            experiments.add(serviceType);
        }

        @Override
        public void enableExperiment(Class<?> serviceType) {
            experiments.remove(serviceType);
        }

        @Override
        public void disableTrial(Class<?> serviceType, String trialKey) {
            trials.add(serviceType.getName() + "#" + trialKey);
        }

        @Override
        public void enableTrial(Class<?> serviceType, String trialKey) {
            trials.remove(serviceType.getName() + "#" + trialKey);
        }
    }

    private CheckoutService succeeding(String key) {
        return cartId -> {
            invocations.computeIfAbsent(key, k -> new AtomicInteger()).incrementAndGet();
            return key + ":" + cartId;
        };
    }

    private CheckoutService failing(String key, Exception failure) {
        return cartId -> {
            invocations.computeIfAbsent(key, k -> new AtomicInteger()).incrementAndGet();
            throw failure;
        };
    }

    private CheckoutService crashing(String key, Error error) {
        return cartId -> {
            invocations.computeIfAbsent(key, k -> new AtomicInteger()).incrementAndGet();
            throw error;
        };
    }

    private int invocationsOf(String key) {
        AtomicInteger count = invocations.get(key);
        return count == null ? 0 : count.get();
    }

    private ExperimentRegistry.Builder registryBuilder() {
        return ExperimentRegistry.builder()
            .clock(Clock.fixed(NOW, ZoneOffset.UTC))
            .featureFlagSource((flag, ctx) -> flags.getOrDefault(flag, false))
            .variantFlagSource((flag, ctx) -> Optional.ofNullable(variants.get(flag)))
            .subjectIdentityProvider(ctx -> ctx.lookup(Subject.class).map(Subject::id))
            .killSwitchProvider(killSwitch)
            .auditSink(assignments::add)
            .decoratorFactory(ctx -> (invocation, next) -> {
                observed.add(invocation);
                return next.proceed();
            });
    }

    private static DispatchRequest<CheckoutService> total(String cartId) {
        return DispatchRequest.of(CheckoutService.class, "total", new Object[] {cartId},
            trial -> CompletableFuture.completedFuture(trial.total(cartId)));
    }

    private ExperimentDefinition.Builder<CheckoutService> checkoutV2(CheckoutService newImpl) {
        return ExperimentDefinition.builder("checkout-v2", CheckoutService.class)
            .control("control", ctx -> succeeding("control"))
            .condition("true", ctx -> newImpl)
            .usingFeatureFlag("UseV2");
    }

    private TrialAssignment lastAssignment() {
        assertThat(assignments).isNotEmpty();
        return assignments.get(assignments.size() - 1);
    }

    // ============================================================
    // 기본 시나리오
    // ============================================================

    @Test
    void Flag_false_이면_기본_Trial_결과() throws Exception {
        // given
        flags.put("UseV2", false);
        ExperimentRegistry registry = registryBuilder().add(checkoutV2(succeeding("true")).build()).build();
        DefaultExperimentDispatcher dispatcher = new DefaultExperimentDispatcher(registry);

        // when
        Object result = dispatcher.dispatch(total("cart-1"));

        // then
        assertThat(result).isEqualTo("control:cart-1");
        assertThat(invocationsOf("true")).isZero();
        TrialAssignment assignment = lastAssignment();
        assertThat(assignment.selectedKey()).isEqualTo("control");
        assertThat(assignment.executedKey()).isEqualTo("control");
        assertThat(assignment.fallback()).isFalse();
        assertThat(assignment.reason()).isEqualTo(RoutingReason.SELECTED);
        assertThat(assignment.methodName()).isEqualTo("total");
        assertThat(assignment.timestamp()).isEqualTo(NOW);
    }

    @Test
    void Flag_true_이면_새_Trial_결과() throws Exception {
        // given
        flags.put("UseV2", true);
        ExperimentRegistry registry = registryBuilder().add(checkoutV2(succeeding("true")).build()).build();

        // when
        Object result = new DefaultExperimentDispatcher(registry).dispatch(total("cart-1"));

        // then
        assertThat(result).isEqualTo("true:cart-1");
        assertThat(lastAssignment().executedKey()).isEqualTo("true");
        assertThat(lastAssignment().isFailed()).isFalse();
    }

    @Test
    void 새_Trial_실패_시_기본_Trial로_재실행() throws Exception {
        // given
        flags.put("UseV2", true);
        ExperimentRegistry registry = registryBuilder()
            .add(checkoutV2(failing("true", new IllegalStateException("v2 broken")))
                .onErrorRedirectAndReplayDefault()
                .build())
            .build();

        // when
        Object result = new DefaultExperimentDispatcher(registry).dispatch(total("cart-1"));

        // then
        assertThat(result).isEqualTo("control:cart-1");
        TrialAssignment assignment = lastAssignment();
        assertThat(assignment.selectedKey()).isEqualTo("true");
        assertThat(assignment.executedKey()).isEqualTo("control");
        assertThat(assignment.fallback()).isTrue();
        assertThat(assignment.exception()).isNull();

        // 시도마다 Decorator Chain을 한 번씩 통과
        assertThat(observed).extracting(InvocationContext::trialKey).containsExactly("true", "control");
        assertThat(observed).extracting(InvocationContext::attempt).containsExactly(1, 2);
        assertThat(observed).extracting(InvocationContext::arguments).containsOnly(List.of("cart-1"));
    }

    @Test
    void Experiment_Kill_Switch_이면_새_Trial을_호출하지_않음() throws Exception {
        // given
        flags.put("UseV2", true);
        killSwitch.disableExperiment(CheckoutService.class);
        ExperimentRegistry registry = registryBuilder().add(checkoutV2(succeeding("true")).build()).build();

        // when
        Object result = new DefaultExperimentDispatcher(registry).dispatch(total("cart-1"));

        // then
        assertThat(result).isEqualTo("control:cart-1");
        assertThat(invocationsOf("true")).isZero();
        assertThat(lastAssignment().reason()).isEqualTo(RoutingReason.EXPERIMENT_DISABLED);
    }

    @Test
    void 종료된_Experiment는_Flag와_무관하게_기본_Trial() throws Exception {
        // given
        flags.put("UseV2", true);
        ExperimentRegistry registry = registryBuilder()
            .add(checkoutV2(succeeding("true")).activeUntil(NOW.minusSeconds(60)).build())
            .build();

        // when
        Object result = new DefaultExperimentDispatcher(registry).dispatch(total("cart-1"));

        // then
        assertThat(result).isEqualTo("control:cart-1");
        assertThat(invocationsOf("true")).isZero();
        assertThat(lastAssignment().reason()).isEqualTo(RoutingReason.INACTIVE);
        assertThat(lastAssignment().selectedKey()).isEqualTo("control");
    }

    @Test
    void 비활성_Experiment는_Selection과_Kill_Switch를_조회하지_않음() throws Exception {
        // given
        AtomicInteger flagReads = new AtomicInteger();
        killSwitch.failing = true;
        ExperimentRegistry registry = registryBuilder()
            .featureFlagSource((flag, ctx) -> {
                flagReads.incrementAndGet();
                return true;
            })
            .add(checkoutV2(succeeding("true")).activeWhen(ctx -> false).build())
            .build();

        // when
        Object result = new DefaultExperimentDispatcher(registry).dispatch(total("cart-1"));

        // then
        assertThat(result).isEqualTo("control:cart-1");
        assertThat(flagReads).hasValue(0);
    }

    // ============================================================
    // Error Policy
    // ============================================================

    @Test
    void Throw_정책은_원래_예외를_그대로_전달() {
        // given
        flags.put("UseV2", true);
        IOException failure = new IOException("payment gateway timeout");
        ExperimentRegistry registry = registryBuilder()
            .add(checkoutV2(failing("true", failure)).build())
            .build();

        // when & then
        assertThatThrownBy(() -> new DefaultExperimentDispatcher(registry).dispatch(total("cart-1")))
            .isSameAs(failure);
        assertThat(invocationsOf("control")).isZero();
        assertThat(lastAssignment().exception()).isSameAs(failure);
        assertThat(lastAssignment().executedKey()).isEqualTo("true");
        assertThat(lastAssignment().fallback()).isFalse();
    }

    @Test
    void 기본_Trial도_실패하면_기본_Trial의_예외() {
        // given
        flags.put("UseV2", true);
        IllegalStateException original = new IllegalStateException("v2 broken");
        IllegalArgumentException defaultFailure = new IllegalArgumentException("control broken");
        ExperimentRegistry registry = registryBuilder()
            .add(ExperimentDefinition.builder("checkout-v2", CheckoutService.class)
                .control("control", ctx -> failing("control", defaultFailure))
                .condition("true", ctx -> failing("true", original))
                .usingFeatureFlag("UseV2")
                .onErrorRedirectAndReplayDefault()
                .build())
            .build();

        // when & then
        assertThatThrownBy(() -> new DefaultExperimentDispatcher(registry).dispatch(total("cart-1")))
            .isSameAs(defaultFailure);
        assertThat(invocationsOf("true")).isEqualTo(1);
        assertThat(invocationsOf("control")).isEqualTo(1);
        assertThat(lastAssignment().executedKey()).isEqualTo("control");
        assertThat(lastAssignment().fallback()).isTrue();
    }

    @Test
    void 기본_Trial이_선택되어_실패하면_재시도하지_않음() {
        // given
        IllegalStateException failure = new IllegalStateException("control broken");
        ExperimentRegistry registry = registryBuilder()
            .add(ExperimentDefinition.builder("checkout-v2", CheckoutService.class)
                .control("control", ctx -> failing("control", failure))
                .condition("true", ctx -> succeeding("true"))
                .usingFeatureFlag("UseV2")
                .onErrorRedirectAndReplayDefault()
                .build())
            .build();

        // when & then
        assertThatThrownBy(() -> new DefaultExperimentDispatcher(registry).dispatch(total("cart-1")))
            .isSameAs(failure);
        assertThat(invocationsOf("control")).isEqualTo(1);
    }

    @Test
    void 기본_Trial의_Error도_호출자_Future를_완료() {
        // given
        flags.put("UseV2", true);
        AssertionError defaultError = new AssertionError("control crashed");
        ExperimentRegistry registry = registryBuilder()
            .add(ExperimentDefinition.builder("checkout-v2", CheckoutService.class)
                .control("control", ctx -> crashing("control", defaultError))
                .condition("true", ctx -> failing("true", new IllegalStateException("v2 broken")))
                .usingFeatureFlag("UseV2")
                .onErrorRedirectAndReplayDefault()
                .build())
            .build();

        // when
        CompletableFuture<Object> future = new DefaultExperimentDispatcher(registry).dispatchAsync(total("cart-1"));

        // then
        assertThatThrownBy(() -> future.get(5, TimeUnit.SECONDS))
            .isInstanceOf(ExecutionException.class)
            .hasCauseReference(defaultError);
        assertThat(future.isDone()).isTrue();
        assertThat(invocationsOf("true")).isEqualTo(1);
        assertThat(invocationsOf("control")).isEqualTo(1);
        assertThat(assignments).hasSize(1);
        assertThat(lastAssignment().executedKey()).isEqualTo("control");
        assertThat(lastAssignment().exception()).isSameAs(defaultError);
    }

    @Test
    void 동기_호출은_Trial의_Error를_그대로_전달() {
        // given
        flags.put("UseV2", true);
        AssertionError defaultError = new AssertionError("control crashed");
        ExperimentRegistry registry = registryBuilder()
            .add(ExperimentDefinition.builder("checkout-v2", CheckoutService.class)
                .control("control", ctx -> crashing("control", defaultError))
                .condition("true", ctx -> failing("true", new IllegalStateException("v2 broken")))
                .usingFeatureFlag("UseV2")
                .onErrorRedirectAndReplayDefault()
                .build())
            .build();

        // when & then
        assertThatThrownBy(() -> new DefaultExperimentDispatcher(registry).dispatch(total("cart-1")))
            .isSameAs(defaultError);
    }

    @Test
    void 첫_Trial의_Error는_실패한_Future로_전달되고_한_번만_기록() {
        // given
        flags.put("UseV2", true);
        StackOverflowError error = new StackOverflowError("v2 recursion");
        ExperimentRegistry registry = registryBuilder()
            .add(checkoutV2(crashing("true", error)).build())
            .build();

        // when
        CompletableFuture<Object> future = new DefaultExperimentDispatcher(registry).dispatchAsync(total("cart-1"));

        // then
        assertThat(future).isCompletedExceptionally();
        assertThatThrownBy(() -> future.get(5, TimeUnit.SECONDS))
            .isInstanceOf(ExecutionException.class)
            .hasCauseReference(error);
        assertThat(invocationsOf("control")).isZero();
        assertThat(assignments).hasSize(1);
        assertThat(lastAssignment().isFailed()).isTrue();
        assertThat(lastAssignment().exception()).isSameAs(error);
    }

    @Test
    void Audit_Sink의_Error도_결과에_영향_없음() throws Exception {
        // given
        flags.put("UseV2", true);
        ExperimentRegistry registry = registryBuilder()
            .auditSink(assignment -> {
                throw new AssertionError("audit sink crashed");
            })
            .add(checkoutV2(succeeding("true")).build())
            .build();

        // when
        CompletableFuture<Object> future = new DefaultExperimentDispatcher(registry).dispatchAsync(total("cart-1"));

        // then
        assertThat(future.get(5, TimeUnit.SECONDS)).isEqualTo("true:cart-1");
    }

    private ExperimentDefinition.Builder<CheckoutService> threeWay(
            CheckoutService control, CheckoutService v2, CheckoutService v3) {
        return ExperimentDefinition.builder("checkout-three-way", CheckoutService.class)
            .control("control", ctx -> control)
            .condition("v2", ctx -> v2)
            .condition("v3", ctx -> v3)
            .usingVariantFlag("CheckoutVariant")
            .onErrorRedirectAndReplayAny();
    }

    @Test
    void Any_정책은_기본_Trial만_성공해도_결과_반환() throws Exception {
        // given
        variants.put("CheckoutVariant", "v3");
        ExperimentRegistry registry = registryBuilder()
            .add(threeWay(succeeding("control"),
                failing("v2", new IllegalStateException("v2")),
                failing("v3", new IllegalStateException("v3"))).build())
            .build();

        // when
        Object result = new DefaultExperimentDispatcher(registry).dispatch(total("cart-9"));

        // then
        assertThat(result).isEqualTo("control:cart-9");
        assertThat(observed).extracting(InvocationContext::trialKey).containsExactly("v3", "control");
        assertThat(invocationsOf("v2")).isZero();
    }

    @Test
    void Any_정책은_모두_실패하면_마지막_예외_각_Trial_한_번씩() {
        // given
        variants.put("CheckoutVariant", "v2");
        IllegalStateException last = new IllegalStateException("v3");
        ExperimentRegistry registry = registryBuilder()
            .add(threeWay(failing("control", new IllegalStateException("control")),
                failing("v2", new IllegalStateException("v2")),
                failing("v3", last)).build())
            .build();

        // when & then
        assertThatThrownBy(() -> new DefaultExperimentDispatcher(registry).dispatch(total("cart-9")))
            .isSameAs(last);
        assertThat(observed).extracting(InvocationContext::trialKey).containsExactly("v2", "control", "v3");
        assertThat(invocationsOf("control")).isEqualTo(1);
        assertThat(invocationsOf("v2")).isEqualTo(1);
        assertThat(invocationsOf("v3")).isEqualTo(1);
    }

    @Test
    void Ordered_정책은_지정_순서로_재시도() throws Exception {
        // given
        variants.put("CheckoutVariant", "v2");
        ExperimentRegistry registry = registryBuilder()
            .add(threeWay(succeeding("control"),
                failing("v2", new IllegalStateException("v2")),
                succeeding("v3"))
                .onErrorRedirectAndReplayOrdered("v3", "control")
                .build())
            .build();

        // when
        Object result = new DefaultExperimentDispatcher(registry).dispatch(total("cart-9"));

        // then
        assertThat(result).isEqualTo("v3:cart-9");
        assertThat(lastAssignment().executedKey()).isEqualTo("v3");
        assertThat(lastAssignment().fallback()).isTrue();
    }

    // ============================================================
    // Kill Switch 우선순위
    // ============================================================

    @Test
    void 선택된_Trial이_비활성화되면_기본_Trial_실행_선택_Key는_유지() throws Exception {
        // given
        variants.put("CheckoutVariant", "v2");
        killSwitch.disableTrial(CheckoutService.class, "v2");
        ExperimentRegistry registry = registryBuilder()
            .add(threeWay(succeeding("control"), succeeding("v2"), succeeding("v3")).build())
            .build();

        // when
        Object result = new DefaultExperimentDispatcher(registry).dispatch(total("cart-1"));

        // then
        assertThat(result).isEqualTo("control:cart-1");
        assertThat(invocationsOf("v2")).isZero();
        TrialAssignment assignment = lastAssignment();
        assertThat(assignment.selectedKey()).isEqualTo("v2");
        assertThat(assignment.executedKey()).isEqualTo("control");
        assertThat(assignment.reason()).isEqualTo(RoutingReason.TRIAL_DISABLED);
        assertThat(observed).singleElement().satisfies(ctx -> {
            assertThat(ctx.selectedKey()).isEqualTo("v2");
            assertThat(ctx.trialKey()).isEqualTo("control");
        });
    }

    @Test
    void Fallback_후보에서_비활성화된_Trial은_제외() throws Exception {
        // given
        variants.put("CheckoutVariant", "v2");
        ExperimentRegistry registry = registryBuilder()
            .add(ExperimentDefinition.builder("checkout-three-way", CheckoutService.class)
                .condition("v3", ctx -> succeeding("v3"))
                .control("control", ctx -> succeeding("control"))
                .condition("v2", ctx -> failing("v2", new IllegalStateException("v2")))
                .usingVariantFlag("CheckoutVariant")
                .onErrorRedirectAndReplayAny()
                .build())
            .build();
        killSwitch.disableTrial(CheckoutService.class, "v3");

        // when
        Object result = new DefaultExperimentDispatcher(registry).dispatch(total("cart-1"));

        // then
        assertThat(result).isEqualTo("control:cart-1");
        assertThat(observed).extracting(InvocationContext::trialKey).containsExactly("v2", "control");
        assertThat(invocationsOf("v3")).isZero();
    }

    @Test
    void Kill_Switch_조회_실패는_기본_Trial로_라우팅() throws Exception {
        // given
        flags.put("UseV2", true);
        killSwitch.failing = true;
        ExperimentRegistry registry = registryBuilder().add(checkoutV2(succeeding("true")).build()).build();

        // when
        Object result = new DefaultExperimentDispatcher(registry).dispatch(total("cart-1"));

        // then
        assertThat(result).isEqualTo("control:cart-1");
        assertThat(lastAssignment().reason()).isEqualTo(RoutingReason.EXPERIMENT_DISABLED);
    }

    // ============================================================
    // Selection 오류 복구
    // ============================================================

    @Test
    void Selection_예외는_호출자에게_노출되지_않음() throws Exception {
        // given
        ExperimentRegistry registry = registryBuilder()
            .featureFlagSource((flag, ctx) -> {
                throw new IllegalStateException("flag service unreachable");
            })
            .add(checkoutV2(succeeding("true")).build())
            .build();

        // when
        Object result = new DefaultExperimentDispatcher(registry).dispatch(total("cart-1"));

        // then
        assertThat(result).isEqualTo("control:cart-1");
        assertThat(lastAssignment().reason()).isEqualTo(RoutingReason.SELECTION_FAILED);
        assertThat(lastAssignment().selectedKey()).isEqualTo("control");
    }

    @Test
    void 등록되지_않은_변형은_기본_Trial() throws Exception {
        // given
        variants.put("CheckoutVariant", "v9");
        ExperimentRegistry registry = registryBuilder()
            .add(threeWay(succeeding("control"), succeeding("v2"), succeeding("v3")).build())
            .build();

        // when
        Object result = new DefaultExperimentDispatcher(registry).dispatch(total("cart-1"));

        // then
        assertThat(result).isEqualTo("control:cart-1");
        assertThat(lastAssignment().reason()).isEqualTo(RoutingReason.UNKNOWN_TRIAL);
    }

    @Test
    void Audit_Sink_예외는_결과에_영향_없음() throws Exception {
        // given
        flags.put("UseV2", true);
        ExperimentRegistry registry = registryBuilder()
            .auditSink(assignment -> {
                throw new IllegalStateException("audit queue full");
            })
            .add(checkoutV2(succeeding("true")).build())
            .build();

        // when & then
        assertThat(new DefaultExperimentDispatcher(registry).dispatch(total("cart-1"))).isEqualTo("true:cart-1");
    }

    @Test
    void 등록되지_않은_서비스_타입은_예외() {
        ExperimentRegistry registry = registryBuilder().build();

        assertThatThrownBy(() -> new DefaultExperimentDispatcher(registry).dispatch(total("cart-1")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("No experiment registered for");
        assertThat(registry.isRegistered(CheckoutService.class)).isFalse();
    }

    @Test
    void 등록되지_않은_서비스_타입은_비동기_호출에서도_즉시_거부되고_기록하지_않음() {
        ExperimentRegistry registry = registryBuilder().build();
        DefaultExperimentDispatcher dispatcher = new DefaultExperimentDispatcher(registry);

        assertThatThrownBy(() -> dispatcher.dispatchAsync(total("cart-1")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("No experiment registered for " + CheckoutService.class.getName());
        assertThat(assignments).isEmpty();
        assertThat(observed).isEmpty();
    }

    // ============================================================
    // Sticky Routing
    // ============================================================

    @Test
    void 같은_Subject는_항상_같은_Trial() throws Exception {
        // given
        ExperimentRegistry registry = registryBuilder()
            .add(threeWay(succeeding("control"), succeeding("v2"), succeeding("v3"))
                .usingStickyRouting("checkout-rollout")
                .build())
            .build();
        DefaultExperimentDispatcher dispatcher = new DefaultExperimentDispatcher(registry);
        String expected = StickyTrialRouter.selectTrial("user-17", "checkout-rollout", List.of("control", "v2", "v3"));
        ResolutionContext subject = ResolutionContext.of(Map.of(Subject.class, new Subject("user-17")));

        // when & then
        for (int i = 0; i < 20; i++) {
            Object result = dispatcher.dispatch(total("cart-" + i).withResolutionContext(subject));
            assertThat(result).isEqualTo(expected + ":cart-" + i);
        }
    }

    @Test
    void Subject가_없으면_기본_Trial() throws Exception {
        ExperimentRegistry registry = registryBuilder()
            .add(threeWay(succeeding("control"), succeeding("v2"), succeeding("v3")).usingStickyRouting().build())
            .build();

        Object result = new DefaultExperimentDispatcher(registry).dispatch(total("cart-1"));

        assertThat(result).isEqualTo("control:cart-1");
        assertThat(lastAssignment().reason()).isEqualTo(RoutingReason.SELECTED);
    }

    @Test
    void 동시_호출에서도_Subject별_배정이_일정() throws Exception {
        // given
        ExperimentRegistry registry = registryBuilder()
            .add(threeWay(succeeding("control"), succeeding("v2"), succeeding("v3"))
                .usingStickyRouting("checkout-rollout")
                .build())
            .build();
        DefaultExperimentDispatcher dispatcher = new DefaultExperimentDispatcher(registry);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        List<Future<Boolean>> results = new CopyOnWriteArrayList<>();

        // when
        try {
            for (int i = 0; i < 400; i++) {
                String subjectId = "user-" + (i % 40);
                results.add(pool.submit(() -> {
                    ResolutionContext subject = ResolutionContext.of(Map.of(Subject.class, new Subject(subjectId)));
                    Object result = dispatcher.dispatch(total("cart").withResolutionContext(subject));
                    String expected = StickyTrialRouter.selectTrial(subjectId, "checkout-rollout",
                        List.of("control", "v2", "v3"));
                    return (expected + ":cart").equals(result);
                }));
            }

            // then
            for (Future<Boolean> result : results) {
                assertThat(result.get(10, TimeUnit.SECONDS)).isTrue();
            }
            assertThat(assignments).hasSize(400);
        } finally {
            pool.shutdownNow();
        }
    }

    // ============================================================
    // 비동기 Trial
    // ============================================================

    private static DispatchRequest<AsyncQuoteService> quote(String sku) {
        return DispatchRequest.of(AsyncQuoteService.class, "quote", new Object[] {sku}, trial -> trial.quote(sku));
    }

    @Test
    void 비동기_Trial_실패_시_Fallback() throws Exception {
        // given
        variants.put("QuoteVariant", "v2");
        ExperimentRegistry registry = registryBuilder()
            .add(ExperimentDefinition.builder("quote", AsyncQuoteService.class)
                .control("control", ctx -> sku -> CompletableFuture.supplyAsync(() -> "control:" + sku))
                .condition("v2", ctx -> sku -> CompletableFuture.supplyAsync(() -> {
                    throw new IllegalStateException("v2 quote failed");
                }))
                .usingVariantFlag("QuoteVariant")
                .onErrorRedirectAndReplayDefault()
                .build())
            .build();

        // when
        Object result = new DefaultExperimentDispatcher(registry).dispatchAsync(quote("sku-1"))
            .get(5, TimeUnit.SECONDS);

        // then
        assertThat(result).isEqualTo("control:sku-1");
        assertThat(lastAssignment().fallback()).isTrue();
    }

    @Test
    void 호출자_취소는_진행_중인_Trial로_전달되고_Fallback을_시작하지_않음() {
        // given
        variants.put("QuoteVariant", "v2");
        CompletableFuture<String> pending = new CompletableFuture<>();
        AtomicInteger controlCalls = new AtomicInteger();
        ExperimentRegistry registry = registryBuilder()
            .add(ExperimentDefinition.builder("quote", AsyncQuoteService.class)
                .control("control", ctx -> sku -> {
                    controlCalls.incrementAndGet();
                    return CompletableFuture.completedFuture("control:" + sku);
                })
                .condition("v2", ctx -> sku -> pending)
                .usingVariantFlag("QuoteVariant")
                .onErrorRedirectAndReplayDefault()
                .build())
            .build();
        CompletableFuture<Object> call = new DefaultExperimentDispatcher(registry).dispatchAsync(quote("sku-1"));

        // when
        call.cancel(true);

        // then
        assertThat(call.isCancelled()).isTrue();
        assertThat(pending.isCancelled()).isTrue();
        assertThat(controlCalls).hasValue(0);
        assertThat(lastAssignment().executedKey()).isEqualTo("v2");
        assertThat(lastAssignment().isFailed()).isTrue();
    }

    @Test
    void 라우팅_결정은_Trial_실행_전에_확정() {
        // given
        variants.put("CheckoutVariant", "v2");
        killSwitch.disableTrial(CheckoutService.class, "v2");
        ExperimentRegistry registry = registryBuilder()
            .add(threeWay(succeeding("control"), succeeding("v2"), succeeding("v3")).build())
            .build();
        DefaultExperimentDispatcher dispatcher = new DefaultExperimentDispatcher(registry);

        // when
        RoutingDecision decision = dispatcher.route(registry.getRegistration(CheckoutService.class),
            ResolutionContext.empty());

        // then
        assertThat(decision).isEqualTo(new RoutingDecision("v2", "control", RoutingReason.TRIAL_DISABLED));
        assertThat(decision.isForcedToDefault()).isTrue();
    }
}
