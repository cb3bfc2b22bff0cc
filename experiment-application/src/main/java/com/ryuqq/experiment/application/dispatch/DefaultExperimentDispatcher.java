package com.ryuqq.experiment.application.dispatch;

import com.ryuqq.experiment.application.policy.CancellationScope;
import com.ryuqq.experiment.application.policy.ErrorPolicyExecutor;
import com.ryuqq.experiment.application.policy.PolicyOutcome;
import com.ryuqq.experiment.application.registry.ExperimentRegistration;
import com.ryuqq.experiment.application.registry.ExperimentRegistry;
import com.ryuqq.experiment.application.selection.SelectionResult;
import com.ryuqq.experiment.core.context.InvocationContext;
import com.ryuqq.experiment.core.context.ResolutionContext;
import com.ryuqq.experiment.core.context.RoutingReason;
import com.ryuqq.experiment.core.context.TrialAssignment;
import com.ryuqq.experiment.core.spi.KillSwitchProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.UndeclaredThrowableException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;

/**
 * 기본 Dispatcher 구현체.
 *
 * <p>전용 스케줄러가 없습니다. 모든 결정은 호출 스레드에서 내려지고, 동기 Trial은 호출 스레드에서 실행됩니다.
 * 공유 상태는 불변 {@link ExperimentRegistry}와 {@link KillSwitchProvider}뿐입니다.</p>
 *
 * <p><strong>후보 Trial 규칙:</strong></p>
 * <ul>
 *   <li>비활성 / Experiment Kill Switch: 기본 Trial 하나만 시도</li>
 *   <li>그 외: Error Policy 후보 중 Kill Switch로 비활성화된 Trial은 건너뜀 (기본 Trial은 항상 허용)</li>
 * </ul>
 *
 * <p><strong>Kill Switch 조회 실패:</strong> 비활성화된 것으로 간주하여 기본 Trial로 라우팅합니다 (WARN 로그).</p>
 *
 * @author Experiment Dispatch Team
 * @since 1.0.0
 */
public final class DefaultExperimentDispatcher implements ExperimentDispatcher {

    private static final Logger log = LoggerFactory.getLogger(DefaultExperimentDispatcher.class);

    private final ExperimentRegistry registry;
    private final ErrorPolicyExecutor policyExecutor;

    /**
     * 생성자.
     *
     * @param registry 빌드된 Registry
     * @throws IllegalArgumentException registry가 null인 경우
     */
    public DefaultExperimentDispatcher(ExperimentRegistry registry) {
        this(registry, new ErrorPolicyExecutor());
    }

    /**
     * 생성자 (Policy Executor 지정).
     *
     * @param registry 빌드된 Registry
     * @param policyExecutor Error Policy Executor
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public DefaultExperimentDispatcher(ExperimentRegistry registry, ErrorPolicyExecutor policyExecutor) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (policyExecutor == null) {
            throw new IllegalArgumentException("policyExecutor cannot be null");
        }
        this.registry = registry;
        this.policyExecutor = policyExecutor;
    }

    @Override
    public <S> Object dispatch(DispatchRequest<S> request) throws Exception {
        CompletableFuture<Object> result = dispatchAsync(request);
        try {
            return result.join();
        } catch (CompletionException e) {
            throw asException(ErrorPolicyExecutor.unwrap(e));
        }
    }

    @Override
    public <S> CompletableFuture<Object> dispatchAsync(DispatchRequest<S> request) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        ExperimentRegistration<S> registration = registry.getRegistration(request.serviceType());
        ResolutionContext context = request.resolutionContext() != null
            ? request.resolutionContext()
            : registry.getResolutionContext();

        // 1. 라우팅 결정 (Gate → Experiment Kill Switch → Selection → Trial Kill Switch)
        RoutingDecision decision = route(registration, context);

        // 2. Error Policy 후보
        List<String> candidates = candidates(registration, decision);

        // 3. 호출자 취소 → 진행 중인 시도로 전달
        CancellationScope scope = new CancellationScope();
        CompletableFuture<Object> caller = new CompletableFuture<>();
        caller.whenComplete((value, error) -> {
            if (caller.isCancelled()) {
                scope.cancel();
            }
        });

        InvocationContext invocation = new InvocationContext(
            registration.getServiceType(),
            registration.getName(),
            request.methodName(),
            decision.selectedKey(),
            decision.preferredKey(),
            request.arguments(),
            1
        );

        // 4. 시도마다 Decorator Chain으로 감싸서 실행
        policyExecutor.execute(
                candidates,
                (trialKey, attempt) -> registry.getDecoratorChain().execute(
                    invocation.forAttempt(trialKey, attempt),
                    () -> invokeTrial(registration, request.invoker(), trialKey, context, scope)),
                scope)
            .whenComplete((outcome, error) -> {
                PolicyOutcome finalOutcome = error == null
                    ? outcome
                    : new PolicyOutcome.Failed(decision.preferredKey(), ErrorPolicyExecutor.unwrap(error), 0);
                complete(registration, request, decision, finalOutcome, caller);
            });

        return caller;
    }

    /**
     * 라우팅 결정.
     *
     * @param registration 대상 Registration
     * @param context 현재 호출의 Resolution Context
     * @return RoutingDecision
     */
    <S> RoutingDecision route(ExperimentRegistration<S> registration, ResolutionContext context) {
        String defaultKey = registration.getDefaultKey();

        if (!registry.getActivationGate().isActive(
                registration.getActivationWindow(), registration.getActivationPredicate(), context)) {
            return new RoutingDecision(defaultKey, defaultKey, RoutingReason.INACTIVE);
        }

        if (isExperimentDisabled(registration)) {
            return new RoutingDecision(defaultKey, defaultKey, RoutingReason.EXPERIMENT_DISABLED);
        }

        SelectionResult selection = registry.getSelectionEvaluator()
            .evaluate(registration.getSelectionProvider(), registration.selectionContext(context));
        if (selection.isRecovered()) {
            return new RoutingDecision(defaultKey, defaultKey, selection.reason());
        }

        String selectedKey = selection.trialKey();
        if (!selectedKey.equals(defaultKey) && isTrialDisabled(registration, selectedKey)) {
            return new RoutingDecision(selectedKey, defaultKey, RoutingReason.TRIAL_DISABLED);
        }
        return new RoutingDecision(selectedKey, selectedKey, RoutingReason.SELECTED);
    }

    private <S> List<String> candidates(ExperimentRegistration<S> registration, RoutingDecision decision) {
        String defaultKey = registration.getDefaultKey();
        if (decision.reason() == RoutingReason.INACTIVE || decision.reason() == RoutingReason.EXPERIMENT_DISABLED) {
            return List.of(defaultKey);
        }

        List<String> policyCandidates = registration.getErrorPolicy()
            .candidateKeys(decision.preferredKey(), defaultKey, registration.getTrialKeys());
        List<String> candidates = new ArrayList<>(policyCandidates.size());
        for (String key : policyCandidates) {
            if (key.equals(decision.preferredKey()) || key.equals(defaultKey) || !isTrialDisabled(registration, key)) {
                candidates.add(key);
            }
        }
        return candidates;
    }

    private <S> CompletionStage<Object> invokeTrial(
            ExperimentRegistration<S> registration,
            TrialInvoker<S> invoker,
            String trialKey,
            ResolutionContext context,
            CancellationScope scope) {
        try {
            S trial = registration.createTrial(trialKey, context);
            CompletionStage<?> stage = invoker.invoke(trial);
            if (stage == null) {
                return CompletableFuture.failedFuture(
                    new IllegalStateException("Trial '" + trialKey + "' returned no result stage"));
            }
            scope.track(stage);
            return stage.thenApply(value -> (Object) value);
        } catch (Throwable e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private <S> void complete(
            ExperimentRegistration<S> registration,
            DispatchRequest<S> request,
            RoutingDecision decision,
            PolicyOutcome outcome,
            CompletableFuture<Object> caller) {
        Throwable failure = outcome instanceof PolicyOutcome.Failed failed ? failed.cause() : null;

        try {
            audit(new TrialAssignment(
                registration.getName(),
                registration.getServiceType(),
                request.methodName(),
                decision.selectedKey(),
                outcome.executedKey(),
                !outcome.executedKey().equals(decision.selectedKey()),
                decision.reason(),
                registry.getClock().instant(),
                failure
            ));

            log.debug("Dispatched {}.{}: selected='{}', executed='{}', reason={}, attempts={}, failed={}",
                registration.getName(), request.methodName(), decision.selectedKey(),
                outcome.executedKey(), decision.reason(), outcome.attempts(), failure != null);
        } finally {
            if (outcome instanceof PolicyOutcome.Succeeded succeeded) {
                caller.complete(succeeded.value());
            } else {
                caller.completeExceptionally(failure);
            }
        }
    }

    private void audit(TrialAssignment assignment) {
        try {
            registry.getAuditSink().record(assignment);
        } catch (RuntimeException e) {
            log.warn("Audit sink failed for experiment '{}' (executed: '{}')",
                assignment.experimentName(), assignment.executedKey(), e);
        }
    }

    private boolean isExperimentDisabled(ExperimentRegistration<?> registration) {
        try {
            return registry.getKillSwitchProvider().isExperimentDisabled(registration.getServiceType());
        } catch (RuntimeException e) {
            log.warn("Kill switch lookup failed for experiment '{}', routing to default trial",
                registration.getName(), e);
            return true;
        }
    }

    private boolean isTrialDisabled(ExperimentRegistration<?> registration, String trialKey) {
        try {
            return registry.getKillSwitchProvider().isTrialDisabled(registration.getServiceType(), trialKey);
        } catch (RuntimeException e) {
            log.warn("Kill switch lookup failed for trial '{}' of experiment '{}', treating it as disabled",
                trialKey, registration.getName(), e);
            return true;
        }
    }

    private static Exception asException(Throwable failure) {
        if (failure instanceof Exception exception) {
            return exception;
        }
        if (failure instanceof Error error) {
            throw error;
        }
        return new UndeclaredThrowableException(failure);
    }
}
