package com.ryuqq.experiment.adapter.runtime.proxy;

import com.ryuqq.experiment.application.dispatch.DispatchRequest;
import com.ryuqq.experiment.application.dispatch.ExperimentDispatcher;
import com.ryuqq.experiment.application.dispatch.TrialInvoker;
import com.ryuqq.experiment.core.context.ResolutionContext;

import java.lang.reflect.InvocationHandler;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Arrays;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Experiment Proxy의 {@link InvocationHandler}.
 *
 * <p>{@link Object} 메서드는 Proxy 자신이 응답하고, 나머지는 모두 Dispatcher로 전달합니다.</p>
 * <ul>
 *   <li>동기 메서드: {@link ExperimentDispatcher#dispatch}, 최종 예외를 그대로 던짐</li>
 *   <li>{@link CompletionStage} 반환 메서드: {@link ExperimentDispatcher#dispatchAsync}의 Future 반환</li>
 * </ul>
 *
 * @param <S> 서비스 인터페이스 타입
 * @author Experiment Dispatch Team
 * @since 1.0.0
 */
final class ExperimentInvocationHandler<S> implements InvocationHandler {

    private final Class<S> serviceType;
    private final ExperimentDispatcher dispatcher;
    private final ResolutionContext resolutionContext;

    ExperimentInvocationHandler(Class<S> serviceType, ExperimentDispatcher dispatcher, ResolutionContext resolutionContext) {
        this.serviceType = serviceType;
        this.dispatcher = dispatcher;
        this.resolutionContext = resolutionContext;
    }

    @Override
    public Object invoke(Object proxy, Method method, Object[] args) throws Throwable {
        if (method.getDeclaringClass() == Object.class) {
            return invokeObjectMethod(proxy, method, args);
        }

        boolean async = isAsync(method);
        TrialInvoker<S> invoker = trial -> invokeTrial(trial, method, args, async);
        DispatchRequest<S> request = new DispatchRequest<>(
            serviceType,
            method.getName(),
            args == null ? null : Arrays.asList(args),
            invoker,
            resolutionContext
        );

        if (async) {
            return dispatcher.dispatchAsync(request);
        }
        return dispatcher.dispatch(request);
    }

    static boolean isAsync(Method method) {
        return CompletionStage.class.isAssignableFrom(method.getReturnType());
    }

    private static CompletionStage<?> invokeTrial(Object trial, Method method, Object[] args, boolean async) throws Exception {
        if (!Modifier.isPublic(method.getDeclaringClass().getModifiers())) {
            method.trySetAccessible();
        }
        Object result;
        try {
            result = method.invoke(trial, args);
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception exception) {
                throw exception;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw e;
        }

        if (!async) {
            return CompletableFuture.completedFuture(result);
        }
        if (result == null) {
            return CompletableFuture.failedFuture(new IllegalStateException(
                method.getDeclaringClass().getSimpleName() + "." + method.getName()
                    + " returned null instead of a CompletionStage"));
        }
        return (CompletionStage<?>) result;
    }

    private Object invokeObjectMethod(Object proxy, Method method, Object[] args) {
        switch (method.getName()) {
            case "equals":
                return proxy == args[0];
            case "hashCode":
                return System.identityHashCode(proxy);
            case "toString":
                return "ExperimentProxy[" + serviceType.getName() + "]";
            default:
                throw new UnsupportedOperationException("Unsupported Object method on experiment proxy: " + method.getName());
        }
    }
}
