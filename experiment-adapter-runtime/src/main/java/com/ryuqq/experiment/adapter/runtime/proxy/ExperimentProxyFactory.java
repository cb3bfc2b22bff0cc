package com.ryuqq.experiment.adapter.runtime.proxy;

import com.ryuqq.experiment.application.dispatch.DefaultExperimentDispatcher;
import com.ryuqq.experiment.application.dispatch.ExperimentDispatcher;
import com.ryuqq.experiment.application.registry.ExperimentRegistry;
import com.ryuqq.experiment.core.context.ResolutionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.util.concurrent.CompletableFuture;

/**
 * Experiment Proxy Factory.
 *
 * <p>등록된 서비스 인터페이스의 구현체를 {@link Proxy}로 만들어 반환합니다. 호출자는 인터페이스만 알고,
 * 어떤 Trial이 실행되는지는 호출마다 Dispatcher가 결정합니다.</p>
 *
 * <p><strong>생성 시 검증 (호출 시점이 아님):</strong></p>
 * <ul>
 *   <li>serviceType은 인터페이스여야 함</li>
 *   <li>Registry에 등록되어 있어야 함</li>
 *   <li>{@link java.util.concurrent.CompletionStage}를 반환하는 메서드의 반환 타입은
 *       {@link CompletableFuture}를 담을 수 있어야 함</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * ExperimentProxyFactory proxies = new ExperimentProxyFactory(registry);
 * TaxProvider taxProvider = proxies.create(TaxProvider.class);
 * BigDecimal tax = taxProvider.calculate(order);
 * }</pre>
 *
 * @author Experiment Dispatch Team
 * @since 1.0.0
 */
public final class ExperimentProxyFactory {

    private static final Logger log = LoggerFactory.getLogger(ExperimentProxyFactory.class);

    private final ExperimentRegistry registry;
    private final ExperimentDispatcher dispatcher;

    /**
     * 생성자 (기본 Dispatcher).
     *
     * @param registry 빌드된 Registry
     */
    public ExperimentProxyFactory(ExperimentRegistry registry) {
        this(registry, new DefaultExperimentDispatcher(registry));
    }

    /**
     * 생성자.
     *
     * @param registry 빌드된 Registry
     * @param dispatcher 호출을 처리할 Dispatcher
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public ExperimentProxyFactory(ExperimentRegistry registry, ExperimentDispatcher dispatcher) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (dispatcher == null) {
            throw new IllegalArgumentException("dispatcher cannot be null");
        }
        this.registry = registry;
        this.dispatcher = dispatcher;
    }

    /**
     * Proxy 생성 (Registry의 기본 Resolution Context 사용).
     *
     * @param serviceType 서비스 인터페이스 타입
     * @param <S> 서비스 타입
     * @return 서비스 구현 Proxy
     * @throws IllegalArgumentException 검증 실패 시
     */
    public <S> S create(Class<S> serviceType) {
        return create(serviceType, null);
    }

    /**
     * Proxy 생성.
     *
     * @param serviceType 서비스 인터페이스 타입
     * @param resolutionContext 이 Proxy로 들어오는 호출의 Resolution Context (null이면 Registry 기본값)
     * @param <S> 서비스 타입
     * @return 서비스 구현 Proxy
     * @throws IllegalArgumentException 검증 실패 시
     */
    public <S> S create(Class<S> serviceType, ResolutionContext resolutionContext) {
        validate(serviceType);
        Object proxy = Proxy.newProxyInstance(
            serviceType.getClassLoader(),
            new Class<?>[] {serviceType},
            new ExperimentInvocationHandler<>(serviceType, dispatcher, resolutionContext)
        );
        log.debug("Created experiment proxy for {}", serviceType.getName());
        return serviceType.cast(proxy);
    }

    /**
     * 주어진 객체가 이 라이브러리의 Experiment Proxy인지 확인.
     *
     * @param candidate 확인할 객체
     * @return Experiment Proxy이면 true
     */
    public static boolean isExperimentProxy(Object candidate) {
        return candidate != null
            && Proxy.isProxyClass(candidate.getClass())
            && Proxy.getInvocationHandler(candidate) instanceof ExperimentInvocationHandler;
    }

    private void validate(Class<?> serviceType) {
        if (serviceType == null) {
            throw new IllegalArgumentException("serviceType cannot be null");
        }
        if (!serviceType.isInterface()) {
            throw new IllegalArgumentException("serviceType must be an interface: " + serviceType.getName());
        }
        if (!registry.isRegistered(serviceType)) {
            throw new IllegalArgumentException("No experiment registered for " + serviceType.getName());
        }
        for (Method method : serviceType.getMethods()) {
            if (ExperimentInvocationHandler.isAsync(method)
                    && !method.getReturnType().isAssignableFrom(CompletableFuture.class)) {
                throw new IllegalArgumentException("Unsupported async return type " + method.getReturnType().getName()
                    + " on " + serviceType.getName() + "." + method.getName()
                    + " (use CompletionStage or CompletableFuture)");
            }
        }
    }
}
