package com.ryuqq.experiment.application.dispatch;

import com.ryuqq.experiment.core.context.ResolutionContext;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Dispatcher 호출 요청.
 *
 * @param serviceType 등록된 서비스 인터페이스 타입
 * @param methodName 호출된 메서드 이름
 * @param arguments 원래 호출 인자 (null 원소 허용)
 * @param invoker 구현체 호출 함수
 * @param resolutionContext 이번 호출의 Resolution Context (null이면 Registry 기본값)
 * @param <S> 서비스 타입
 *
 * @author Experiment Dispatch Team
 * @since 1.0.0
 */
public record DispatchRequest<S>(
    Class<S> serviceType,
    String methodName,
    List<Object> arguments,
    TrialInvoker<S> invoker,
    ResolutionContext resolutionContext
) {

    public DispatchRequest {
        if (serviceType == null) {
            throw new IllegalArgumentException("serviceType cannot be null");
        }
        if (methodName == null || methodName.isBlank()) {
            throw new IllegalArgumentException("methodName cannot be null or blank");
        }
        if (invoker == null) {
            throw new IllegalArgumentException("invoker cannot be null");
        }
        arguments = arguments == null
            ? List.of()
            : Collections.unmodifiableList(Arrays.asList(arguments.toArray()));
        // resolutionContext는 null 허용
    }

    /**
     * 요청 생성.
     *
     * @param serviceType 서비스 타입
     * @param methodName 메서드 이름
     * @param arguments 호출 인자 (null 가능)
     * @param invoker 구현체 호출 함수
     * @param <S> 서비스 타입
     * @return DispatchRequest
     */
    public static <S> DispatchRequest<S> of(
            Class<S> serviceType, String methodName, Object[] arguments, TrialInvoker<S> invoker) {
        return new DispatchRequest<>(
            serviceType, methodName, arguments == null ? null : Arrays.asList(arguments), invoker, null);
    }

    public DispatchRequest<S> withResolutionContext(ResolutionContext context) {
        return new DispatchRequest<>(serviceType, methodName, arguments, invoker, context);
    }
}
