package com.ryuqq.experiment.core.context;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 단일 시도(attempt)의 불변 호출 메타데이터.
 *
 * <p>Decorator 체인을 따라 전달되며 절대 변경되지 않습니다.
 * Fallback 시도마다 {@link #forAttempt(String, int)}로 새 인스턴스가 만들어집니다.</p>
 *
 * <ul>
 *   <li>{@code selectedKey}: Selection Mode가 고른 Key (Kill Switch 적용 전)</li>
 *   <li>{@code trialKey}: 이번 시도에서 실제로 실행되는 Key</li>
 *   <li>{@code arguments}: 원래 호출 인자 (순서 유지, null 원소 허용)</li>
 *   <li>{@code attempt}: 1부터 시작하는 시도 번호</li>
 * </ul>
 *
 * @param serviceType 서비스 인터페이스 타입
 * @param experimentName Experiment 이름
 * @param methodName 호출된 메서드 이름
 * @param selectedKey Selection Mode가 선택한 Trial Key
 * @param trialKey 실행되는 Trial Key
 * @param arguments 호출 인자
 * @param attempt 시도 번호 (1부터)
 *
 * @author Experiment Dispatch Team
 * @since 1.0.0
 */
public record InvocationContext(
    Class<?> serviceType,
    String experimentName,
    String methodName,
    String selectedKey,
    String trialKey,
    List<Object> arguments,
    int attempt
) {

    public InvocationContext {
        if (serviceType == null) {
            throw new IllegalArgumentException("serviceType cannot be null");
        }
        if (experimentName == null || experimentName.isBlank()) {
            throw new IllegalArgumentException("experimentName cannot be null or blank");
        }
        if (methodName == null || methodName.isBlank()) {
            throw new IllegalArgumentException("methodName cannot be null or blank");
        }
        if (selectedKey == null || selectedKey.isEmpty()) {
            throw new IllegalArgumentException("selectedKey cannot be null or empty");
        }
        if (trialKey == null || trialKey.isEmpty()) {
            throw new IllegalArgumentException("trialKey cannot be null or empty");
        }
        if (attempt <= 0) {
            throw new IllegalArgumentException("attempt must be positive (current: " + attempt + ")");
        }
        arguments = arguments == null
            ? List.of()
            : Collections.unmodifiableList(Arrays.asList(arguments.toArray()));
    }

    /**
     * 첫 번째 시도용 Context 생성.
     *
     * @param serviceType 서비스 타입
     * @param experimentName Experiment 이름
     * @param methodName 메서드 이름
     * @param selectedKey 선택된 Key
     * @param trialKey 실행할 Key
     * @param arguments 호출 인자 (null 가능)
     * @return InvocationContext
     */
    public static InvocationContext of(
            Class<?> serviceType,
            String experimentName,
            String methodName,
            String selectedKey,
            String trialKey,
            Object[] arguments) {
        List<Object> args = arguments == null ? List.of() : Arrays.asList(arguments);
        return new InvocationContext(serviceType, experimentName, methodName, selectedKey, trialKey, args, 1);
    }

    /**
     * 다른 Trial로의 시도를 나타내는 새 Context 생성.
     *
     * @param trialKey 실행할 Trial Key
     * @param attempt 시도 번호
     * @return 새 InvocationContext
     */
    public InvocationContext forAttempt(String trialKey, int attempt) {
        return new InvocationContext(serviceType, experimentName, methodName, selectedKey, trialKey, arguments, attempt);
    }

    /**
     * 선택된 Key와 다른 Trial을 실행 중인지 확인.
     *
     * @return trialKey != selectedKey 이면 true
     */
    public boolean isRedirected() {
        return !trialKey.equals(selectedKey);
    }
}
