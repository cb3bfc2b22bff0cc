package com.ryuqq.experiment.application.dispatch;

import java.util.concurrent.CompletableFuture;

/**
 * Experiment Dispatcher.
 *
 * <p>등록된 서비스 인터페이스로 들어온 호출을 Trial 하나(또는 Fallback 시퀀스)로 라우팅합니다.</p>
 *
 * <p><strong>호출 흐름:</strong></p>
 * <ol>
 *   <li>Activation Gate 비활성 → 기본 Trial</li>
 *   <li>Experiment Kill Switch → 기본 Trial</li>
 *   <li>Selection Mode 평가 (실패 시 기본 Trial), 선택된 Trial이 Kill Switch면 기본 Trial</li>
 *   <li>Error Policy 후보마다 Decorator Chain으로 감싼 시도 실행</li>
 *   <li>첫 성공 결과 반환, 또는 정책이 정한 최종 예외 전달</li>
 *   <li>Audit Sink에 TrialAssignment 한 건 전달</li>
 * </ol>
 *
 * <p>Thread-safe: 동시에 임의 개수의 호출을 처리할 수 있습니다.</p>
 *
 * <p><strong>사전 조건:</strong> {@code request.serviceType()}은 Registry에 등록된 타입이어야 합니다.
 * 등록되지 않은 타입은 라우팅 실패가 아니라 호출자의 프로그래밍 오류이며,
 * Trial 실행과 Audit 기록 없이 즉시 {@link IllegalArgumentException}으로 거부됩니다.
 * Proxy 경로는 생성 시점에 등록 여부를 검증하므로 호출 시점에는 이 예외가 발생하지 않습니다.
 * 직접 호출하는 경우 {@code ExperimentRegistry#isRegistered(Class)}로 먼저 확인할 수 있습니다.</p>
 *
 * @author Experiment Dispatch Team
 * @since 1.0.0
 */
public interface ExperimentDispatcher {

    /**
     * 동기 호출.
     *
     * <p>동기 Trial은 호출 스레드에서 실행됩니다. 비동기 Trial이면 완료까지 대기합니다.</p>
     *
     * @param request 호출 요청
     * @param <S> 서비스 타입
     * @return 성공한 Trial의 결과 (null 가능)
     * @throws Exception 정책상 최종 실패한 Trial의 예외 (래핑하지 않음)
     * @throws IllegalArgumentException 등록되지 않은 서비스 타입인 경우 (사전 조건 위반, Trial 미실행)
     */
    <S> Object dispatch(DispatchRequest<S> request) throws Exception;

    /**
     * 비동기 호출.
     *
     * <p>반환된 Future를 취소하면 진행 중인 시도에 취소가 전달되고 이후 Fallback은 시작되지 않습니다.</p>
     *
     * @param request 호출 요청
     * @param <S> 서비스 타입
     * @return 결과 Future (최종 실패 시 해당 예외로 예외 완료)
     * @throws IllegalArgumentException 등록되지 않은 서비스 타입인 경우 (Future를 반환하지 않고 즉시 발생)
     */
    <S> CompletableFuture<Object> dispatchAsync(DispatchRequest<S> request);
}
