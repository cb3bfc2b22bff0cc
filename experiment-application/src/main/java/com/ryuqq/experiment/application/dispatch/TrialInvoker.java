package com.ryuqq.experiment.application.dispatch;

import java.util.concurrent.CompletionStage;

/**
 * 선택된 Trial 구현체에 실제 메서드 호출을 수행하는 함수.
 *
 * <p>동기 메서드는 이미 완료된 Stage를, 비동기 메서드는 구현체가 반환한 Stage를 그대로 반환합니다.
 * 동기적으로 던진 예외는 해당 시도의 실패로 처리됩니다.</p>
 *
 * @param <S> 서비스 인터페이스 타입
 * @author Experiment Dispatch Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface TrialInvoker<S> {

    /**
     * Trial 호출.
     *
     * @param trial 이번 시도의 구현체
     * @return 호출 결과 Stage (null 불가)
     * @throws Exception 구현체가 던진 예외
     */
    CompletionStage<?> invoke(S trial) throws Exception;
}
