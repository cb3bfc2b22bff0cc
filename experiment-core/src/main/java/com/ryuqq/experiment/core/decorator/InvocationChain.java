package com.ryuqq.experiment.core.decorator;

import java.util.concurrent.CompletionStage;

/**
 * Decorator 체인의 나머지 부분 (다음 Decorator 또는 실제 Trial 호출).
 *
 * @author Experiment Dispatch Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface InvocationChain {

    /**
     * 체인의 다음 단계 실행.
     *
     * @return 호출 결과 Stage (void 메서드는 null 값으로 완료)
     */
    CompletionStage<Object> proceed();
}
