package com.ryuqq.experiment.application.policy;

import java.util.concurrent.CompletionStage;

/**
 * 특정 Trial Key로 시도 한 번을 시작하는 함수.
 *
 * @author Experiment Dispatch Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface AttemptFunction {

    /**
     * 시도 시작.
     *
     * @param trialKey 실행할 Trial Key
     * @param attempt 시도 번호 (1부터)
     * @return 시도 결과 Stage
     */
    CompletionStage<Object> attempt(String trialKey, int attempt);
}
