package com.ryuqq.experiment.core.decorator;

import com.ryuqq.experiment.core.context.InvocationContext;

import java.util.concurrent.CompletionStage;

/**
 * 각 Trial 시도를 감싸는 미들웨어.
 *
 * <p>Decorator는 Registry 빌드 시 한 번 생성되어 모든 호출에서 공유되므로
 * 상태가 없거나 내부적으로 thread-safe해야 합니다.</p>
 *
 * <p><strong>구현 규칙:</strong></p>
 * <ul>
 *   <li>{@code next.proceed()}는 정확히 한 번 호출 (의도적인 short-circuit 제외)</li>
 *   <li>동기 완료를 가정하지 않음: 결과는 항상 Stage로 합성</li>
 *   <li>{@code context}는 읽기 전용</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * ExperimentDecorator logging = (context, next) -> {
 *     log.info("calling {} on trial {}", context.methodName(), context.trialKey());
 *     return next.proceed();
 * };
 * }</pre>
 *
 * @author Experiment Dispatch Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ExperimentDecorator {

    /**
     * 시도 한 건을 감싸서 실행.
     *
     * @param context 이번 시도의 호출 Context
     * @param next 체인의 나머지
     * @return 결과 Stage
     */
    CompletionStage<Object> invoke(InvocationContext context, InvocationChain next);
}
