/**
 * 호출 단위 컨텍스트 패키지.
 *
 * <p>{@link com.ryuqq.experiment.core.context.InvocationContext}는 시도마다 새로 만들어져
 * Decorator Chain을 따라 값으로 전달되고, {@link com.ryuqq.experiment.core.context.TrialAssignment}는
 * 호출 완료 후 Audit Sink에 전달됩니다.</p>
 *
 * @since 1.0.0
 * @author Experiment Dispatch Team
 */
package com.ryuqq.experiment.core.context;
