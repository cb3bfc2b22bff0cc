/**
 * 내장 Decorator.
 *
 * <h2>Decorator</h2>
 * <ul>
 *   <li>{@link com.ryuqq.experiment.adapter.runtime.decorator.BenchmarkDecoratorFactory} - 시도별 소요 시간</li>
 *   <li>{@link com.ryuqq.experiment.adapter.runtime.decorator.ErrorLoggingDecoratorFactory} - 실패 시도 ERROR 로그</li>
 *   <li>{@link com.ryuqq.experiment.adapter.runtime.decorator.OutcomeCollectionDecoratorFactory} - Outcome 기록</li>
 *   <li>{@link com.ryuqq.experiment.adapter.runtime.decorator.TimeoutDecoratorFactory} - 시도별 제한 시간</li>
 * </ul>
 *
 * <p>모든 Decorator는 상태를 갖지 않으며 결과를 그대로 전달합니다 (Timeout 제외).
 * {@link com.ryuqq.experiment.adapter.runtime.decorator.StandardDecorators}로 설정에 맞는 목록을 만듭니다.</p>
 *
 * @since 1.0.0
 * @author Experiment Dispatch Team
 */
package com.ryuqq.experiment.adapter.runtime.decorator;
