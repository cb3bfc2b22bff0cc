/**
 * 외부 상태 없는 결정적 라우팅 함수.
 *
 * @since 1.0.0
 * @author Experiment Dispatch Team
 */
package com.ryuqq.experiment.core.routing;
