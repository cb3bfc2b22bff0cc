/**
 * 테스트 지원 도구: 강제 Trial 선택과 호출 흐름 기록.
 *
 * @since 1.0.0
 * @author Experiment Dispatch Team
 */
package com.ryuqq.experiment.testkit.support;
