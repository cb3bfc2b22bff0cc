/**
 * 설정 오류 예외.
 *
 * <p>호출 경로에서는 던져지지 않습니다. Registry 빌드 시점 전용입니다.</p>
 *
 * @since 1.0.0
 * @author Experiment Dispatch Team
 */
package com.ryuqq.experiment.core.exception;
