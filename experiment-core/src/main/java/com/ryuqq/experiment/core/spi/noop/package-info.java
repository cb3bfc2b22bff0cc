/**
 * SPI NoOp 구현 패키지.
 *
 * <p>선택적 협력 객체가 설정되지 않았을 때 Registry가 사용하는 기본값입니다.</p>
 *
 * @since 1.0.0
 * @author Experiment Dispatch Team
 */
package com.ryuqq.experiment.core.spi.noop;
