/**
 * SPI 구현체용 Contract Test 기반 클래스.
 *
 * @since 1.0.0
 * @author Experiment Dispatch Team
 */
package com.ryuqq.experiment.testkit.contract;
