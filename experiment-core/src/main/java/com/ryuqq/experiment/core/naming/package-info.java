/**
 * Naming Convention: 서비스 타입 → 기본 플래그 이름 / 설정 키.
 *
 * @since 1.0.0
 * @author Experiment Dispatch Team
 */
package com.ryuqq.experiment.core.naming;
