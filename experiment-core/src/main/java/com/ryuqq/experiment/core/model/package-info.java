/**
 * Experiment 정의 모델 패키지.
 *
 * <p>작성 시점에 만들어지고 이후 변경되지 않는 값 객체들입니다.</p>
 *
 * <h2>주요 타입</h2>
 * <ul>
 *   <li>{@link com.ryuqq.experiment.core.model.ExperimentDefinition} - Experiment 정의와 Fluent Builder</li>
 *   <li>{@link com.ryuqq.experiment.core.model.TrialDefinition} - Trial Key + 구현체 Factory</li>
 *   <li>{@link com.ryuqq.experiment.core.model.SelectionRule} - 선택 모드 + Selector 이름</li>
 *   <li>{@link com.ryuqq.experiment.core.model.ActivationWindow} - 활성 시간 구간</li>
 *   <li>{@link com.ryuqq.experiment.core.model.KillSwitchState} - Kill Switch 스냅샷</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Experiment Dispatch Team
 */
package com.ryuqq.experiment.core.model;
