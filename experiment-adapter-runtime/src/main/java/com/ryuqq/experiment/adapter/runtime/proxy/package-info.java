/**
 * 호출 진입점: {@link java.lang.reflect.Proxy} 기반 Experiment Proxy.
 *
 * <p>Proxy는 호출 정보(메서드 이름, 인자)와 Trial 호출 함수를 만들어 Dispatcher에 넘기는 일만 합니다.
 * 라우팅 규칙은 모두 experiment-application에 있습니다.</p>
 *
 * @since 1.0.0
 * @author Experiment Dispatch Team
 */
package com.ryuqq.experiment.adapter.runtime.proxy;
