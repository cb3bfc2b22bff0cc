package com.ryuqq.experiment.adapter.runtime.decorator;

import java.time.Duration;

/**
 * 내장 Decorator 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>benchmarkEnabled: 시도별 소요 시간 측정 (기본 true)</li>
 *   <li>errorLoggingEnabled: 실패한 시도의 구조화 ERROR 로그 (기본 true)</li>
 *   <li>outcomeCollectionEnabled: 성공/실패/소요 시간 Outcome 기록 (기본 false, OutcomeStore 필요)</li>
 *   <li>timeout: 시도별 제한 시간 (기본 null = 제한 없음, 비동기 Trial에만 적용)</li>
 * </ul>
 *
 * @author Experiment Dispatch Team
 * @since 1.0.0
 * @param benchmarkEnabled 소요 시간 측정 여부
 * @param errorLoggingEnabled 오류 로그 여부
 * @param outcomeCollectionEnabled Outcome 수집 여부
 * @param timeout 시도별 제한 시간 (null 가능, 양수여야 함)
 */
public record DecoratorConfig(
    boolean benchmarkEnabled,
    boolean errorLoggingEnabled,
    boolean outcomeCollectionEnabled,
    Duration timeout
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: benchmark=true, errorLogging=true, outcomeCollection=false, timeout=없음</p>
     */
    public DecoratorConfig() {
        this(true, true, false, null);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException timeout이 0 이하인 경우
     */
    public DecoratorConfig {
        if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
            throw new IllegalArgumentException("timeout must be positive (current: " + timeout + ")");
        }
    }

    /**
     * 모든 내장 Decorator를 끈 설정.
     *
     * @return DecoratorConfig
     */
    public static DecoratorConfig disabled() {
        return new DecoratorConfig(false, false, false, null);
    }

    public DecoratorConfig withBenchmarkEnabled(boolean benchmarkEnabled) {
        return new DecoratorConfig(benchmarkEnabled, errorLoggingEnabled, outcomeCollectionEnabled, timeout);
    }

    public DecoratorConfig withErrorLoggingEnabled(boolean errorLoggingEnabled) {
        return new DecoratorConfig(benchmarkEnabled, errorLoggingEnabled, outcomeCollectionEnabled, timeout);
    }

    public DecoratorConfig withOutcomeCollectionEnabled(boolean outcomeCollectionEnabled) {
        return new DecoratorConfig(benchmarkEnabled, errorLoggingEnabled, outcomeCollectionEnabled, timeout);
    }

    public DecoratorConfig withTimeout(Duration timeout) {
        return new DecoratorConfig(benchmarkEnabled, errorLoggingEnabled, outcomeCollectionEnabled, timeout);
    }

    public boolean hasTimeout() {
        return timeout != null;
    }
}
