package com.ryuqq.experiment.application.activation;

import com.ryuqq.experiment.core.context.ResolutionContext;
import com.ryuqq.experiment.core.model.ActivationWindow;
import com.ryuqq.experiment.core.spi.ActivationPredicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;

/**
 * Activation Gate.
 *
 * <p>Experiment가 지금 "살아 있는지" 판단합니다. 시간 구간과 사용자 정의 조건을 AND로 결합합니다.</p>
 *
 * <p><strong>판단 규칙:</strong></p>
 * <ol>
 *   <li>now &lt; activeFrom 또는 now &gt; activeUntil → 비활성</li>
 *   <li>조건이 있고 false 반환 → 비활성</li>
 *   <li>조건이 예외를 던짐 → 비활성 (WARN 로그)</li>
 *   <li>그 외 → 활성</li>
 * </ol>
 *
 * <p>비활성이면 Dispatcher는 Selection Mode와 Kill Switch를 보지 않고 기본 Trial로 라우팅합니다.</p>
 *
 * @author Experiment Dispatch Team
 * @since 1.0.0
 */
public final class ActivationGate {

    private static final Logger log = LoggerFactory.getLogger(ActivationGate.class);

    private final Clock clock;

    /**
     * 생성자.
     *
     * @param clock 현재 시각 기준
     * @throws IllegalArgumentException clock이 null인 경우
     */
    public ActivationGate(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.clock = clock;
    }

    /**
     * 현재 시각 기준 활성 여부.
     *
     * @param window 활성 시간 구간
     * @param predicate 사용자 정의 조건 (null 가능)
     * @param context 현재 호출의 Resolution Context
     * @return 활성이면 true
     */
    public boolean isActive(ActivationWindow window, ActivationPredicate predicate, ResolutionContext context) {
        return isActive(window, predicate, clock.instant(), context);
    }

    /**
     * 주어진 시각 기준 활성 여부.
     *
     * @param window 활성 시간 구간
     * @param predicate 사용자 정의 조건 (null 가능)
     * @param now 기준 시각
     * @param context 현재 호출의 Resolution Context
     * @return 활성이면 true
     */
    public boolean isActive(ActivationWindow window, ActivationPredicate predicate, Instant now, ResolutionContext context) {
        if (window == null) {
            throw new IllegalArgumentException("window cannot be null");
        }
        if (!window.contains(now)) {
            return false;
        }
        if (predicate == null) {
            return true;
        }
        try {
            return predicate.isActive(context);
        } catch (RuntimeException e) {
            log.warn("Activation predicate failed, treating experiment as inactive", e);
            return false;
        }
    }

    public Clock getClock() {
        return clock;
    }
}
