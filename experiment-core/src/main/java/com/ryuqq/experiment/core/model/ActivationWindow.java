package com.ryuqq.experiment.core.model;

import java.time.Instant;
import java.util.Optional;

/**
 * Experiment 활성 시간 구간.
 *
 * <p>양 끝 모두 선택 사항이며 경계 시각은 활성으로 간주합니다.</p>
 *
 * @param activeFrom 활성 시작 시각 (null 가능)
 * @param activeUntil 활성 종료 시각 (null 가능)
 *
 * @author Experiment Dispatch Team
 * @since 1.0.0
 */
public record ActivationWindow(Instant activeFrom, Instant activeUntil) {

    /**
     * 제한 없는 구간.
     */
    public static final ActivationWindow ALWAYS = new ActivationWindow(null, null);

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException activeFrom이 activeUntil보다 늦은 경우
     */
    public ActivationWindow {
        if (activeFrom != null && activeUntil != null && activeFrom.isAfter(activeUntil)) {
            throw new IllegalArgumentException(
                "activeFrom must not be after activeUntil (from: " + activeFrom + ", until: " + activeUntil + ")");
        }
    }

    /**
     * 주어진 시각이 구간 안에 있는지 확인.
     *
     * @param now 기준 시각
     * @return now &lt; activeFrom 이거나 now &gt; activeUntil 이면 false
     */
    public boolean contains(Instant now) {
        if (now == null) {
            throw new IllegalArgumentException("now cannot be null");
        }
        if (activeFrom != null && now.isBefore(activeFrom)) {
            return false;
        }
        return activeUntil == null || !now.isAfter(activeUntil);
    }

    public Optional<Instant> from() {
        return Optional.ofNullable(activeFrom);
    }

    public Optional<Instant> until() {
        return Optional.ofNullable(activeUntil);
    }

    public ActivationWindow withActiveFrom(Instant activeFrom) {
        return new ActivationWindow(activeFrom, this.activeUntil);
    }

    public ActivationWindow withActiveUntil(Instant activeUntil) {
        return new ActivationWindow(this.activeFrom, activeUntil);
    }
}
