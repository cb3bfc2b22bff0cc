package com.ryuqq.experiment.core.context;

import java.time.Instant;
import java.util.Optional;

/**
 * 완료된 호출 한 건의 Trial 배정 결과 (Audit 이벤트).
 *
 * <p>{@code fallback}은 실제 실행된 Key가 선택된 Key와 다를 때 true입니다.
 * {@code exception}은 최종 실패한 경우에만 존재합니다.</p>
 *
 * @param experimentName Experiment 이름
 * @param serviceType 서비스 타입
 * @param methodName 메서드 이름
 * @param selectedKey Selection Mode가 선택한 Key
 * @param executedKey 마지막으로 실행된 Key
 * @param fallback selectedKey와 executedKey가 다른지 여부
 * @param reason 라우팅 이유
 * @param timestamp 완료 시각
 * @param exception 최종 실패 원인 (null 가능)
 *
 * @author Experiment Dispatch Team
 * @since 1.0.0
 */
public record TrialAssignment(
    String experimentName,
    Class<?> serviceType,
    String methodName,
    String selectedKey,
    String executedKey,
    boolean fallback,
    RoutingReason reason,
    Instant timestamp,
    Throwable exception
) {

    public TrialAssignment {
        if (experimentName == null || experimentName.isBlank()) {
            throw new IllegalArgumentException("experimentName cannot be null or blank");
        }
        if (serviceType == null) {
            throw new IllegalArgumentException("serviceType cannot be null");
        }
        if (selectedKey == null || executedKey == null) {
            throw new IllegalArgumentException("selectedKey and executedKey cannot be null");
        }
        if (reason == null) {
            throw new IllegalArgumentException("reason cannot be null");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp cannot be null");
        }
        // exception은 null 허용
    }

    /**
     * 최종 실패 여부.
     *
     * @return exception이 있으면 true
     */
    public boolean isFailed() {
        return exception != null;
    }

    public Optional<Throwable> failure() {
        return Optional.ofNullable(exception);
    }
}
