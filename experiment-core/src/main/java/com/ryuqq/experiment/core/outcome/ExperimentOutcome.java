package com.ryuqq.experiment.core.outcome;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Trial 실행 한 건에서 수집된 측정값.
 *
 * @param id 고유 ID
 * @param experimentName Experiment 이름
 * @param trialKey 실행된 Trial Key
 * @param subjectId 대상 식별자 (없으면 "anonymous")
 * @param metricName 메트릭 이름
 * @param type 측정값 종류
 * @param value 측정값
 * @param timestamp 수집 시각
 * @param metadata 부가 정보 (불변)
 *
 * @author Experiment Dispatch Team
 * @since 1.0.0
 */
public record ExperimentOutcome(
    String id,
    String experimentName,
    String trialKey,
    String subjectId,
    String metricName,
    OutcomeType type,
    double value,
    Instant timestamp,
    Map<String, String> metadata
) {

    /**
     * subjectId를 알 수 없을 때 사용하는 값.
     */
    public static final String ANONYMOUS_SUBJECT = "anonymous";

    public ExperimentOutcome {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (experimentName == null || trialKey == null || metricName == null) {
            throw new IllegalArgumentException("experimentName, trialKey and metricName cannot be null");
        }
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp cannot be null");
        }
        subjectId = subjectId == null || subjectId.isBlank() ? ANONYMOUS_SUBJECT : subjectId;
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    /**
     * 새 ID로 Outcome 생성.
     */
    public static ExperimentOutcome of(
        String experimentName,
        String trialKey,
        String subjectId,
        String metricName,
        OutcomeType type,
        double value,
        Instant timestamp,
        Map<String, String> metadata
    ) {
        return new ExperimentOutcome(
            UUID.randomUUID().toString(), experimentName, trialKey, subjectId,
            metricName, type, value, timestamp, metadata
        );
    }
}
