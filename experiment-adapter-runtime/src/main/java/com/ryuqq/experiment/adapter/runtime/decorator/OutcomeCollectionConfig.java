package com.ryuqq.experiment.adapter.runtime.decorator;

/**
 * Outcome 수집 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>collectDuration: DURATION Outcome 기록 (기본 true)</li>
 *   <li>collectErrors: 실패 시 COUNT Outcome 기록 (기본 true)</li>
 *   <li>메트릭 이름: duration / success / error</li>
 * </ul>
 *
 * <p>BINARY 성공 Outcome(성공 1.0, 실패 0.0)은 항상 기록됩니다.</p>
 *
 * @author Experiment Dispatch Team
 * @since 1.0.0
 * @param collectDuration 소요 시간 기록 여부
 * @param collectErrors 오류 횟수 기록 여부
 * @param durationMetricName 소요 시간 메트릭 이름
 * @param successMetricName 성공 메트릭 이름
 * @param errorMetricName 오류 메트릭 이름
 */
public record OutcomeCollectionConfig(
    boolean collectDuration,
    boolean collectErrors,
    String durationMetricName,
    String successMetricName,
    String errorMetricName
) {

    /**
     * 기본 설정 생성자.
     */
    public OutcomeCollectionConfig() {
        this(true, true, "duration", "success", "error");
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 메트릭 이름이 null이거나 공백인 경우
     */
    public OutcomeCollectionConfig {
        requireName(durationMetricName, "durationMetricName");
        requireName(successMetricName, "successMetricName");
        requireName(errorMetricName, "errorMetricName");
    }

    public OutcomeCollectionConfig withCollectDuration(boolean collectDuration) {
        return new OutcomeCollectionConfig(collectDuration, collectErrors, durationMetricName, successMetricName, errorMetricName);
    }

    public OutcomeCollectionConfig withCollectErrors(boolean collectErrors) {
        return new OutcomeCollectionConfig(collectDuration, collectErrors, durationMetricName, successMetricName, errorMetricName);
    }

    public OutcomeCollectionConfig withMetricNames(String durationMetricName, String successMetricName, String errorMetricName) {
        return new OutcomeCollectionConfig(collectDuration, collectErrors, durationMetricName, successMetricName, errorMetricName);
    }

    private static void requireName(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " cannot be null or blank");
        }
    }
}
