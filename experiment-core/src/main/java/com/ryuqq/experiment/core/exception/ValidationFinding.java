package com.ryuqq.experiment.core.exception;

/**
 * Registry 빌드 시 발견된 설정 오류 한 건.
 *
 * @param experimentName 관련 Experiment 이름 (Registry 수준 오류면 null)
 * @param message 오류 설명
 *
 * @author Experiment Dispatch Team
 * @since 1.0.0
 */
public record ValidationFinding(String experimentName, String message) {

    public ValidationFinding {
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
    }

    @Override
    public String toString() {
        return experimentName == null ? message : "[" + experimentName + "] " + message;
    }
}
