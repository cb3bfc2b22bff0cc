package com.ryuqq.experiment.core.exception;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Registry 빌드 시 설정 오류가 하나 이상 발견되면 던져지는 예외.
 *
 * <p>모든 오류를 한 번에 모아서 보고합니다. 호출 시점이 아니라 빌드 시점에만 발생합니다.</p>
 *
 * @author Experiment Dispatch Team
 * @since 1.0.0
 */
public class ExperimentConfigurationException extends RuntimeException {

    private final List<ValidationFinding> findings;

    public ExperimentConfigurationException(List<ValidationFinding> findings) {
        super(format(findings));
        this.findings = List.copyOf(findings);
    }

    public List<ValidationFinding> getFindings() {
        return findings;
    }

    private static String format(List<ValidationFinding> findings) {
        if (findings == null || findings.isEmpty()) {
            throw new IllegalArgumentException("findings cannot be null or empty");
        }
        return findings.stream()
            .map(ValidationFinding::toString)
            .collect(Collectors.joining("; ", "Invalid experiment configuration (" + findings.size() + "): ", ""));
    }
}
