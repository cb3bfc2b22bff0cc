package com.ryuqq.experiment.core.model;

/**
 * Kill Switch로 비활성화된 (Experiment, Trial) 쌍.
 *
 * @param serviceType Experiment의 서비스 타입
 * @param trialKey 비활성화된 Trial Key
 *
 * @author Experiment Dispatch Team
 * @since 1.0.0
 */
public record DisabledTrial(Class<?> serviceType, String trialKey) {

    public DisabledTrial {
        if (serviceType == null) {
            throw new IllegalArgumentException("serviceType cannot be null");
        }
        if (trialKey == null || trialKey.isEmpty()) {
            throw new IllegalArgumentException("trialKey cannot be null or empty");
        }
    }
}
