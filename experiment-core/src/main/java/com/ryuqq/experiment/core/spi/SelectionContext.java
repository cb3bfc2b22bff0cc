package com.ryuqq.experiment.core.spi;

import com.ryuqq.experiment.core.context.ResolutionContext;

import java.util.List;

/**
 * Selection Provider에 전달되는 입력.
 *
 * @param serviceType 서비스 인터페이스 타입
 * @param selectorName 플래그 이름 / 설정 키 (Registry 빌드 시 확정)
 * @param trialKeys 등록 순서의 Trial Key
 * @param defaultKey 기본 Trial Key
 * @param resolutionContext 현재 호출의 Resolution Context
 *
 * @author Experiment Dispatch Team
 * @since 1.0.0
 */
public record SelectionContext(
    Class<?> serviceType,
    String selectorName,
    List<String> trialKeys,
    String defaultKey,
    ResolutionContext resolutionContext
) {

    public SelectionContext {
        if (serviceType == null) {
            throw new IllegalArgumentException("serviceType cannot be null");
        }
        if (selectorName == null) {
            throw new IllegalArgumentException("selectorName cannot be null");
        }
        if (trialKeys == null || trialKeys.isEmpty()) {
            throw new IllegalArgumentException("trialKeys cannot be null or empty");
        }
        if (defaultKey == null) {
            throw new IllegalArgumentException("defaultKey cannot be null");
        }
        trialKeys = List.copyOf(trialKeys);
        resolutionContext = resolutionContext == null ? ResolutionContext.empty() : resolutionContext;
    }
}
