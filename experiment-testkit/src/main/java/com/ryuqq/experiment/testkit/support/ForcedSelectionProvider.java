package com.ryuqq.experiment.testkit.support;

import com.ryuqq.experiment.core.spi.SelectionContext;
import com.ryuqq.experiment.core.spi.SelectionModeProvider;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 테스트용 Custom Selection Mode Provider.
 *
 * <p>서비스 타입마다 실행할 Trial Key를 직접 지정합니다. 지정되지 않은 타입은 기본 Trial로 라우팅됩니다.
 * 존재하지 않는 Key를 지정하면 Dispatcher의 {@code UNKNOWN_TRIAL} 경로를 재현할 수 있고,
 * {@link #failWith(Class, RuntimeException)}로 {@code SELECTION_FAILED} 경로를 재현할 수 있습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * ForcedSelectionProvider forced = new ForcedSelectionProvider();
 * ExperimentRegistry registry = ExperimentRegistry.builder()
 *     .selectionModeProvider(forced)
 *     .add(ExperimentDefinition.builder("tax", TaxProvider.class)
 *         .control("control", ctx -> new LegacyTax())
 *         .condition("v2", ctx -> new NewTax())
 *         .usingCustomMode(ForcedSelectionProvider.MODE_IDENTIFIER, null)
 *         .build())
 *     .build();
 *
 * forced.force(TaxProvider.class, "v2");
 * }</pre>
 *
 * <p>Thread-safe.</p>
 *
 * @author Experiment Dispatch Team
 * @since 1.0.0
 */
public final class ForcedSelectionProvider implements SelectionModeProvider {

    public static final String MODE_IDENTIFIER = "Test";

    private final String modeIdentifier;
    private final Map<Class<?>, String> forcedKeys = new ConcurrentHashMap<>();
    private final Map<Class<?>, RuntimeException> failures = new ConcurrentHashMap<>();
    private final AtomicInteger selectionCount = new AtomicInteger();

    public ForcedSelectionProvider() {
        this(MODE_IDENTIFIER);
    }

    /**
     * 식별자 지정 생성자 (한 Registry에 여러 개를 등록할 때).
     *
     * @param modeIdentifier 모드 식별자
     */
    public ForcedSelectionProvider(String modeIdentifier) {
        this.modeIdentifier = modeIdentifier;
    }

    @Override
    public String modeIdentifier() {
        return modeIdentifier;
    }

    @Override
    public Optional<String> selectTrialKey(SelectionContext context) {
        selectionCount.incrementAndGet();
        RuntimeException failure = failures.get(context.serviceType());
        if (failure != null) {
            throw failure;
        }
        return Optional.ofNullable(forcedKeys.get(context.serviceType()));
    }

    /**
     * 서비스 타입의 Trial 고정.
     *
     * @param serviceType 서비스 타입
     * @param trialKey 선택할 Key (등록되지 않은 Key도 허용)
     * @return this
     */
    public ForcedSelectionProvider force(Class<?> serviceType, String trialKey) {
        if (serviceType == null) {
            throw new IllegalArgumentException("serviceType cannot be null");
        }
        if (trialKey == null) {
            throw new IllegalArgumentException("trialKey cannot be null");
        }
        forcedKeys.put(serviceType, trialKey);
        return this;
    }

    /**
     * 서비스 타입의 선택이 예외를 던지도록 설정.
     *
     * @param serviceType 서비스 타입
     * @param failure 던질 예외
     * @return this
     */
    public ForcedSelectionProvider failWith(Class<?> serviceType, RuntimeException failure) {
        if (serviceType == null) {
            throw new IllegalArgumentException("serviceType cannot be null");
        }
        if (failure == null) {
            throw new IllegalArgumentException("failure cannot be null");
        }
        failures.put(serviceType, failure);
        return this;
    }

    /**
     * 고정 / 실패 설정 해제. 이후 기본 Trial로 라우팅됩니다.
     *
     * @param serviceType 서비스 타입
     * @return this
     */
    public ForcedSelectionProvider release(Class<?> serviceType) {
        forcedKeys.remove(serviceType);
        failures.remove(serviceType);
        return this;
    }

    public void reset() {
        forcedKeys.clear();
        failures.clear();
        selectionCount.set(0);
    }

    /**
     * 지금까지 선택이 요청된 횟수.
     *
     * @return 횟수
     */
    public int getSelectionCount() {
        return selectionCount.get();
    }
}
