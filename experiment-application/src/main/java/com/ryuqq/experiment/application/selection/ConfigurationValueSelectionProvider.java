package com.ryuqq.experiment.application.selection;

import com.ryuqq.experiment.core.model.SelectionMode;
import com.ryuqq.experiment.core.naming.NamingConvention;
import com.ryuqq.experiment.core.spi.ConfigurationSource;
import com.ryuqq.experiment.core.spi.SelectionContext;
import com.ryuqq.experiment.core.spi.SelectionModeProvider;

import java.util.Optional;

/**
 * {@code ConfigurationValue} 모드.
 *
 * <p>설정 값을 그대로 Trial Key로 사용합니다. 값이 없거나 공백이면 기본 Trial,
 * 등록되지 않은 값이면 Evaluator가 {@code UNKNOWN_TRIAL}로 기록합니다.</p>
 *
 * @author Experiment Dispatch Team
 * @since 1.0.0
 */
public final class ConfigurationValueSelectionProvider implements SelectionModeProvider {

    private final ConfigurationSource configurationSource;

    public ConfigurationValueSelectionProvider(ConfigurationSource configurationSource) {
        if (configurationSource == null) {
            throw new IllegalArgumentException("configurationSource cannot be null");
        }
        this.configurationSource = configurationSource;
    }

    @Override
    public String modeIdentifier() {
        return SelectionMode.CONFIGURATION_VALUE.builtInIdentifier();
    }

    @Override
    public Optional<String> selectTrialKey(SelectionContext context) {
        return configurationSource.valueOf(context.selectorName())
            .filter(value -> !value.isBlank());
    }

    @Override
    public String defaultSelectorName(Class<?> serviceType, NamingConvention convention) {
        return convention.configurationKeyFor(serviceType);
    }
}
