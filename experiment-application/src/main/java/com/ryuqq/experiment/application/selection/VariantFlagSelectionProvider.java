package com.ryuqq.experiment.application.selection;

import com.ryuqq.experiment.core.model.SelectionMode;
import com.ryuqq.experiment.core.naming.NamingConvention;
import com.ryuqq.experiment.core.spi.SelectionContext;
import com.ryuqq.experiment.core.spi.SelectionModeProvider;
import com.ryuqq.experiment.core.spi.VariantFlagSource;

import java.util.Optional;

/**
 * {@code VariantFlag} 모드. Variant 이름을 그대로 Trial Key로 사용합니다.
 *
 * @author Experiment Dispatch Team
 * @since 1.0.0
 */
public final class VariantFlagSelectionProvider implements SelectionModeProvider {

    private final VariantFlagSource variantFlagSource;

    public VariantFlagSelectionProvider(VariantFlagSource variantFlagSource) {
        if (variantFlagSource == null) {
            throw new IllegalArgumentException("variantFlagSource cannot be null");
        }
        this.variantFlagSource = variantFlagSource;
    }

    @Override
    public String modeIdentifier() {
        return SelectionMode.VARIANT_FLAG.builtInIdentifier();
    }

    @Override
    public Optional<String> selectTrialKey(SelectionContext context) {
        return variantFlagSource.variantOf(context.selectorName(), context.resolutionContext())
            .filter(variant -> !variant.isBlank());
    }

    @Override
    public String defaultSelectorName(Class<?> serviceType, NamingConvention convention) {
        return convention.variantFlagNameFor(serviceType);
    }
}
