package com.ryuqq.experiment.adapter.inmemory.source;

import com.ryuqq.experiment.core.context.ResolutionContext;
import com.ryuqq.experiment.core.spi.VariantFlagSource;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory {@link VariantFlagSource}. Unknown flags have no variant.
 *
 * @author Experiment Dispatch Team
 * @since 1.0.0
 */
public class InMemoryVariantFlagSource implements VariantFlagSource {

    private final ConcurrentHashMap<String, String> variants = new ConcurrentHashMap<>();

    @Override
    public Optional<String> variantOf(String flagName, ResolutionContext context) {
        return flagName == null ? Optional.empty() : Optional.ofNullable(variants.get(flagName));
    }

    public InMemoryVariantFlagSource set(String flagName, String variant) {
        if (flagName == null || flagName.isBlank()) {
            throw new IllegalArgumentException("flagName cannot be null or blank");
        }
        if (variant == null) {
            throw new IllegalArgumentException("variant cannot be null");
        }
        variants.put(flagName, variant);
        return this;
    }

    public void remove(String flagName) {
        variants.remove(flagName);
    }

    public void clear() {
        variants.clear();
    }
}
