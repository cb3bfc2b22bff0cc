package com.ryuqq.experiment.adapter.inmemory.source;

import com.ryuqq.experiment.core.context.ResolutionContext;
import com.ryuqq.experiment.core.spi.FeatureFlagSource;

import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory {@link FeatureFlagSource}.
 *
 * <p>Unknown flags evaluate to false. Thread-safe; flags may be flipped while calls are in flight.</p>
 *
 * @author Experiment Dispatch Team
 * @since 1.0.0
 */
public class InMemoryFeatureFlagSource implements FeatureFlagSource {

    private final ConcurrentHashMap<String, Boolean> flags = new ConcurrentHashMap<>();

    @Override
    public boolean isEnabled(String flagName, ResolutionContext context) {
        return flagName != null && flags.getOrDefault(flagName, Boolean.FALSE);
    }

    /**
     * Sets a flag.
     *
     * @param flagName flag name
     * @param enabled value
     * @return this
     */
    public InMemoryFeatureFlagSource set(String flagName, boolean enabled) {
        if (flagName == null || flagName.isBlank()) {
            throw new IllegalArgumentException("flagName cannot be null or blank");
        }
        flags.put(flagName, enabled);
        return this;
    }

    public void remove(String flagName) {
        flags.remove(flagName);
    }

    public void clear() {
        flags.clear();
    }
}
