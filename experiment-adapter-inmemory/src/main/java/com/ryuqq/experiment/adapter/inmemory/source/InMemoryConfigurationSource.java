package com.ryuqq.experiment.adapter.inmemory.source;

import com.ryuqq.experiment.core.spi.ConfigurationSource;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory {@link ConfigurationSource} backed by a key/value map.
 *
 * @author Experiment Dispatch Team
 * @since 1.0.0
 */
public class InMemoryConfigurationSource implements ConfigurationSource {

    private final ConcurrentHashMap<String, String> values = new ConcurrentHashMap<>();

    public InMemoryConfigurationSource() {
    }

    /**
     * Creates a source pre-filled with values.
     *
     * @param initialValues initial key/value pairs
     */
    public InMemoryConfigurationSource(Map<String, String> initialValues) {
        if (initialValues == null) {
            throw new IllegalArgumentException("initialValues cannot be null");
        }
        values.putAll(initialValues);
    }

    @Override
    public Optional<String> valueOf(String key) {
        return key == null ? Optional.empty() : Optional.ofNullable(values.get(key));
    }

    public InMemoryConfigurationSource set(String key, String value) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key cannot be null or blank");
        }
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        values.put(key, value);
        return this;
    }

    public void remove(String key) {
        values.remove(key);
    }
}
