package com.ryuqq.experiment.core.context;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 불변 Map 기반 {@link ResolutionContext}.
 *
 * <p>정확히 일치하는 타입으로 먼저 조회하고, 없으면 할당 가능한 첫 항목을 반환합니다.</p>
 *
 * @author Experiment Dispatch Team
 * @since 1.0.0
 */
public final class SimpleResolutionContext implements ResolutionContext {

    static final SimpleResolutionContext EMPTY = new SimpleResolutionContext(Map.of());

    private final Map<Class<?>, Object> entries;

    SimpleResolutionContext(Map<Class<?>, Object> entries) {
        if (entries == null) {
            throw new IllegalArgumentException("entries cannot be null");
        }
        for (Map.Entry<Class<?>, Object> entry : entries.entrySet()) {
            if (!entry.getKey().isInstance(entry.getValue())) {
                throw new IllegalArgumentException(
                    "entry is not an instance of " + entry.getKey().getName() + ": " + entry.getValue());
            }
        }
        this.entries = Map.copyOf(entries);
    }

    /**
     * Builder 생성.
     *
     * @return Builder
     */
    public static Builder builder() {
        return new Builder();
    }

    @Override
    public <T> Optional<T> lookup(Class<T> type) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        Object exact = entries.get(type);
        if (exact != null) {
            return Optional.of(type.cast(exact));
        }
        return entries.values().stream()
            .filter(type::isInstance)
            .findFirst()
            .map(type::cast);
    }

    @Override
    public String toString() {
        return "SimpleResolutionContext{" + entries.keySet() + '}';
    }

    /**
     * SimpleResolutionContext Builder.
     */
    public static final class Builder {

        private final Map<Class<?>, Object> entries = new HashMap<>();

        private Builder() {
        }

        public <T> Builder register(Class<T> type, T instance) {
            if (type == null) {
                throw new IllegalArgumentException("type cannot be null");
            }
            if (instance == null) {
                throw new IllegalArgumentException("instance cannot be null");
            }
            entries.put(type, instance);
            return this;
        }

        public SimpleResolutionContext build() {
            return new SimpleResolutionContext(entries);
        }
    }
}
