package com.deepansh.desk.context;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable, ordered carrier of request-scoped values (requester identity,
 * session id, ...) that travel beside the natural-language input, never
 * inside it.
 *
 * A bag is never mutated after construction. Children obtain a derived bag
 * through {@link ContextPropagator#propagate(ContextBag, Map)}.
 */
public final class ContextBag {

    private static final ContextBag EMPTY = new ContextBag(Map.of());

    private final Map<String, String> values;

    private ContextBag(Map<String, String> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static ContextBag empty() {
        return EMPTY;
    }

    public static ContextBag of(String key, String value) {
        Map<String, String> map = new LinkedHashMap<>();
        map.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
        return new ContextBag(map);
    }

    public static ContextBag of(Map<String, String> values) {
        if (values == null || values.isEmpty()) {
            return EMPTY;
        }
        values.forEach((k, v) -> {
            Objects.requireNonNull(k, "key");
            Objects.requireNonNull(v, "value for " + k);
        });
        return new ContextBag(values);
    }

    public Optional<String> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    public String getOrDefault(String key, String defaultValue) {
        return values.getOrDefault(key, defaultValue);
    }

    public boolean contains(String key) {
        return values.containsKey(key);
    }

    /** Read-only view, in insertion order. */
    public Map<String, String> asMap() {
        return values;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ContextBag other)) return false;
        return values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    /** Lists keys only; values may identify a person and stay out of logs. */
    @Override
    public String toString() {
        return "ContextBag" + values.keySet();
    }
}
