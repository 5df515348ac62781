package com.deepansh.desk.context;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Explicit propagation of {@link ContextBag} values across call boundaries.
 *
 * Nothing is inherited implicitly: every caller hands its callee a bag,
 * usually derived from its own with {@link #propagate}.
 */
public final class ContextPropagator {

    private ContextPropagator() {
    }

    /**
     * Returns a new bag holding the union of {@code parent} and
     * {@code additions}. Parent keys survive unless {@code additions}
     * names them. Neither input is modified; a null parent counts as empty.
     */
    public static ContextBag propagate(ContextBag parent, Map<String, String> additions) {
        Map<String, String> merged = new LinkedHashMap<>();
        if (parent != null) {
            merged.putAll(parent.asMap());
        }
        if (additions != null) {
            additions.forEach((k, v) -> {
                if (v != null) {
                    merged.put(k, v);
                }
            });
        }
        return ContextBag.of(merged);
    }

    public static ContextBag propagate(ContextBag parent, String key, String value) {
        Map<String, String> additions = new LinkedHashMap<>();
        additions.put(key, value);
        return propagate(parent, additions);
    }

    /**
     * Like {@link #propagate} but only fills keys the parent does not hold,
     * so an explicit value set by an outer caller is never shadowed.
     */
    public static ContextBag fillMissing(ContextBag parent, Map<String, String> defaults) {
        Map<String, String> additions = new LinkedHashMap<>();
        if (defaults != null) {
            defaults.forEach((k, v) -> {
                if (v != null && (parent == null || !parent.contains(k))) {
                    additions.put(k, v);
                }
            });
        }
        return propagate(parent, additions);
    }

    /**
     * Reads {@code key}, falling back to {@code defaultValue} when the bag is
     * absent or lacks the key. Missing values are a normal path, not an error.
     */
    public static String valueOf(ContextBag bag, String key, String defaultValue) {
        if (bag == null) {
            return defaultValue;
        }
        return bag.getOrDefault(key, defaultValue);
    }
}
