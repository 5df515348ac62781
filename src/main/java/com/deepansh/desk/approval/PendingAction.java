package com.deepansh.desk.approval;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A side-effecting call waiting for a human decision.
 *
 * The parameter map is a deep, unmodifiable snapshot taken at construction,
 * so later edits to the worker's fields never leak into an action that is
 * already under review.
 */
public record PendingAction(String actionId,
                            String actionName,
                            String workerType,
                            Map<String, Object> parameters,
                            String summary,
                            Instant createdAt) {

    public static final String TOTAL_AMOUNT = "totalAmount";

    public PendingAction {
        parameters = snapshot(parameters);
    }

    /** Total in yen, or -1 when the action carries no total. */
    public long totalAmount() {
        Object total = parameters.get(TOTAL_AMOUNT);
        return total instanceof Number n ? n.longValue() : -1;
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> snapshot(Map<String, Object> source) {
        if (source == null) {
            return Collections.emptyMap();
        }
        return (Map<String, Object>) deepCopy(source);
    }

    private static Object deepCopy(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(String.valueOf(k), deepCopy(v)));
            return Collections.unmodifiableMap(copy);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            list.forEach(v -> copy.add(deepCopy(v)));
            return Collections.unmodifiableList(copy);
        }
        return value;
    }
}
