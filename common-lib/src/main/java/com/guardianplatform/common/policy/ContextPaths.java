package com.guardianplatform.common.policy;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Dotted-path lookups and value comparisons over a nested evaluation context.
 *
 * <p>Numbers compare by value regardless of boxed type, so a rule written with
 * {@code 1000} matches a context value of {@code 1000.0}. Booleans never equal numbers.
 *
 * <p>Stateless and thread-safe.
 */
public final class ContextPaths {

    private ContextPaths() {}

    /**
     * Descends {@code path} segment by segment through nested maps.
     *
     * @return the resolved value, or empty when any segment is missing, null, or
     *         reached through a non-map value
     */
    public static Optional<Object> resolve(Map<String, ?> context, String path) {
        if (context == null || path == null || path.isEmpty()) {
            return Optional.empty();
        }
        Object current = context;
        for (String segment : path.split("\\.")) {
            if (!(current instanceof Map<?, ?> map)) {
                return Optional.empty();
            }
            current = map.get(segment);
            if (current == null) {
                return Optional.empty();
            }
        }
        return Optional.of(current);
    }

    public static boolean valuesEqual(Object actual, Object expected) {
        if (isNumber(actual) && isNumber(expected)) {
            return Double.compare(((Number) actual).doubleValue(), ((Number) expected).doubleValue()) == 0;
        }
        return Objects.equals(actual, expected);
    }

    /** True for numeric values; booleans are not numbers here. */
    public static boolean isNumber(Object value) {
        return value instanceof Number;
    }
}
