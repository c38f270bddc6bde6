package com.guardianplatform.common.policy.constraint;

import com.guardianplatform.common.exception.PolicyConfigurationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns the raw {@code path → value|map} constraint form into typed {@link Constraint}s.
 *
 * <h3>Mapping</h3>
 * <ul>
 *   <li>map with {@code min}/{@code max} → {@link RangeConstraint}</li>
 *   <li>map with {@code eq}/{@code neq}  → {@link EqualityConstraint} (one per key)</li>
 *   <li>boolean                         → {@link BooleanConstraint}</li>
 *   <li>number                          → {@link UpperBoundConstraint}</li>
 *   <li>any other scalar                → {@link EqualityConstraint}</li>
 * </ul>
 * A map may combine range and equality keys; each produces its own entry, in the order
 * range, eq, neq. Anything else is rejected with {@link PolicyConfigurationException}.
 */
public final class ConstraintCompiler {

    private static final Set<String> KNOWN_KEYS = Set.of("min", "max", "eq", "neq");

    private ConstraintCompiler() {}

    public static List<PathConstraint> compile(String ruleName, Map<String, ?> rawConstraint) {
        if (rawConstraint == null) {
            return List.of();
        }
        List<PathConstraint> compiled = new ArrayList<>();
        rawConstraint.forEach((path, value) -> {
            if (path == null || path.isBlank()) {
                throw new PolicyConfigurationException("Rule '" + ruleName + "' has a blank constraint path");
            }
            compiled.addAll(compileEntry(ruleName, path, value));
        });
        return Collections.unmodifiableList(compiled);
    }

    private static List<PathConstraint> compileEntry(String ruleName, String path, Object value) {
        if (value == null) {
            throw new PolicyConfigurationException(
                "Rule '" + ruleName + "' has a null constraint for path '" + path + "'");
        }
        if (value instanceof Map<?, ?> map) {
            return compileOperatorMap(ruleName, path, map);
        }
        if (value instanceof Boolean b) {
            return List.of(new PathConstraint(path, new BooleanConstraint(b)));
        }
        if (value instanceof Number n) {
            return List.of(new PathConstraint(path, new UpperBoundConstraint(n)));
        }
        return List.of(new PathConstraint(path, EqualityConstraint.equalTo(value)));
    }

    private static List<PathConstraint> compileOperatorMap(String ruleName, String path, Map<?, ?> map) {
        for (Object key : map.keySet()) {
            if (!KNOWN_KEYS.contains(String.valueOf(key))) {
                throw new PolicyConfigurationException("Rule '" + ruleName + "' uses unknown operator '"
                    + key + "' on path '" + path + "' (expected min, max, eq or neq)");
            }
        }
        if (map.isEmpty()) {
            throw new PolicyConfigurationException(
                "Rule '" + ruleName + "' has an empty operator map on path '" + path + "'");
        }

        List<PathConstraint> out = new ArrayList<>();
        if (map.containsKey("min") || map.containsKey("max")) {
            Double min = map.containsKey("min") ? bound(ruleName, path, "min", map.get("min")) : null;
            Double max = map.containsKey("max") ? bound(ruleName, path, "max", map.get("max")) : null;
            if (min != null && max != null && min > max) {
                throw new PolicyConfigurationException(
                    "Rule '" + ruleName + "' has min > max on path '" + path + "'");
            }
            out.add(new PathConstraint(path, new RangeConstraint(min, max)));
        }
        if (map.containsKey("eq")) {
            out.add(new PathConstraint(path, EqualityConstraint.equalTo(map.get("eq"))));
        }
        if (map.containsKey("neq")) {
            out.add(new PathConstraint(path, EqualityConstraint.notEqualTo(map.get("neq"))));
        }
        return out;
    }

    private static Double bound(String ruleName, String path, String key, Object raw) {
        if (raw instanceof Number n) {
            return n.doubleValue();
        }
        throw new PolicyConfigurationException("Rule '" + ruleName + "' has non-numeric '" + key
            + "' bound on path '" + path + "': " + raw);
    }
}
