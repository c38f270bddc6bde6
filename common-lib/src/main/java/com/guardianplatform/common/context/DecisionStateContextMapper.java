package com.guardianplatform.common.context;

import com.guardianplatform.common.exception.ContextMappingException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps the map-shaped decision state produced by the orchestrator into the evaluation
 * namespace.
 *
 * <h3>Input keys</h3>
 * <ul>
 *   <li>{@code proposedAction}: {@code actionType}, {@code amount} (or
 *       {@code parameters.amount}), {@code description}</li>
 *   <li>{@code domain}, {@code domainConfidence}, {@code domainEntropy}</li>
 *   <li>{@code context}: user, risk, approval, prediction and data attributes</li>
 * </ul>
 *
 * <p>Absent values take conservative defaults: role {@code junior}, risk {@code LOW},
 * domain {@code Disorder}, confidence 0.0, entropy 1.0, flags {@code false}.
 * Wrongly-typed sections or numerics raise {@link ContextMappingException}.
 */
public final class DecisionStateContextMapper implements StateContextMapper<Map<String, Object>> {

    public static final String PROPOSED_ACTION = "proposedAction";

    @Override
    public Map<String, Object> toContext(Map<String, Object> state) {
        if (state == null) {
            throw new ContextMappingException("Decision state is null");
        }
        Map<String, Object> action = section(state, PROPOSED_ACTION);
        Map<String, Object> ctx = section(state, "context");
        Map<String, Object> parameters = section(action, "parameters");

        Object domain = state.getOrDefault("domain", "Disorder");
        double confidence = number(state, "domainConfidence", 0.0);
        double entropy = number(state, "domainEntropy", 1.0);

        Map<String, Object> out = new LinkedHashMap<>();
        out.put("domain", ordered(
            "type", String.valueOf(domain),
            "confidence", confidence,
            "entropy", entropy));
        out.put("action", ordered(
            "type", action.getOrDefault("actionType", ""),
            "amount", amount(action, parameters),
            "description", action.getOrDefault("description", "")));
        out.put("user", ordered(
            "role", ctx.getOrDefault("userRole", "junior"),
            "id", ctx.getOrDefault("userId", "")));
        out.put("risk", ordered(
            "level", ctx.getOrDefault("riskLevel", "LOW")));
        out.put("approval", ordered(
            "status", ctx.getOrDefault("approvalStatus", ""),
            "role", ctx.getOrDefault("approverRole", ""),
            "escalated", ctx.getOrDefault("escalated", false)));
        out.put("prediction", ordered(
            "source", ctx.getOrDefault("predictionSource", ""),
            "effect_size", number(ctx, "predictionEffectSize", 0.0),
            "confidence", confidence,
            "drift_detected", ctx.getOrDefault("driftDetected", false),
            "is_actionable", ctx.getOrDefault("isActionable", false),
            "refutation_passed", ctx.getOrDefault("refutationPassed", false)));
        out.put("data", ordered(
            "contains_pii", ctx.getOrDefault("containsPii", false),
            "is_masked", ctx.getOrDefault("isMasked", false),
            "type", ctx.getOrDefault("dataType", "")));
        out.put("session", ordered(
            "active_predictions", ctx.getOrDefault("activePredictions", 0)));
        return out;
    }

    /** A zero or missing top-level amount falls through to {@code parameters.amount}. */
    private static Object amount(Map<String, Object> action, Map<String, Object> parameters) {
        Object direct = action.get("amount");
        if (direct != null && !(direct instanceof Number n && n.doubleValue() == 0.0)) {
            return direct;
        }
        Object nested = parameters.get("amount");
        return nested != null ? nested : 0;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> section(Map<String, Object> source, String key) {
        Object value = source.get(key);
        if (value == null) {
            return Map.of();
        }
        if (value instanceof Map<?, ?>) {
            return (Map<String, Object>) value;
        }
        throw new ContextMappingException("'" + key + "' must be an object but was "
            + value.getClass().getSimpleName());
    }

    private static double number(Map<String, Object> source, String key, double fallback) {
        Object value = source.get(key);
        if (value == null) {
            return fallback;
        }
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        throw new ContextMappingException("'" + key + "' must be numeric but was '" + value + "'");
    }

    private static Map<String, Object> ordered(Object... keyValues) {
        Map<String, Object> m = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            m.put((String) keyValues[i], keyValues[i + 1]);
        }
        return m;
    }
}
