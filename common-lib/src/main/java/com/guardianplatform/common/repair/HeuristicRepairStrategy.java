package com.guardianplatform.common.repair;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Fast rule-based repair keyed on {@link com.guardianplatform.common.policy.ViolationKind}.
 *
 * <h3>Buckets</h3>
 * <ul>
 *   <li>BUDGET_EXCEEDED   : every positive number × {@value #BUDGET_FACTOR}</li>
 *   <li>THRESHOLD_EXCEEDED: every positive number × {@value #THRESHOLD_FACTOR}</li>
 *   <li>APPROVAL_REQUIRED : {@code requires_human_review=true}, {@code review_reason=<message>}</li>
 *   <li>UNCLASSIFIED      : left for another strategy</li>
 * </ul>
 * "Every positive number" covers top-level fields and values of directly nested maps;
 * booleans are not numbers. Effects accumulate on a single deep copy, so two budget
 * violations compound. The caller's action is never modified.
 *
 * <p>Stateless and thread-safe.
 */
public final class HeuristicRepairStrategy {

    public static final double BUDGET_FACTOR = 0.8;
    public static final double THRESHOLD_FACTOR = 0.9;
    public static final double FULL_CONFIDENCE = 0.85;
    public static final double PARTIAL_CONFIDENCE = 0.6;

    public static final String REQUIRES_HUMAN_REVIEW = "requires_human_review";
    public static final String REVIEW_REASON = "review_reason";

    private HeuristicRepairStrategy() {}

    /**
     * @return the repair, or empty when no violation fell into any bucket
     */
    public static Optional<RepairResult> repair(Map<String, Object> action, List<Violation> violations) {
        Map<String, Object> repaired = deepCopy(action);
        List<String> details = new ArrayList<>();
        List<String> addressed = new ArrayList<>();
        List<String> remaining = new ArrayList<>();

        for (Violation violation : violations) {
            boolean matched = switch (violation.kind()) {
                case BUDGET_EXCEEDED -> {
                    reduceNumerics(repaired, BUDGET_FACTOR, "budget", details);
                    yield true;
                }
                case THRESHOLD_EXCEEDED -> {
                    reduceNumerics(repaired, THRESHOLD_FACTOR, "threshold safety margin", details);
                    yield true;
                }
                case APPROVAL_REQUIRED -> {
                    repaired.put(REQUIRES_HUMAN_REVIEW, true);
                    repaired.put(REVIEW_REASON, violation.message());
                    details.add("Flagged for targeted human review");
                    yield true;
                }
                case UNCLASSIFIED -> false;
            };
            if (matched) {
                addressed.add(violation.message());
            } else {
                remaining.add(violation.message());
            }
        }

        if (addressed.isEmpty()) {
            return Optional.empty();
        }
        double confidence = remaining.isEmpty() ? FULL_CONFIDENCE : PARTIAL_CONFIDENCE;
        return Optional.of(new RepairResult(RepairStrategy.HEURISTIC, action, repaired,
            String.join("; ", details), confidence, addressed, remaining, null));
    }

    @SuppressWarnings("unchecked")
    static void reduceNumerics(Map<String, Object> action, double factor, String label, List<String> details) {
        int pct = (int) Math.round((1 - factor) * 100);
        for (Map.Entry<String, Object> entry : action.entrySet()) {
            Object value = entry.getValue();
            if (isPositiveNumber(value)) {
                entry.setValue(((Number) value).doubleValue() * factor);
                details.add("Reduced " + entry.getKey() + " by " + pct + "% (" + label + ")");
            } else if (value instanceof Map<?, ?> nested) {
                for (Map.Entry<String, Object> sub : ((Map<String, Object>) nested).entrySet()) {
                    if (isPositiveNumber(sub.getValue())) {
                        sub.setValue(((Number) sub.getValue()).doubleValue() * factor);
                        details.add("Reduced " + entry.getKey() + "." + sub.getKey() + " by " + pct + "% (" + label + ")");
                    }
                }
            }
        }
    }

    private static boolean isPositiveNumber(Object value) {
        return value instanceof Number n && n.doubleValue() > 0;
    }

    /** Copies maps and lists recursively so nested edits never reach the source. */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> deepCopy(Map<String, Object> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        if (source == null) {
            return copy;
        }
        source.forEach((k, v) -> copy.put(k, copyValue(v)));
        return copy;
    }

    @SuppressWarnings("unchecked")
    private static Object copyValue(Object value) {
        if (value instanceof Map<?, ?> m) {
            return deepCopy((Map<String, Object>) m);
        }
        if (value instanceof List<?> l) {
            List<Object> copy = new ArrayList<>(l.size());
            l.forEach(item -> copy.add(copyValue(item)));
            return copy;
        }
        return value;
    }
}
