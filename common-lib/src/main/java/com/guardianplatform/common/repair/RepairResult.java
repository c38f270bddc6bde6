package com.guardianplatform.common.repair;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Outcome of one repair attempt.
 *
 * <p>{@code error} is set when the attempt degraded (model timeout, unavailable model,
 * unparseable response); such results carry the original action and zero confidence.
 */
public record RepairResult(
    @JsonProperty("strategyUsed")        RepairStrategy      strategyUsed,
    @JsonProperty("originalAction")      Map<String, Object> originalAction,
    @JsonProperty("repairedAction")      Map<String, Object> repairedAction,
    @JsonProperty("repairExplanation")   String              repairExplanation,
    @JsonProperty("confidence")          double              confidence,
    @JsonProperty("violationsAddressed") List<String>        violationsAddressed,
    @JsonProperty("violationsRemaining") List<String>        violationsRemaining,
    @JsonProperty("error")               String              error
) {
    public RepairResult {
        confidence = Math.min(1.0, Math.max(0.0, confidence));
        violationsAddressed = violationsAddressed == null ? List.of() : List.copyOf(violationsAddressed);
        violationsRemaining = violationsRemaining == null ? List.of() : List.copyOf(violationsRemaining);
    }

    /** Nothing to repair: action unchanged, full confidence. */
    public static RepairResult nothingToRepair(RepairStrategy strategy, Map<String, Object> action) {
        return new RepairResult(strategy, action, action, "No violations to address",
            1.0, List.of(), List.of(), null);
    }

    /** Attempt that changed nothing: original action, zero confidence, all violations remaining. */
    public static RepairResult unrepaired(RepairStrategy strategy, Map<String, Object> action,
                                          List<String> violations, String explanation, String error) {
        return new RepairResult(strategy, action, action, explanation, 0.0, List.of(), violations, error);
    }

    public boolean fullyAddressed() {
        return violationsRemaining.isEmpty();
    }

    public boolean requiresHumanReview() {
        return repairedAction != null && Boolean.TRUE.equals(repairedAction.get(HeuristicRepairStrategy.REQUIRES_HUMAN_REVIEW));
    }
}
