package com.guardianplatform.guardian.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.guardianplatform.common.model.Evaluation;
import com.guardianplatform.common.repair.RepairResult;

import java.util.List;
import java.util.Map;

/**
 * Outcome of one guardian check.
 *
 * @param evaluation    the last evaluation performed (of the repaired action when repair ran)
 * @param repair        the last repair attempt, {@code null} when none ran
 * @param finalAction   the action to execute, or the best candidate for a human to review
 * @param repairAttempts number of repair rounds run
 * @param contextualViolations contextual policy breaches found on {@code finalAction}
 * @param riskLevel     highest severity across contextual violations and the rule-engine outcome
 */
public record GuardianDecision(
    @JsonProperty("traceId")               String              traceId,
    @JsonProperty("verdict")               GuardianVerdict     verdict,
    @JsonProperty("evaluation")            Evaluation          evaluation,
    @JsonProperty("repair")                RepairResult        repair,
    @JsonProperty("finalAction")           Map<String, Object> finalAction,
    @JsonProperty("repairAttempts")        int                 repairAttempts,
    @JsonProperty("requiresHumanOverride") boolean             requiresHumanOverride,
    @JsonProperty("explanation")           String              explanation,
    @JsonProperty("contextualViolations")  List<ContextualViolation> contextualViolations,
    @JsonProperty("riskLevel")             RiskLevel           riskLevel
) {
    public GuardianDecision {
        contextualViolations = contextualViolations == null ? List.of() : List.copyOf(contextualViolations);
        riskLevel = riskLevel == null ? RiskLevel.LOW : riskLevel;
    }
}
