package com.guardianplatform.guardian.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A breach of the guardian's contextual policies (confidence, financial limit,
 * mandatory escalation, reflection cap), as opposed to a rule-engine violation.
 */
public record ContextualViolation(
    @JsonProperty("policyName")   String    policyName,
    @JsonProperty("category")     String    category,
    @JsonProperty("description")  String    description,
    @JsonProperty("severity")     RiskLevel severity,
    @JsonProperty("suggestedFix") String    suggestedFix
) {
    public ContextualViolation withSeverity(RiskLevel newSeverity) {
        return new ContextualViolation(policyName, category, description, newSeverity, suggestedFix);
    }
}
