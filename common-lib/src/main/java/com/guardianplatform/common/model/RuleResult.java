package com.guardianplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.guardianplatform.common.policy.ViolationKind;

/**
 * Outcome of one rule against one context. Produced per evaluation and never stored
 * beyond the {@link Evaluation} that carries it.
 */
public record RuleResult(
    @JsonProperty("ruleName")   String        ruleName,
    @JsonProperty("policyName") String        policyName,
    @JsonProperty("passed")     boolean       passed,
    @JsonProperty("message")    String        message,
    @JsonProperty("kind")       ViolationKind kind
) {
    public static RuleResult passed(String ruleName, String policyName, String message, ViolationKind kind) {
        return new RuleResult(ruleName, policyName, true, message, kind);
    }

    public static RuleResult failed(String ruleName, String policyName, String message, ViolationKind kind) {
        return new RuleResult(ruleName, policyName, false, message, kind);
    }
}
