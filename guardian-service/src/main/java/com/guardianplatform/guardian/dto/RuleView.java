package com.guardianplatform.guardian.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.guardianplatform.common.policy.Rule;
import com.guardianplatform.common.policy.ViolationKind;

import java.util.Map;

public record RuleView(
    @JsonProperty("name")       String              name,
    @JsonProperty("policyName") String              policyName,
    @JsonProperty("condition")  Map<String, Object> condition,
    @JsonProperty("constraint") Map<String, Object> constraint,
    @JsonProperty("message")    String              message,
    @JsonProperty("kind")       ViolationKind       kind
) {
    public static RuleView from(Rule rule) {
        return new RuleView(rule.name(), rule.policyName(), rule.condition(), rule.constraint(),
            rule.message(), rule.kind());
    }
}
