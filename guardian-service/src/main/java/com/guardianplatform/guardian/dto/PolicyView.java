package com.guardianplatform.guardian.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.guardianplatform.common.policy.Policy;

import java.util.List;

public record PolicyView(
    @JsonProperty("name")        String         name,
    @JsonProperty("version")     String         version,
    @JsonProperty("description") String         description,
    @JsonProperty("ruleCount")   int            ruleCount,
    @JsonProperty("rules")       List<RuleView> rules
) {
    public static PolicyView from(Policy policy) {
        List<RuleView> rules = policy.rules().stream().map(RuleView::from).toList();
        return new PolicyView(policy.name(), policy.version(), policy.description(), rules.size(), rules);
    }
}
