package com.guardianplatform.common.audit;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.guardianplatform.common.guard.GuardMode;
import com.guardianplatform.common.model.Evaluation;

import java.time.Instant;
import java.util.List;

/**
 * One guarded-call record, written whether the call was allowed or blocked.
 */
public record AuditEntry(
    @JsonProperty("timestamp")    Instant               timestamp,
    @JsonProperty("toolName")     String                toolName,
    @JsonProperty("mode")         GuardMode             mode,
    @JsonProperty("allow")        boolean               allow,
    @JsonProperty("rulesChecked") int                   rulesChecked,
    @JsonProperty("rulesFailed")  int                   rulesFailed,
    @JsonProperty("latencyMs")    double                latencyMs,
    @JsonProperty("violations")   List<ViolationRecord> violations
) {
    public record ViolationRecord(
        @JsonProperty("rule")    String rule,
        @JsonProperty("policy")  String policy,
        @JsonProperty("message") String message
    ) {}

    public static AuditEntry of(String toolName, GuardMode mode, Evaluation evaluation, double latencyMs) {
        List<ViolationRecord> violations = evaluation.violations().stream()
            .map(v -> new ViolationRecord(v.ruleName(), v.policyName(), v.message()))
            .toList();
        return new AuditEntry(Instant.now(), toolName, mode, evaluation.allow(),
            evaluation.rulesChecked(), evaluation.rulesFailed(), latencyMs, violations);
    }
}
