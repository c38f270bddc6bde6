package com.guardianplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Aggregate verdict of one policy evaluation.
 *
 * <p>{@code allow} is true exactly when {@code violations} is empty, except for the
 * error path: when evaluation could not run, {@code error} is set and {@code allow}
 * reflects the configured fail mode.
 *
 * <p>{@code auditEntries} carries one {@code rule/policy/passed/message} map per rule
 * checked when auditing is enabled.
 */
public record Evaluation(
    @JsonProperty("allow")        boolean                   allow,
    @JsonProperty("rulesChecked") int                       rulesChecked,
    @JsonProperty("rulesPassed")  int                       rulesPassed,
    @JsonProperty("rulesFailed")  int                       rulesFailed,
    @JsonProperty("violations")   List<RuleResult>          violations,
    @JsonProperty("auditEntries") List<Map<String, Object>> auditEntries,
    @JsonProperty("error")        String                    error
) {
    public Evaluation {
        violations = violations == null ? List.of() : List.copyOf(violations);
        auditEntries = auditEntries == null ? List.of() : List.copyOf(auditEntries);
    }

    /** Builds the aggregate from every rule result, in evaluation order. */
    public static Evaluation fromResults(List<RuleResult> results, boolean auditEnabled) {
        List<RuleResult> violations = results.stream().filter(r -> !r.passed()).toList();
        List<Map<String, Object>> audit = new ArrayList<>();
        if (auditEnabled) {
            for (RuleResult r : results) {
                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put("rule", r.ruleName());
                entry.put("policy", r.policyName());
                entry.put("passed", r.passed());
                entry.put("message", r.message());
                audit.add(entry);
            }
        }
        return new Evaluation(violations.isEmpty(), results.size(),
            results.size() - violations.size(), violations.size(), violations, audit, null);
    }

    /** Result when evaluation itself could not complete. */
    public static Evaluation failure(boolean allow, String error) {
        return new Evaluation(allow, 0, 0, 0, List.of(), List.of(), error);
    }

    /** Result when policy enforcement is switched off. */
    public static Evaluation disabled() {
        return new Evaluation(true, 0, 0, 0, List.of(), List.of(), null);
    }

    public boolean hasError() {
        return error != null;
    }

    /** Violation messages joined with {@code "; "}, as surfaced to operators. */
    public String violationSummary() {
        return violations.stream().map(RuleResult::message).collect(Collectors.joining("; "));
    }
}
