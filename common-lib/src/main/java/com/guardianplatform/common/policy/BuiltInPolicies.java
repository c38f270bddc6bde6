package com.guardianplatform.common.policy;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The fixed policy set loaded at start and on every reload.
 *
 * <ul>
 *   <li>{@link #BUDGET_LIMITS} : role and domain transfer ceilings, prediction normalisation</li>
 *   <li>{@link #ACTION_GATES}  : approvals for high-risk and destructive actions</li>
 *   <li>{@link #CHIMERA_GUARDS}: prediction safety bounds</li>
 *   <li>{@link #DATA_ACCESS}   : PII and audit-log handling</li>
 * </ul>
 *
 * <p>Every call compiles fresh {@link Rule} instances; a malformed definition fails
 * with {@link com.guardianplatform.common.exception.PolicyConfigurationException}.
 */
public final class BuiltInPolicies {

    public static final String BUDGET_LIMITS  = "budget_limits";
    public static final String ACTION_GATES   = "action_gates";
    public static final String CHIMERA_GUARDS = "chimera_guards";
    public static final String DATA_ACCESS    = "data_access";

    private BuiltInPolicies() {}

    public static PolicyRegistry load() {
        return new PolicyRegistry(List.of(
            budgetLimits(),
            actionGates(),
            chimeraGuards(),
            dataAccess()));
    }

    static Policy budgetLimits() {
        List<RuleDefinition> rules = new ArrayList<>();
        rules.add(rule("junior_transfer_limit",
            map("user.role", "junior", "action.type", "transfer"),
            map("action.amount", 1000),
            "Junior users cannot transfer more than $1,000"));
        rules.add(rule("senior_transfer_limit",
            map("user.role", "senior", "action.type", "transfer"),
            map("action.amount", 50000),
            "Senior users limited to $50,000 transfers"));
        rules.add(rule("admin_transfer_limit",
            map("user.role", "admin", "action.type", "transfer"),
            map("action.amount", 500000),
            "Admin users limited to $500,000 transfers"));
        rules.add(rule("chimera_prediction_bounds",
            map("prediction.source", "chimera"),
            map("prediction.effect_size", map("min", -1.0, "max", 1.0)),
            "Chimera predictions must be normalized between -1.0 and 1.0"));
        rules.add(rule("domain_financial_limit_clear",
            map("domain.type", "Clear"),
            map("action.amount", 100000),
            "Clear domain auto-approval limit is $100,000"));
        rules.add(rule("domain_financial_limit_complicated",
            map("domain.type", "Complicated"),
            map("action.amount", 50000),
            "Complicated domain auto-approval limit is $50,000"));
        rules.add(rule("domain_financial_limit_complex",
            map("domain.type", "Complex"),
            map("action.amount", 25000),
            "Complex domain auto-approval limit is $25,000"));
        rules.add(rule("domain_financial_limit_chaotic",
            map("domain.type", "Chaotic"),
            map("action.amount", 10000),
            "Chaotic domain auto-approval limit is $10,000"));
        return policy(BUDGET_LIMITS, "Enforce financial action limits", rules);
    }

    static Policy actionGates() {
        List<RuleDefinition> rules = new ArrayList<>();
        rules.add(rule("high_risk_requires_approval",
            map("risk.level", "HIGH"),
            map("approval.status", "approved"),
            "High-risk actions require human approval"));
        rules.add(rule("critical_risk_blocked",
            map("risk.level", "CRITICAL"),
            map("action.type", "halt"),
            "Critical-risk actions are blocked pending investigation"));
        rules.add(rule("delete_data_requires_approval",
            map("action.type", "delete_data"),
            map("approval.status", "approved"),
            "Data deletion requires admin approval"));
        rules.add(rule("modify_policy_requires_approval",
            map("action.type", "modify_policy"),
            map("approval.status", "approved"),
            "Policy modification requires admin approval"));
        rules.add(rule("production_deployment_gate",
            map("action.type", "production_deployment"),
            map("approval.status", "approved"),
            "Production deployments require approval"));
        rules.add(rule("external_api_write_gate",
            map("action.type", "external_api_write"),
            map("approval.status", "approved"),
            "External API writes require human approval"));
        return policy(ACTION_GATES, "Require approvals for high-risk actions", rules);
    }

    static Policy chimeraGuards() {
        List<RuleDefinition> rules = new ArrayList<>();
        rules.add(rule("effect_size_bounds",
            map("prediction.source", "chimera"),
            map("prediction.effect_size", map("min", -2.0, "max", 2.0)),
            "Chimera effect size must be within [-2.0, 2.0]"));
        rules.add(rule("confidence_minimum",
            map("prediction.source", "chimera"),
            map("prediction.confidence", map("min", 0.5)),
            "Chimera predictions require minimum 50% confidence"));
        rules.add(rule("drift_detection_gate",
            map("prediction.drift_detected", true),
            map("approval.escalated", true),
            "Predictions blocked when drift is detected"));
        rules.add(rule("refutation_required",
            map("prediction.source", "causal", "prediction.is_actionable", true),
            map("prediction.refutation_passed", true),
            "Actionable causal predictions must pass refutation tests"));
        return policy(CHIMERA_GUARDS, "Prediction safety bounds for ChimeraOracle", rules);
    }

    static Policy dataAccess() {
        List<RuleDefinition> rules = new ArrayList<>();
        rules.add(rule("pii_must_be_masked",
            map("data.contains_pii", true),
            map("data.is_masked", true),
            "PII data must be masked before processing"));
        rules.add(rule("audit_log_immutable",
            map("data.type", "audit_log"),
            map("action.type", map("neq", "delete")),
            "Audit logs are immutable and cannot be deleted"));
        return policy(DATA_ACCESS, "PII and sensitive data handling rules", rules);
    }

    private static Policy policy(String name, String description, List<RuleDefinition> definitions) {
        List<Rule> rules = definitions.stream().map(d -> Rule.compile(name, d)).toList();
        return Policy.of(name, "1.0", description, rules);
    }

    private static RuleDefinition rule(String name, Map<String, Object> condition,
                                       Map<String, Object> constraint, String message) {
        return RuleDefinition.of(name, condition, constraint, message);
    }

    private static Map<String, Object> map(Object... keyValues) {
        Map<String, Object> m = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            m.put((String) keyValues[i], keyValues[i + 1]);
        }
        return m;
    }
}
