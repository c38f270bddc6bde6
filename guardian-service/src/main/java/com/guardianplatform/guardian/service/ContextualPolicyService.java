package com.guardianplatform.guardian.service;

import com.guardianplatform.guardian.dto.GuardianConfigPatch;
import com.guardianplatform.guardian.model.ContextualViolation;
import com.guardianplatform.guardian.model.GuardianPolicyConfig;
import com.guardianplatform.guardian.model.RiskLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Contextual checks the guardian applies on top of the rule engine, and the live
 * configuration behind them.
 *
 * <ul>
 *   <li>{@code confidence_threshold}: domain confidence below the domain's threshold (medium)</li>
 *   <li>{@code always_escalate}: action type on the mandatory-escalation list (high)</li>
 *   <li>{@code currency_mismatch}: action currency differs from the limit currency (medium)</li>
 *   <li>{@code auto_approval_limit}: amount above the domain's auto-approval limit (high)</li>
 *   <li>{@code max_reflection_attempts}: repair rounds reached the cap (medium)</li>
 * </ul>
 * In strict mode every high-severity violation is raised to critical.
 */
@Service
public class ContextualPolicyService {

    private static final Logger log = LoggerFactory.getLogger(ContextualPolicyService.class);

    private final AtomicReference<GuardianPolicyConfig> config;

    /** @param maxAttempts seeds {@code maxReflectionAttempts} of the default config */
    public ContextualPolicyService(@Value("${guardian.repair.max-attempts:2}") int maxAttempts) {
        this.config = new AtomicReference<>(GuardianPolicyConfig.defaults(Math.max(0, maxAttempts)));
    }

    public GuardianPolicyConfig config() {
        return config.get();
    }

    public GuardianPolicyConfig replace(GuardianPolicyConfig next) {
        config.set(next);
        log.info("[GuardianPolicy] Config replaced. strictMode={} maxReflectionAttempts={} policiesEnabled={}",
            next.strictMode(), next.maxReflectionAttempts(), next.policiesEnabled());
        return next;
    }

    public GuardianPolicyConfig patch(GuardianConfigPatch patch) {
        GuardianPolicyConfig next = config.updateAndGet(current -> current.withOverrides(
            patch.userFinancialLimit(), patch.userConfidenceThreshold(), patch.strictMode()));
        log.info("[GuardianPolicy] Config patched. userFinancialLimit={} userConfidenceThreshold={} strictMode={}",
            next.userFinancialLimit(), next.userConfidenceThreshold(), next.strictMode());
        return next;
    }

    /**
     * Checks {@code action} in the setting described by {@code state}, against {@code cfg}
     * (normally a snapshot taken from {@link #config()} when the check started).
     *
     * @param reflectionCount  repair rounds already run for this decision
     * @param reflectionCapped whether the repair loop stopped with the action still violating
     */
    public List<ContextualViolation> assess(GuardianPolicyConfig cfg, Map<String, Object> state,
                                            Map<String, Object> action,
                                            int reflectionCount, boolean reflectionCapped) {
        if (!cfg.policiesEnabled()) {
            return List.of();
        }
        String domain = state == null ? null : String.valueOf(state.getOrDefault("domain", "Disorder"));
        List<ContextualViolation> violations = new ArrayList<>();

        Object confidence = state == null ? null : state.get("domainConfidence");
        if (confidence instanceof Number n) {
            double threshold = cfg.confidenceThresholdFor(domain);
            if (n.doubleValue() < threshold) {
                violations.add(new ContextualViolation("confidence_threshold", "risk",
                    String.format(Locale.ROOT, "Confidence (%.2f) below threshold (%s) for domain %s",
                        n.doubleValue(), threshold, domain),
                    RiskLevel.MEDIUM, "Gather more information or escalate to human"));
            }
        }

        if (reflectionCapped && reflectionCount >= cfg.maxReflectionAttempts()) {
            violations.add(new ContextualViolation("max_reflection_attempts", "operational",
                "Reflection count (" + reflectionCount + ") has reached limit (" + cfg.maxReflectionAttempts() + ")",
                RiskLevel.MEDIUM, "Escalate to human for resolution"));
        }

        Object actionType = action.get("actionType");
        if (actionType != null && cfg.alwaysEscalate().contains(String.valueOf(actionType))) {
            violations.add(new ContextualViolation("always_escalate", "escalation",
                "Action '" + actionType + "' requires mandatory human approval", RiskLevel.HIGH, null));
        }

        Double amount = amount(action);
        if (amount != null) {
            String currency = action.get("currency") != null
                ? String.valueOf(action.get("currency")).toUpperCase(Locale.ROOT)
                : cfg.currency();
            double limit = cfg.financialLimitFor(domain);
            if (!currency.equals(cfg.currency())) {
                violations.add(new ContextualViolation("currency_mismatch", "financial",
                    "Currency mismatch: action uses " + currency + " but policy limit is in " + cfg.currency(),
                    RiskLevel.MEDIUM, "Convert amount to " + cfg.currency() + " or specify the amount in " + cfg.currency()));
            }
            if (amount > limit) {
                violations.add(new ContextualViolation("auto_approval_limit", "financial",
                    String.format(Locale.ROOT, "Amount %,.2f %s exceeds auto-approval limit of %,.2f %s",
                        amount, currency, limit, cfg.currency()),
                    RiskLevel.HIGH,
                    String.format(Locale.ROOT, "Reduce amount to %,.2f %s or request human approval",
                        limit, cfg.currency())));
            }
        }

        if (cfg.strictMode()) {
            violations.replaceAll(v -> v.severity() == RiskLevel.HIGH ? v.withSeverity(RiskLevel.CRITICAL) : v);
        }
        return violations;
    }

    /** Catalogue of the contextual policies with their current settings. */
    public Map<String, Object> describePolicies() {
        GuardianPolicyConfig cfg = config.get();
        List<Map<String, Object>> policies = List.of(
            describe("confidence_threshold", "risk",
                "Minimum confidence required for automated approval", true, cfg.confidenceThresholds()),
            describe("auto_approval_limit", "financial",
                "Maximum amount for automatic approval without human review", true, cfg.financialLimits()),
            describe("max_reflection_attempts", "operational",
                "Maximum self-correction loops before escalation", false, cfg.maxReflectionAttempts()),
            describe("always_escalate", "escalation",
                "Actions that always require human approval", false, cfg.alwaysEscalate()));

        Map<String, Object> out = new LinkedHashMap<>();
        out.put("policies", policies);
        out.put("riskWeights", Map.of(
            "description", "Weights used for decomposed risk scoring",
            "values", cfg.riskWeights()));
        return out;
    }

    private static Map<String, Object> describe(String name, String category, String description,
                                                boolean userConfigurable, Object value) {
        Map<String, Object> policy = new LinkedHashMap<>();
        policy.put("name", name);
        policy.put("category", category);
        policy.put("description", description);
        policy.put("userConfigurable", userConfigurable);
        policy.put("value", value);
        return policy;
    }

    /** Top-level {@code amount}, else {@code parameters.amount}; {@code null} when neither is numeric. */
    private static Double amount(Map<String, Object> action) {
        Object direct = action.get("amount");
        if (direct instanceof Number n) {
            return n.doubleValue();
        }
        Object parameters = action.get("parameters");
        if (parameters instanceof Map<?, ?> p && p.get("amount") instanceof Number n) {
            return n.doubleValue();
        }
        return null;
    }
}
