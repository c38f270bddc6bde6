package com.guardianplatform.guardian.service;

import com.guardianplatform.common.exception.PolicyConfigurationException;
import com.guardianplatform.common.exception.RuleNotFoundException;
import com.guardianplatform.common.model.Evaluation;
import com.guardianplatform.common.model.RuleResult;
import com.guardianplatform.common.policy.BuiltInPolicies;
import com.guardianplatform.common.policy.Policy;
import com.guardianplatform.common.policy.PolicyEvaluationEngine;
import com.guardianplatform.common.policy.PolicyRegistry;
import com.guardianplatform.common.policy.PolicyRegistryHolder;
import com.guardianplatform.common.policy.Rule;
import com.guardianplatform.common.policy.RuleDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Administrative operations on the live policy registry.
 *
 * <p>Every mutation compiles the new rule first, then publishes a whole new registry
 * snapshot through {@link PolicyRegistryHolder#update}. Evaluations already running
 * keep the snapshot they started with.
 */
@Service
public class PolicyAdminService {

    private static final Logger log = LoggerFactory.getLogger(PolicyAdminService.class);

    private final PolicyRegistryHolder registry;
    private final PolicyEvaluationEngine engine;

    public PolicyAdminService(PolicyRegistryHolder registry, PolicyEvaluationEngine engine) {
        this.registry = registry;
        this.engine = engine;
    }

    public List<Policy> listPolicies() {
        return registry.current().policies();
    }

    /** @throws com.guardianplatform.common.exception.PolicyNotFoundException if unknown */
    public Policy getPolicy(String policyName) {
        return registry.current().require(policyName);
    }

    public Rule addRule(String policyName, RuleDefinition definition) {
        Rule rule = Rule.compile(policyName, definition);
        registry.update(r -> r.withPolicy(policyName, p -> p.withRuleAdded(rule)));
        log.info("[PolicyAdmin] Rule added. policy={} rule={} kind={}", policyName, rule.name(), rule.kind());
        return rule;
    }

    /**
     * Replaces the constraint and/or message of an existing rule. {@code null} arguments
     * keep the current value.
     */
    public Rule updateRule(String policyName, String ruleName, Map<String, Object> constraint, String message) {
        if (constraint == null && message == null) {
            throw new PolicyConfigurationException("Update for rule '" + ruleName + "' changes nothing");
        }
        AtomicReference<Rule> updated = new AtomicReference<>();
        registry.update(r -> r.withPolicy(policyName, p -> {
            Rule current = p.findRule(ruleName).orElseThrow(() -> new RuleNotFoundException(policyName, ruleName));
            updated.set(current.withUpdate(constraint, message));
            return p.withRuleReplaced(updated.get());
        }));
        log.info("[PolicyAdmin] Rule updated. policy={} rule={}", policyName, ruleName);
        return updated.get();
    }

    public void deleteRule(String policyName, String ruleName) {
        registry.update(r -> r.withPolicy(policyName, p -> p.withRuleRemoved(ruleName)));
        log.info("[PolicyAdmin] Rule deleted. policy={} rule={}", policyName, ruleName);
    }

    /** Discards every runtime edit and republishes the built-in set. */
    public PolicyRegistry reload() {
        PolicyRegistry reloaded = registry.replace(BuiltInPolicies.load());
        log.info("[PolicyAdmin] Policies reloaded. policies={} rules={}",
            reloaded.policyCount(), reloaded.ruleCount());
        return reloaded;
    }

    /**
     * Evaluates a caller-supplied namespaced context without touching the guard's audit
     * log. {@code policyName} restricts evaluation to one policy and must exist.
     *
     * <p>Policies are evaluated directly, so the result reflects the rules even while
     * enforcement is switched off.
     */
    public Evaluation testEvaluate(String policyName, Map<String, Object> context) {
        PolicyRegistry snapshot = registry.current();
        List<Policy> policies = policyName == null || policyName.isBlank()
            ? snapshot.policies()
            : List.of(snapshot.require(policyName));
        boolean auditEnabled = engine.settings().auditEnabled();
        try {
            List<RuleResult> results = new ArrayList<>();
            for (Policy policy : policies) {
                results.addAll(policy.evaluate(context));
            }
            return Evaluation.fromResults(results, auditEnabled);
        } catch (RuntimeException e) {
            log.warn("[PolicyAdmin] Test evaluation failed: {}", e.getMessage());
            return Evaluation.failure(!engine.settings().failClosed(), "Evaluation failed: " + e.getMessage());
        }
    }
}
