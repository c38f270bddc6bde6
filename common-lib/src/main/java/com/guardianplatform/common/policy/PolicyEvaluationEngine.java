package com.guardianplatform.common.policy;

import com.guardianplatform.common.context.StateContextMapper;
import com.guardianplatform.common.exception.EvaluationException;
import com.guardianplatform.common.model.Evaluation;
import com.guardianplatform.common.model.RuleResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Matches an evaluation context against every loaded rule and aggregates the verdict.
 *
 * <h3>Ordering</h3>
 * Policies in registration order, then rules in registration order. No short-circuit:
 * the caller always receives the complete violation list.
 *
 * <h3>Failure semantics</h3>
 * Context-mapping and evaluation failures are converted into an {@link Evaluation}
 * carrying {@code error}; {@code allow} is {@code false} when fail-closed (the default)
 * and {@code true} otherwise. No method here throws to its caller.
 *
 * <p>Stateless per call. Each evaluation reads one registry snapshot, so concurrent
 * evaluations of different contexts share no mutable state.
 */
public class PolicyEvaluationEngine {

    private static final Logger log = LoggerFactory.getLogger(PolicyEvaluationEngine.class);

    public static final String ENGINE_NAME = "built-in";

    private final PolicyRegistryHolder registry;
    private final EngineSettings settings;

    public PolicyEvaluationEngine(PolicyRegistryHolder registry, EngineSettings settings) {
        this.registry = registry;
        this.settings = settings;
    }

    /** Evaluates the context against all policies. */
    public Evaluation evaluate(Map<String, ?> context) {
        return evaluate(context, null);
    }

    /**
     * Evaluates the context against the named policies only. A {@code null} or empty
     * subset means all policies. Unknown names are ignored.
     */
    public Evaluation evaluate(Map<String, ?> context, Collection<String> policySubset) {
        if (!settings.enabled()) {
            return Evaluation.disabled();
        }
        try {
            return evaluateRules(registry.current(), context, policySubset);
        } catch (RuntimeException e) {
            EvaluationException failure = new EvaluationException("Evaluation failed: " + e.getMessage(), e);
            log.error("[PolicyEngine] Rule evaluation failed. failClosed={}", settings.failClosed(), failure);
            return Evaluation.failure(!settings.failClosed(), "Evaluation failed: " + e.getMessage());
        }
    }

    public <S> Evaluation evaluateState(S state, StateContextMapper<S> mapper) {
        return evaluateState(state, mapper, null);
    }

    /**
     * Maps {@code state} through {@code mapper}, then evaluates. A mapping failure
     * yields an error evaluation per the fail mode.
     */
    public <S> Evaluation evaluateState(S state, StateContextMapper<S> mapper, Collection<String> policySubset) {
        if (!settings.enabled()) {
            return Evaluation.disabled();
        }
        Map<String, Object> context;
        try {
            context = mapper.toContext(state);
        } catch (RuntimeException e) {
            log.error("[PolicyEngine] Failed to map state to evaluation context. failClosed={} reason={}",
                settings.failClosed(), e.getMessage());
            return Evaluation.failure(!settings.failClosed(), "Context mapping failed: " + e.getMessage());
        }
        return evaluate(context, policySubset);
    }

    private Evaluation evaluateRules(PolicyRegistry snapshot, Map<String, ?> context,
                                     Collection<String> policySubset) {
        boolean scoped = policySubset != null && !policySubset.isEmpty();
        List<RuleResult> results = new ArrayList<>();
        for (Policy policy : snapshot.policies()) {
            if (scoped && !policySubset.contains(policy.name())) {
                continue;
            }
            results.addAll(policy.evaluate(context));
        }
        Evaluation evaluation = Evaluation.fromResults(results, settings.auditEnabled());
        if (!evaluation.allow()) {
            log.debug("[PolicyEngine] Evaluation denied. rulesChecked={} rulesFailed={} violations={}",
                evaluation.rulesChecked(), evaluation.rulesFailed(), evaluation.violationSummary());
        }
        return evaluation;
    }

    public EngineStatus status() {
        PolicyRegistry snapshot = registry.current();
        return new EngineStatus(settings.enabled(), ENGINE_NAME, snapshot.policyCount(),
            snapshot.ruleCount(), settings.failClosed(), settings.auditEnabled(), snapshot.policyNames());
    }

    public EngineSettings settings() {
        return settings;
    }

    public PolicyRegistryHolder registry() {
        return registry;
    }
}
