package com.guardianplatform.common.policy;

import com.guardianplatform.common.exception.DuplicateRuleException;
import com.guardianplatform.common.exception.RuleNotFoundException;
import com.guardianplatform.common.model.RuleResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Named, versioned, ordered group of rules. Immutable; mutators return new instances.
 */
public record Policy(String name, String version, String description, List<Rule> rules) {

    public Policy {
        rules = List.copyOf(rules);
    }

    public static Policy of(String name, String version, String description, List<Rule> rules) {
        return new Policy(name, version, description, rules);
    }

    public Optional<Rule> findRule(String ruleName) {
        return rules.stream().filter(r -> r.name().equals(ruleName)).findFirst();
    }

    /** Evaluates every rule in registration order. */
    public List<RuleResult> evaluate(Map<String, ?> context) {
        List<RuleResult> results = new ArrayList<>(rules.size());
        for (Rule rule : rules) {
            results.add(rule.evaluate(context));
        }
        return results;
    }

    public Policy withRuleAdded(Rule rule) {
        if (findRule(rule.name()).isPresent()) {
            throw new DuplicateRuleException(name, rule.name());
        }
        List<Rule> next = new ArrayList<>(rules);
        next.add(rule);
        return new Policy(name, version, description, next);
    }

    public Policy withRuleReplaced(Rule rule) {
        List<Rule> next = new ArrayList<>(rules.size());
        boolean found = false;
        for (Rule existing : rules) {
            if (existing.name().equals(rule.name())) {
                next.add(rule);
                found = true;
            } else {
                next.add(existing);
            }
        }
        if (!found) {
            throw new RuleNotFoundException(name, rule.name());
        }
        return new Policy(name, version, description, next);
    }

    public Policy withRuleRemoved(String ruleName) {
        List<Rule> next = new ArrayList<>(rules);
        if (!next.removeIf(r -> r.name().equals(ruleName))) {
            throw new RuleNotFoundException(name, ruleName);
        }
        return new Policy(name, version, description, next);
    }
}
