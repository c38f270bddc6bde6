package com.guardianplatform.common.policy;

import com.guardianplatform.common.exception.PolicyConfigurationException;
import com.guardianplatform.common.exception.PolicyNotFoundException;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Immutable, ordered snapshot of all loaded policies.
 *
 * <p>Evaluations read one snapshot from start to finish; administrative edits build a
 * new snapshot through {@link #withPolicy} and are published by
 * {@link PolicyRegistryHolder}. Policy names are unique.
 */
public record PolicyRegistry(List<Policy> policies) {

    public PolicyRegistry {
        policies = List.copyOf(policies);
        Set<String> seen = new HashSet<>();
        for (Policy p : policies) {
            if (!seen.add(p.name())) {
                throw new PolicyConfigurationException("Duplicate policy name '" + p.name() + "'");
            }
        }
    }

    public static PolicyRegistry empty() {
        return new PolicyRegistry(List.of());
    }

    public Optional<Policy> find(String policyName) {
        return policies.stream().filter(p -> p.name().equals(policyName)).findFirst();
    }

    public Policy require(String policyName) {
        return find(policyName).orElseThrow(() -> new PolicyNotFoundException(policyName));
    }

    /**
     * Returns a snapshot where the named policy is replaced by {@code edit}'s result,
     * keeping registration order.
     *
     * @throws PolicyNotFoundException if no policy has that name
     */
    public PolicyRegistry withPolicy(String policyName, UnaryOperator<Policy> edit) {
        Policy current = require(policyName);
        Policy edited = edit.apply(current);
        List<Policy> next = new ArrayList<>(policies.size());
        for (Policy p : policies) {
            next.add(p == current ? edited : p);
        }
        return new PolicyRegistry(next);
    }

    public int policyCount() {
        return policies.size();
    }

    public int ruleCount() {
        return policies.stream().mapToInt(p -> p.rules().size()).sum();
    }

    public List<String> policyNames() {
        return policies.stream().map(Policy::name).toList();
    }
}
