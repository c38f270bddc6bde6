package com.guardianplatform.common.policy;

import com.guardianplatform.common.exception.PolicyConfigurationException;
import com.guardianplatform.common.model.RuleResult;
import com.guardianplatform.common.policy.constraint.ConstraintCompiler;
import com.guardianplatform.common.policy.constraint.PathConstraint;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One compiled condition→constraint pair owned by a single policy.
 *
 * <p>A rule applies only when every condition path resolves to its expected value.
 * A rule that does not apply passes vacuously; a rule that applies passes only when
 * every compiled constraint holds. A constraint path missing from the context fails.
 *
 * <p>Immutable. Edits go through {@link #withUpdate} and yield a new instance, so a
 * published registry snapshot never changes underneath a running evaluation.
 */
public final class Rule {

    static final String SKIPPED_MESSAGE = "Condition not matched, rule skipped";

    private final String name;
    private final String policyName;
    private final Map<String, Object> condition;
    private final Map<String, Object> rawConstraint;
    private final List<PathConstraint> constraints;
    private final String message;
    private final ViolationKind kind;
    private final boolean kindDeclared;

    private Rule(String name, String policyName, Map<String, Object> condition,
                 Map<String, Object> rawConstraint, List<PathConstraint> constraints,
                 String message, ViolationKind kind, boolean kindDeclared) {
        this.name = name;
        this.policyName = policyName;
        this.condition = condition;
        this.rawConstraint = rawConstraint;
        this.constraints = constraints;
        this.message = message;
        this.kind = kind;
        this.kindDeclared = kindDeclared;
    }

    /**
     * Validates and compiles a definition for the given policy.
     *
     * @throws PolicyConfigurationException if the name is blank, a condition value is
     *         null or a map, or the constraint cannot be compiled
     */
    public static Rule compile(String policyName, RuleDefinition definition) {
        if (definition == null || definition.name() == null || definition.name().isBlank()) {
            throw new PolicyConfigurationException("Rule in policy '" + policyName + "' has no name");
        }
        String ruleName = definition.name();
        Map<String, Object> condition = orderedCopy(definition.condition());
        condition.forEach((path, expected) -> {
            if (expected == null || expected instanceof Map<?, ?>) {
                throw new PolicyConfigurationException("Rule '" + ruleName
                    + "' condition on '" + path + "' must be a scalar value");
            }
        });
        Map<String, Object> rawConstraint = orderedCopy(definition.constraint());
        List<PathConstraint> compiled = ConstraintCompiler.compile(ruleName, rawConstraint);

        String message = definition.message() != null && !definition.message().isBlank()
            ? definition.message()
            : "Rule " + ruleName + " violated";
        boolean declared = definition.kind() != null;
        ViolationKind kind = declared ? definition.kind() : ViolationKind.infer(message);

        return new Rule(ruleName, policyName,
            Collections.unmodifiableMap(condition), Collections.unmodifiableMap(rawConstraint),
            compiled, message, kind, declared);
    }

    /**
     * Returns a copy with a replaced constraint and/or message. {@code null} keeps the
     * current value. An inferred kind is re-inferred from the new message.
     */
    public Rule withUpdate(Map<String, Object> newConstraint, String newMessage) {
        return compile(policyName, new RuleDefinition(
            name,
            condition,
            newConstraint != null ? newConstraint : rawConstraint,
            newMessage != null ? newMessage : message,
            kindDeclared ? kind : null));
    }

    public RuleResult evaluate(Map<String, ?> context) {
        if (!matchesCondition(context)) {
            return RuleResult.passed(name, policyName, SKIPPED_MESSAGE, kind);
        }
        return satisfiesConstraints(context)
            ? RuleResult.passed(name, policyName, "", kind)
            : RuleResult.failed(name, policyName, message, kind);
    }

    boolean matchesCondition(Map<String, ?> context) {
        for (Map.Entry<String, Object> entry : condition.entrySet()) {
            Optional<Object> actual = ContextPaths.resolve(context, entry.getKey());
            if (actual.isEmpty() || !ContextPaths.valuesEqual(actual.get(), entry.getValue())) {
                return false;
            }
        }
        return true;
    }

    boolean satisfiesConstraints(Map<String, ?> context) {
        for (PathConstraint pc : constraints) {
            Optional<Object> actual = ContextPaths.resolve(context, pc.path());
            if (actual.isEmpty() || !pc.constraint().isSatisfiedBy(actual.get())) {
                return false;
            }
        }
        return true;
    }

    private static Map<String, Object> orderedCopy(Map<String, Object> source) {
        return source == null ? new LinkedHashMap<>() : new LinkedHashMap<>(source);
    }

    public String name()                     { return name; }
    public String policyName()               { return policyName; }
    public Map<String, Object> condition()   { return condition; }
    public Map<String, Object> constraint()  { return rawConstraint; }
    public List<PathConstraint> constraints() { return constraints; }
    public String message()                  { return message; }
    public ViolationKind kind()              { return kind; }

    @Override
    public String toString() {
        return "Rule[" + policyName + "/" + name + "]";
    }
}
