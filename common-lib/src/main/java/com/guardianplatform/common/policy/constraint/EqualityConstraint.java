package com.guardianplatform.common.policy.constraint;

import com.guardianplatform.common.policy.ContextPaths;

/**
 * Value must equal ({@code eq}) or differ from ({@code neq}) the expected value.
 */
public record EqualityConstraint(Object expected, boolean negated) implements Constraint {

    public static EqualityConstraint equalTo(Object expected) {
        return new EqualityConstraint(expected, false);
    }

    public static EqualityConstraint notEqualTo(Object expected) {
        return new EqualityConstraint(expected, true);
    }

    @Override
    public boolean isSatisfiedBy(Object actual) {
        boolean equal = ContextPaths.valuesEqual(actual, expected);
        return negated != equal;
    }
}
