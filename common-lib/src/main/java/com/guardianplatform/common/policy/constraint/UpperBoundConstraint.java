package com.guardianplatform.common.policy.constraint;

import com.guardianplatform.common.policy.ContextPaths;

/**
 * Shorthand upper bound: fails only when the value exceeds {@code bound}, so a value
 * exactly at the bound passes.
 */
public record UpperBoundConstraint(Number bound) implements Constraint {

    @Override
    public boolean isSatisfiedBy(Object actual) {
        if (!ContextPaths.isNumber(actual)) {
            return false;
        }
        return ((Number) actual).doubleValue() <= bound.doubleValue();
    }
}
