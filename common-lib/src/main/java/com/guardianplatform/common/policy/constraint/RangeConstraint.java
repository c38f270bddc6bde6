package com.guardianplatform.common.policy.constraint;

import com.guardianplatform.common.policy.ContextPaths;

/**
 * Inclusive numeric range. Either bound may be absent. A non-numeric value cannot be
 * verified against the range and is treated as a violation.
 */
public record RangeConstraint(Double min, Double max) implements Constraint {

    @Override
    public boolean isSatisfiedBy(Object actual) {
        if (!ContextPaths.isNumber(actual)) {
            return false;
        }
        double value = ((Number) actual).doubleValue();
        if (min != null && value < min) {
            return false;
        }
        return max == null || value <= max;
    }
}
