package com.guardianplatform.common.policy.constraint;

public record BooleanConstraint(boolean required) implements Constraint {

    @Override
    public boolean isSatisfiedBy(Object actual) {
        return actual instanceof Boolean b && b == required;
    }
}
