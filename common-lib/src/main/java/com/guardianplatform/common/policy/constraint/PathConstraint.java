package com.guardianplatform.common.policy.constraint;

/**
 * A compiled constraint bound to the dotted context path it checks.
 */
public record PathConstraint(String path, Constraint constraint) {
}
