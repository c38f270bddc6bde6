package com.guardianplatform.common.policy.constraint;

/**
 * Requirement a matched rule enforces on one resolved context value.
 *
 * <p>Variants are chosen once when a rule is compiled by {@link ConstraintCompiler}:
 * <ul>
 *   <li>{@link RangeConstraint}     : inclusive {@code min}/{@code max} bounds</li>
 *   <li>{@link EqualityConstraint}  : {@code eq}, {@code neq} or a bare scalar</li>
 *   <li>{@link BooleanConstraint}   : bare boolean</li>
 *   <li>{@link UpperBoundConstraint}: bare number, value must not exceed it</li>
 * </ul>
 *
 * <p>Implementations are immutable and safe to share across concurrent evaluations.
 */
public interface Constraint {

    /**
     * @param actual the resolved, non-null context value
     * @return {@code true} when the value satisfies the constraint
     */
    boolean isSatisfiedBy(Object actual);
}
