package com.guardianplatform.guardian.model;

public enum GuardianVerdict {
    /** Passed every applicable rule as proposed. */
    APPROVED,
    /** A repaired action passed re-evaluation. */
    REPAIRED,
    /** Repair could not produce an approvable action; a human must decide. */
    REQUIRES_ESCALATION,
    /** Evaluation failed closed; blocked until a human overrides. */
    REJECTED
}
