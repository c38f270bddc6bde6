package com.guardianplatform.guardian.model;

import java.util.Collection;

/** Severity of a contextual violation, and the overall risk of a decision. Ordered low to high. */
public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public RiskLevel max(RiskLevel other) {
        return other != null && other.compareTo(this) > 0 ? other : this;
    }

    /** Highest severity among the violations; {@link #LOW} when there are none. */
    public static RiskLevel highest(Collection<ContextualViolation> violations) {
        RiskLevel level = LOW;
        for (ContextualViolation v : violations) {
            level = level.max(v.severity());
        }
        return level;
    }
}
