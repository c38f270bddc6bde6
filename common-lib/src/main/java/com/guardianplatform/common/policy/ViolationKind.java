package com.guardianplatform.common.policy;

import java.util.Locale;

/**
 * Machine-readable category attached to every rule and carried on its results, so
 * repair can switch on the tag instead of re-reading message text.
 *
 * <p>Rules may declare their kind explicitly. Undeclared kinds are inferred once, at
 * compile time, from the violation message via {@link #infer(String)}.
 */
public enum ViolationKind {
    BUDGET_EXCEEDED,
    THRESHOLD_EXCEEDED,
    APPROVAL_REQUIRED,
    UNCLASSIFIED;

    /**
     * Keyword inference, checked in order: budget/cost, threshold/limit,
     * approval/authorization. Case-insensitive substring match.
     */
    public static ViolationKind infer(String message) {
        if (message == null || message.isBlank()) {
            return UNCLASSIFIED;
        }
        String lower = message.toLowerCase(Locale.ROOT);
        if (lower.contains("budget") || lower.contains("cost")) {
            return BUDGET_EXCEEDED;
        }
        if (lower.contains("threshold") || lower.contains("limit")) {
            return THRESHOLD_EXCEEDED;
        }
        if (lower.contains("approval") || lower.contains("authorization")) {
            return APPROVAL_REQUIRED;
        }
        return UNCLASSIFIED;
    }
}
