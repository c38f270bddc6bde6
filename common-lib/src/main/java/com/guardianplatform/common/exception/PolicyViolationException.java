package com.guardianplatform.common.exception;

import com.guardianplatform.common.model.Evaluation;

/**
 * Raised by a guarded operation in enforce mode when the evaluation denies the call.
 *
 * <p>This is a deliberate block, not a fault: it is the only guardian exception that
 * reaches the caller of a guarded operation.
 */
public class PolicyViolationException extends GuardianException {
    private final transient Evaluation evaluation;

    public PolicyViolationException(String message, Evaluation evaluation) {
        super("ToolGuard", message);
        this.evaluation = evaluation;
    }

    public Evaluation getEvaluation() {
        return evaluation;
    }
}
