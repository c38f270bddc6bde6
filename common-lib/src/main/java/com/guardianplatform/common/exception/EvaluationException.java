package com.guardianplatform.common.exception;

/**
 * Unexpected failure while matching rules against a context.
 */
public class EvaluationException extends GuardianException {

    public EvaluationException(String message, Throwable cause) {
        super("PolicyEngine", message, cause);
    }
}
