package com.guardianplatform.common.exception;

/**
 * Upstream decision state could not be flattened into the evaluation namespace.
 */
public class ContextMappingException extends GuardianException {

    public ContextMappingException(String message) {
        super("ContextMapper", message);
    }

    public ContextMappingException(String message, Throwable cause) {
        super("ContextMapper", message, cause);
    }
}
