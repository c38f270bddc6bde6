package com.guardianplatform.common.exception;

/**
 * A policy or rule definition is malformed. Fatal when raised while loading the
 * built-in set; rejected with a client error when raised by an admin edit.
 */
public class PolicyConfigurationException extends GuardianException {

    public PolicyConfigurationException(String message) {
        super("PolicyConfig", message);
    }

    public PolicyConfigurationException(String message, Throwable cause) {
        super("PolicyConfig", message, cause);
    }
}
