package com.guardianplatform.common.exception;

/**
 * Base type for every failure raised inside the guardian platform.
 *
 * <p>Carries the name of the component that raised it so log lines and API error
 * bodies can be attributed without parsing the message.
 */
public class GuardianException extends RuntimeException {
    private final String component;

    public GuardianException(String component, String message) {
        super("[" + component + "] " + message);
        this.component = component;
    }

    public GuardianException(String component, String message, Throwable cause) {
        super("[" + component + "] " + message, cause);
        this.component = component;
    }

    public String getComponent() {
        return component;
    }
}
