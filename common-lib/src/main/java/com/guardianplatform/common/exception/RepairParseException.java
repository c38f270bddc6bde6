package com.guardianplatform.common.exception;

/**
 * Language model repair response was not the expected structured JSON.
 */
public class RepairParseException extends GuardianException {

    public RepairParseException(String message) {
        super("Repair", message);
    }

    public RepairParseException(String message, Throwable cause) {
        super("Repair", message, cause);
    }
}
