package com.guardianplatform.common.guard;

import com.fasterxml.jackson.annotation.JsonValue;
import com.guardianplatform.common.exception.PolicyConfigurationException;

/**
 * <ul>
 *   <li>{@link #ENFORCE} : a denied call is blocked with a policy violation</li>
 *   <li>{@link #LOG_ONLY}: a denied call is logged and still executed, so operators can
 *       audit "would have blocked" decisions before switching modes</li>
 * </ul>
 */
public enum GuardMode {
    ENFORCE("enforce"),
    LOG_ONLY("log-only");

    private final String value;

    GuardMode(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * @throws PolicyConfigurationException for anything other than {@code enforce} or
     *         {@code log-only}
     */
    public static GuardMode fromValue(String raw) {
        for (GuardMode mode : values()) {
            if (mode.value.equalsIgnoreCase(raw == null ? "" : raw.trim())) {
                return mode;
            }
        }
        throw new PolicyConfigurationException(
            "Invalid guard mode '" + raw + "', must be 'enforce' or 'log-only'");
    }
}
