package com.guardianplatform.common.policy;

/**
 * Engine switches.
 *
 * @param enabled      when false every evaluation allows with zero rules checked
 * @param failClosed   deny when mapping or evaluation fails
 * @param auditEnabled attach per-rule audit entries to each evaluation
 */
public record EngineSettings(boolean enabled, boolean failClosed, boolean auditEnabled) {

    public static EngineSettings defaults() {
        return new EngineSettings(true, true, true);
    }
}
