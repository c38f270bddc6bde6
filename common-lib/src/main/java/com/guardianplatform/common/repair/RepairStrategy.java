package com.guardianplatform.common.repair;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

public enum RepairStrategy {
    HEURISTIC,
    LLM,
    HYBRID;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Case-insensitive lookup; empty for unknown values. */
    public static Optional<RepairStrategy> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        for (RepairStrategy s : values()) {
            if (s.value().equals(raw.trim().toLowerCase(Locale.ROOT))) {
                return Optional.of(s);
            }
        }
        return Optional.empty();
    }
}
