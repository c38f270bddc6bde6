package com.guardianplatform.common.repair;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.guardianplatform.common.model.RuleResult;
import com.guardianplatform.common.policy.ViolationKind;

/**
 * A violated rule as seen by repair: the operator-facing message plus its kind tag.
 */
public record Violation(
    @JsonProperty("message") String        message,
    @JsonProperty("kind")    ViolationKind kind
) {
    public Violation {
        if (kind == null) {
            kind = ViolationKind.infer(message);
        }
    }

    public static Violation of(RuleResult result) {
        ViolationKind kind = result.kind() != null ? result.kind() : ViolationKind.infer(result.message());
        return new Violation(result.message(), kind);
    }

    /** For callers that only hold message text; the kind is inferred from it. */
    public static Violation fromMessage(String message) {
        return new Violation(message, ViolationKind.infer(message));
    }
}
