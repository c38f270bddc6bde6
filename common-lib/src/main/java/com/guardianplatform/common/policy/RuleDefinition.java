package com.guardianplatform.common.policy;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Declarative, uncompiled form of a rule as it is authored in the built-in set or
 * submitted through the admin API. {@code kind} is optional.
 */
public record RuleDefinition(
    @JsonProperty("name")       String              name,
    @JsonProperty("condition")  Map<String, Object> condition,
    @JsonProperty("constraint") Map<String, Object> constraint,
    @JsonProperty("message")    String              message,
    @JsonProperty("kind")       ViolationKind       kind
) {
    public static RuleDefinition of(String name, Map<String, Object> condition,
                                    Map<String, Object> constraint, String message) {
        return new RuleDefinition(name, condition, constraint, message, null);
    }
}
