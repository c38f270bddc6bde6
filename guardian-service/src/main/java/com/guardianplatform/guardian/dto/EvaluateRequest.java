package com.guardianplatform.guardian.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Test evaluation of a namespaced context, e.g.
 * {@code {"context": {"user": {"role": "junior"}, "action": {"type": "transfer", "amount": 1500}}}}.
 */
public record EvaluateRequest(
    @JsonProperty("context")    Map<String, Object> context,
    @JsonProperty("policyName") String              policyName
) {}
