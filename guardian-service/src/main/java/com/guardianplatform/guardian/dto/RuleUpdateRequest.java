package com.guardianplatform.guardian.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/** Either field may be omitted to keep the rule's current value. */
public record RuleUpdateRequest(
    @JsonProperty("constraint") Map<String, Object> constraint,
    @JsonProperty("message")    String              message
) {}
