package com.guardianplatform.guardian.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

public record RepairRequest(
    @JsonProperty("action")     Map<String, Object> action,
    @JsonProperty("violations") List<String>        violations,
    @JsonProperty("context")    Map<String, Object> context
) {}
