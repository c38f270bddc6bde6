package com.guardianplatform.common.policy;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record EngineStatus(
    @JsonProperty("enabled")      boolean      enabled,
    @JsonProperty("engine")       String       engine,
    @JsonProperty("policyCount")  int          policyCount,
    @JsonProperty("ruleCount")    int          ruleCount,
    @JsonProperty("failClosed")   boolean      failClosed,
    @JsonProperty("auditEnabled") boolean      auditEnabled,
    @JsonProperty("policies")     List<String> policies
) {}
