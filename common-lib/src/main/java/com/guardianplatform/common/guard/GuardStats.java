package com.guardianplatform.common.guard;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Set;

public record GuardStats(
    @JsonProperty("totalChecks") int         totalChecks,
    @JsonProperty("blocked")     int         blocked,
    @JsonProperty("allowed")     int         allowed,
    @JsonProperty("mode")        GuardMode   mode,
    @JsonProperty("policies")    Set<String> policies
) {}
