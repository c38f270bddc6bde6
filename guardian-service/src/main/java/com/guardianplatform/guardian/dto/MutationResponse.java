package com.guardianplatform.guardian.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record MutationResponse(
    @JsonProperty("status")  String   status,
    @JsonProperty("message") String   message,
    @JsonProperty("rule")    RuleView rule
) {}
