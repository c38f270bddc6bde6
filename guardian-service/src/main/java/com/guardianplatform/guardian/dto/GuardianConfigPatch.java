package com.guardianplatform.guardian.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Partial update of the operator overrides; omitted fields keep their value. */
public record GuardianConfigPatch(
    @JsonProperty("userFinancialLimit")      Double  userFinancialLimit,
    @JsonProperty("userConfidenceThreshold") Double  userConfidenceThreshold,
    @JsonProperty("strictMode")              Boolean strictMode
) {}
