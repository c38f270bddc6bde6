package com.guardianplatform.guardian.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record ActionReceipt(
    @JsonProperty("actionId")     String  actionId,
    @JsonProperty("actionType")   String  actionType,
    @JsonProperty("status")       String  status,
    @JsonProperty("dispatchedAt") Instant dispatchedAt
) {}
