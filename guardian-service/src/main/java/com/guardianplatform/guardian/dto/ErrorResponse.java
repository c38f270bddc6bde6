package com.guardianplatform.guardian.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
    @JsonProperty("error")      String       error,
    @JsonProperty("message")    String       message,
    @JsonProperty("violations") List<String> violations
) {
    public static ErrorResponse of(String error, String message) {
        return new ErrorResponse(error, message, null);
    }
}
