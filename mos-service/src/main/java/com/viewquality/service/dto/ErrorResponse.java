package com.viewquality.service.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.viewquality.pmos.error.MosError;

/**
 * Rejection body. {@code errorCode} keeps the legacy negative code for the
 * model errors and is 0 for failures outside the model taxonomy.
 */
public record ErrorResponse(
    @JsonProperty("errorCode") int    errorCode,
    @JsonProperty("error")     String error,
    @JsonProperty("message")   String message
) {
    public static ErrorResponse of(MosError error, String message) {
        return new ErrorResponse(error.code(), error.name(), message);
    }

    public static ErrorResponse unexpected(String message) {
        return new ErrorResponse(0, "UNEXPECTED", message);
    }
}
