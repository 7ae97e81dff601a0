package com.pwescrow.adapter.in.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Error body shared by all escrow endpoints
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
        String status,
        String message,
        String reason,
        List<String> errors
) {
    public static ErrorResponse of(String message, String reason) {
        return new ErrorResponse("error", message, reason, null);
    }

    public static ErrorResponse of(String message, List<String> errors) {
        return new ErrorResponse("error", message, "validation_failed", errors);
    }
}
