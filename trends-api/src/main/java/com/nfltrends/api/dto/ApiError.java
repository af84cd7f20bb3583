package com.nfltrends.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Standardized error response format. {@code field} names the offending filter key on
 * validation failures.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiError(
        String code,
        String message,
        String field,
        String path,
        Instant timestamp
) {
    public ApiError(String code, String message, String path) {
        this(code, message, null, path, Instant.now());
    }
}
