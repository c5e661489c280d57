package com.adlanda.perema.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * Error body returned by every endpoint: {@code {"error": "..."}}, plus
 * per-field details for validation failures.
 *
 * @param error   Human readable message
 * @param details Field name to message, only for validation errors
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
        String error,
        Map<String, String> details
) {
    public static ErrorResponse of(String error) {
        return new ErrorResponse(error, null);
    }
}
