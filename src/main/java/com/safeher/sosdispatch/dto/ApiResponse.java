package com.safeher.sosdispatch.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;

import java.util.Map;

/**
 * Generic API response wrapper.
 *
 * Provides Lombok @Builder for fine-grained construction AND
 * static factory helpers for the most common cases:
 *   ApiResponse.success(data, message)
 *   ApiResponse.error(message)
 *
 * {@code errors} carries per-field messages for bean-validation failures only.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse {

    private boolean success;
    private String message;
    private Object data;
    private Map<String, String> errors;

    /** Shorthand for a successful response with data. */
    public static ApiResponse success(Object data, String message) {
        ApiResponse r = new ApiResponse();
        r.setSuccess(true);
        r.setMessage(message);
        r.setData(data);
        return r;
    }

    /** Shorthand for a successful response with no data payload. */
    public static ApiResponse success(String message) {
        ApiResponse r = new ApiResponse();
        r.setSuccess(true);
        r.setMessage(message);
        return r;
    }

    /** Shorthand for an error response. */
    public static ApiResponse error(String message) {
        ApiResponse r = new ApiResponse();
        r.setSuccess(false);
        r.setMessage(message);
        return r;
    }
}
