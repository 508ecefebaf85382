package com.clapgrow.summary.scheduler.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Envelope of every successful control-surface response. Failures are rendered by
 * {@link com.clapgrow.summary.scheduler.exception.GlobalExceptionHandler}.
 *
 * @param <T> payload type
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse<T>(boolean success, T data, String message) {

    public static <T> ApiResponse<T> success(T data) {
        return new ApiResponse<>(true, data, null);
    }

    public static <T> ApiResponse<T> success(T data, String message) {
        return new ApiResponse<>(true, data, message);
    }

    public static ApiResponse<Void> message(String message) {
        return new ApiResponse<>(true, null, message);
    }
}
