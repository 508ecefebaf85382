package com.clapgrow.summary.scheduler.exception;

import com.clapgrow.summary.whatsapp.exception.GatewayErrorCode;
import com.clapgrow.summary.whatsapp.exception.GatewayException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(GatewayException.class)
    public ResponseEntity<ErrorResponse> handleGatewayException(GatewayException e) {
        HttpStatus status = statusFor(e.getErrorCode());
        if (status.is5xxServerError()) {
            log.error("Gateway error {}: {}", e.getErrorCode(), e.getMessage());
        } else {
            log.warn("Gateway error {}: {}", e.getErrorCode(), e.getMessage());
        }
        return ResponseEntity.status(status).body(ErrorResponse.of(e.getErrorCode().name(), e.getMessage()));
    }

    @ExceptionHandler(ScheduleNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleScheduleNotFound(ScheduleNotFoundException e) {
        log.warn("Schedule not found: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorResponse.of("NOT_FOUND", e.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgumentException(IllegalArgumentException e) {
        log.warn("Illegal argument: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ErrorResponse.of("BAD_REQUEST", e.getMessage()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(ErrorResponse.of("BAD_REQUEST", "Malformed request body"));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidationExceptions(MethodArgumentNotValidException e) {
        Map<String, String> errors = new HashMap<>();
        e.getBindingResult().getAllErrors().forEach(error -> {
            String fieldName = error instanceof FieldError fieldError ? fieldError.getField() : error.getObjectName();
            errors.put(fieldName, error.getDefaultMessage());
        });

        Map<String, Object> response = new HashMap<>();
        response.put("success", false);
        response.put("errorCode", "VALIDATION_ERROR");
        response.put("message", "Validation failed");
        response.put("errors", errors);
        response.put("timestamp", LocalDateTime.now());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(response);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        log.error("Unexpected error: {}", e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ErrorResponse.of(
            "INTERNAL_SERVER_ERROR",
            e.getMessage() != null ? e.getMessage() : "An unexpected error occurred"));
    }

    static HttpStatus statusFor(GatewayErrorCode errorCode) {
        return switch (errorCode) {
            case INVALID_GROUP_ID, INVALID_IDENTIFIER, EMPTY_IDENTIFIER, EMPTY_MESSAGE -> HttpStatus.BAD_REQUEST;
            case NOT_AUTHORIZED -> HttpStatus.UNAUTHORIZED;
            case RATE_LIMITED, EXHAUSTED -> HttpStatus.TOO_MANY_REQUESTS;
            case TRANSPORT_ERROR, INVALID_RESPONSE, REQUEST_REJECTED -> HttpStatus.BAD_GATEWAY;
        };
    }

    /**
     * Error body shared by every endpoint.
     */
    public record ErrorResponse(boolean success, String errorCode, String message, LocalDateTime timestamp) {

        static ErrorResponse of(String errorCode, String message) {
            return new ErrorResponse(false, errorCode, message, LocalDateTime.now());
        }
    }
}
