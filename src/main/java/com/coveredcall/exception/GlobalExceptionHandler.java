package com.coveredcall.exception;

import com.coveredcall.dto.ApiResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Global exception handler for all REST controllers.
 * Centralizes error handling and provides consistent error responses across the application.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    private static final String MALFORMED_JSON_MESSAGE = "Malformed JSON request. Please check your request body format.";

    /**
     * Handles backtest errors. The error code decides the status:
     * RESULT_NOT_FOUND is 404, BACKTEST_DISABLED is 503, everything else is a client error.
     */
    @ExceptionHandler(BacktestException.class)
    public ResponseEntity<ApiResponse<Void>> handleBacktestException(BacktestException e) {
        HttpStatus status = switch (e.getErrorCode()) {
            case RESULT_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case BACKTEST_DISABLED -> HttpStatus.SERVICE_UNAVAILABLE;
            default -> HttpStatus.BAD_REQUEST;
        };
        log.warn("Backtest error [{}]: {}", e.getErrorCode(), e.getMessage());
        return createErrorResponse(status, "[" + e.getErrorCode() + "] " + e.getMessage());
    }

    /**
     * Handles malformed JSON in request body.
     * This occurs when the client sends invalid JSON format.
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponse<Void>> handleHttpMessageNotReadable(HttpMessageNotReadableException e) {
        log.warn("Malformed JSON request: {}", e.getMessage());
        return createErrorResponse(HttpStatus.BAD_REQUEST, MALFORMED_JSON_MESSAGE);
    }

    /**
     * Handles validation errors from @Valid annotations on request bodies.
     * Extracts the first validation error message for client feedback.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Void>> handleValidationException(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .findFirst()
                .orElse("Validation failed");

        log.warn("Validation error: {}", message);
        return createErrorResponse(HttpStatus.BAD_REQUEST, "Validation error: " + message);
    }

    /**
     * Handles type mismatch errors when request parameters cannot be converted.
     */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiResponse<Void>> handleTypeMismatchException(MethodArgumentTypeMismatchException e) {
        String message = String.format("Invalid value '%s' for parameter '%s'", e.getValue(), e.getName());
        log.warn("Type mismatch: {}", message);
        return createErrorResponse(HttpStatus.BAD_REQUEST, message);
    }

    /**
     * Handles all uncaught exceptions as a safety net.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleGenericException(Exception e) {
        log.error("Unexpected error: {}", e.getMessage(), e);
        return createErrorResponse(HttpStatus.INTERNAL_SERVER_ERROR, "Unexpected error: " + e.getMessage());
    }

    private static ResponseEntity<ApiResponse<Void>> createErrorResponse(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(ApiResponse.error(message));
    }
}
