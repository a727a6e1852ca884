package com.example.prsync.exception;

import com.example.prsync.dto.response.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.RejectedExecutionException;

/**
 * Converts exceptions to the {@link ErrorResponse} format.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(PullRequestNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(PullRequestNotFoundException ex) {
        log.warn("Pull request not found: {}", ex.getMessage());
        return buildErrorResponse(HttpStatus.NOT_FOUND, "PULL_REQUEST_NOT_FOUND", ex.getMessage(), null);
    }

    @ExceptionHandler(AuthorizationDeniedException.class)
    public ResponseEntity<ErrorResponse> handleAuthorizationDenied(AuthorizationDeniedException ex) {
        log.warn("Authorization denied: {}", ex.getMessage());
        return buildErrorResponse(HttpStatus.FORBIDDEN, "FORBIDDEN", ex.getMessage(), null);
    }

    @ExceptionHandler(ConfigurationGapException.class)
    public ResponseEntity<ErrorResponse> handleConfigurationGap(ConfigurationGapException ex) {
        log.warn("Configuration gap: {}", ex.getMessage());
        return buildErrorResponse(HttpStatus.UNPROCESSABLE_ENTITY, "CONFIGURATION_GAP", ex.getMessage(), null);
    }

    @ExceptionHandler(RemoteUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleRemoteUnavailable(RemoteUnavailableException ex) {
        log.error("Remote unavailable ({}): {}", ex.getRemote(), ex.getMessage());
        return buildErrorResponse(HttpStatus.BAD_GATEWAY, "REMOTE_UNAVAILABLE", ex.getMessage(),
                Map.of("remote", String.valueOf(ex.getRemote())));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
        Map<String, String> fieldErrors = new LinkedHashMap<>();
        ex.getBindingResult().getFieldErrors()
                .forEach(error -> fieldErrors.putIfAbsent(error.getField(), error.getDefaultMessage()));
        String field = fieldErrors.isEmpty() ? null : fieldErrors.keySet().iterator().next();
        log.warn("Validation failed: {}", fieldErrors);
        return buildErrorResponse(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", "Request validation failed", field, fieldErrors);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
        log.warn("Malformed request body: {}", ex.getMessage());
        return buildErrorResponse(HttpStatus.BAD_REQUEST, "BAD_REQUEST", "Malformed request body", null);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return buildErrorResponse(HttpStatus.BAD_REQUEST, "BAD_REQUEST", ex.getMessage(), null);
    }

    @ExceptionHandler(RejectedExecutionException.class)
    public ResponseEntity<ErrorResponse> handleRejected(RejectedExecutionException ex) {
        log.error("Task rejected: {}", ex.getMessage());
        return buildErrorResponse(HttpStatus.SERVICE_UNAVAILABLE, "SERVICE_UNAVAILABLE",
                "System at capacity, retry later", null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex) {
        log.error("Unexpected error: {}", ex.getMessage(), ex);
        return buildErrorResponse(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_SERVER_ERROR",
                "An unexpected error occurred", null);
    }

    private ResponseEntity<ErrorResponse> buildErrorResponse(HttpStatus status, String code, String message,
                                                             Map<String, String> details) {
        return buildErrorResponse(status, code, message, null, details);
    }

    private ResponseEntity<ErrorResponse> buildErrorResponse(HttpStatus status, String code, String message,
                                                             String field, Map<String, String> details) {
        return ResponseEntity.status(status).body(ErrorResponse.of(code, message, field, details));
    }
}
