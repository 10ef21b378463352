package com.rms.restaurantservice.exception;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Turns every failure into a {@code {"error": "..."}} body.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(RestaurantException.class)
    public ResponseEntity<Map<String, String>> handleRestaurantException(RestaurantException e) {
        if (e.getErrorCode().getStatus().is5xxServerError()) {
            logger.error("[{}] {}", e.getErrorCode().getCode(), e.getMessage(), e);
        } else {
            logger.warn("[{}] {}", e.getErrorCode().getCode(), e.getMessage());
        }
        return ResponseEntity.status(e.getErrorCode().getStatus()).body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, String>> handleValidation(MethodArgumentNotValidException e) {
        FieldError fieldError = e.getBindingResult().getFieldError();
        String message = fieldError != null && fieldError.getDefaultMessage() != null
                ? fieldError.getDefaultMessage()
                : ErrorCode.VALIDATION_FAILED.getMessage();
        logger.warn("[{}] {}", ErrorCode.VALIDATION_FAILED.getCode(), message);
        return ResponseEntity.badRequest().body(Map.of("error", message));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, String>> handleUnreadable(HttpMessageNotReadableException e) {
        logger.warn("[{}] Malformed request body: {}", ErrorCode.VALIDATION_FAILED.getCode(), e.getMessage());
        return ResponseEntity.badRequest().body(Map.of("error", "Malformed request body"));
    }

    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<Map<String, String>> handleAccessDenied(AccessDeniedException e) {
        logger.warn("Access denied: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.FORBIDDEN).body(Map.of("error", "Access denied"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, String>> handleUnexpected(Exception e) {
        logger.error("Unhandled exception", e);
        return ResponseEntity.internalServerError()
                .body(Map.of("error", ErrorCode.INTERNAL_ERROR.getMessage()));
    }
}
