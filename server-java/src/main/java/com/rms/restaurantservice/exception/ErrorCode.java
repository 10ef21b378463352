package com.rms.restaurantservice.exception;

import org.springframework.http.HttpStatus;

/**
 * Error codes shared by all application exceptions, each bound to the HTTP status it is reported with.
 */
public enum ErrorCode {

    // 4XX
    VALIDATION_FAILED("VALIDATION_FAILED", "Invalid request", HttpStatus.BAD_REQUEST),
    INVALID_STATUS_TRANSITION("INVALID_STATUS_TRANSITION", "Invalid status transition", HttpStatus.BAD_REQUEST),
    DUPLICATE_USER("DUPLICATE_USER", "User already exists", HttpStatus.BAD_REQUEST),
    RESOURCE_IN_USE("RESOURCE_IN_USE", "Resource is still referenced", HttpStatus.BAD_REQUEST),
    INVALID_CREDENTIALS("INVALID_CREDENTIALS", "Invalid credentials", HttpStatus.UNAUTHORIZED),
    RESOURCE_NOT_FOUND("RESOURCE_NOT_FOUND", "Resource not found", HttpStatus.NOT_FOUND),

    // 5XX
    INSUFFICIENT_INVENTORY("INSUFFICIENT_INVENTORY", "Insufficient inventory", HttpStatus.INTERNAL_SERVER_ERROR),
    ORDER_TRANSACTION_FAILED("ORDER_TRANSACTION_FAILED", "Failed to place order", HttpStatus.INTERNAL_SERVER_ERROR),
    INTERNAL_ERROR("INTERNAL_ERROR", "Something went wrong!", HttpStatus.INTERNAL_SERVER_ERROR);

    private final String code;
    private final String message;
    private final HttpStatus status;

    ErrorCode(String code, String message, HttpStatus status) {
        this.code = code;
        this.message = message;
        this.status = status;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    public HttpStatus getStatus() {
        return status;
    }
}
