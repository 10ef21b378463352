package com.rms.restaurantservice.exception;

/**
 * Base class of every failure the service reports to clients on purpose.
 * The message is sent as-is in the {@code error} field of the response body.
 */
public abstract class RestaurantException extends RuntimeException {

    private final ErrorCode errorCode;

    protected RestaurantException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
    }

    protected RestaurantException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected RestaurantException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public int getStatusCode() {
        return errorCode.getStatus().value();
    }
}
