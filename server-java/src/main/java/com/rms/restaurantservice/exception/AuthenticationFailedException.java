package com.rms.restaurantservice.exception;

public class AuthenticationFailedException extends RestaurantException {

    public AuthenticationFailedException() {
        super(ErrorCode.INVALID_CREDENTIALS);
    }
}
