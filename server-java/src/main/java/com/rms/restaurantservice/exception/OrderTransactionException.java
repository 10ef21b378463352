package com.rms.restaurantservice.exception;

public class OrderTransactionException extends RestaurantException {

    public OrderTransactionException(String message, Throwable cause) {
        super(ErrorCode.ORDER_TRANSACTION_FAILED, message, cause);
    }
}
