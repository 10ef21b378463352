package com.rms.restaurantservice.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum PaymentStatus {
    PENDING,
    COMPLETED,
    FAILED;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static PaymentStatus from(String value) {
        if (value != null) {
            for (PaymentStatus status : values()) {
                if (status.value().equalsIgnoreCase(value.trim())) {
                    return status;
                }
            }
        }
        throw new IllegalArgumentException("Invalid payment status: " + value);
    }
}
