package com.rms.restaurantservice.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Set;

/**
 * Kitchen lifecycle of an order.
 * <p>
 * The forward path is pending, preparing, ready, delivered. Any order that has not
 * been delivered may be cancelled. Delivered and cancelled are terminal.
 */
public enum OrderStatus {
    PENDING,
    PREPARING,
    READY,
    DELIVERED,
    CANCELLED;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static OrderStatus from(String value) {
        if (value != null) {
            for (OrderStatus status : values()) {
                if (status.value().equalsIgnoreCase(value.trim())) {
                    return status;
                }
            }
        }
        throw new IllegalArgumentException("Invalid order status: " + value);
    }

    public boolean isTerminal() {
        return this == DELIVERED || this == CANCELLED;
    }

    public Set<OrderStatus> nextStatuses() {
        return switch (this) {
            case PENDING -> EnumSet.of(PREPARING, CANCELLED);
            case PREPARING -> EnumSet.of(READY, CANCELLED);
            case READY -> EnumSet.of(DELIVERED, CANCELLED);
            case DELIVERED, CANCELLED -> EnumSet.noneOf(OrderStatus.class);
        };
    }

    public boolean canTransitionTo(OrderStatus next) {
        return next != null && nextStatuses().contains(next);
    }
}
