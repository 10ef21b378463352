package com.rms.restaurantservice.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum Role {
    ADMIN,
    STAFF,
    CUSTOMER;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static Role from(String value) {
        if (value != null) {
            for (Role role : values()) {
                if (role.value().equalsIgnoreCase(value.trim())) {
                    return role;
                }
            }
        }
        throw new IllegalArgumentException("Invalid role: " + value);
    }

    public String authority() {
        return "ROLE_" + name();
    }
}
