package com.rms.restaurantservice.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum MenuCategory {
    APPETIZER,
    MAIN,
    DESSERT,
    BEVERAGE;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static MenuCategory from(String value) {
        if (value != null) {
            for (MenuCategory category : values()) {
                if (category.value().equalsIgnoreCase(value.trim())) {
                    return category;
                }
            }
        }
        throw new IllegalArgumentException("Invalid category: " + value);
    }
}
