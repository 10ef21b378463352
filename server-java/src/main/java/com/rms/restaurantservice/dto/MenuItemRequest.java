package com.rms.restaurantservice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigDecimal;

/**
 * Create and full-replace payload for a menu item. Every mutable column is listed.
 */
@Data
public class MenuItemRequest {
    @NotBlank(message = "name is required")
    private String name;

    private String description;

    @NotNull(message = "price is required")
    @DecimalMin(value = "0", message = "price must not be negative")
    private BigDecimal price;

    @NotBlank(message = "category is required")
    private String category;

    @JsonProperty("image_url")
    private String imageUrl;

    private Boolean available;
}
