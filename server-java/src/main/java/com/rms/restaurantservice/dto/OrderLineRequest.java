package com.rms.restaurantservice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class OrderLineRequest {
    @NotNull(message = "menu_item_id is required")
    @JsonProperty("menu_item_id")
    private Long menuItemId;

    @NotNull(message = "quantity is required")
    @Positive(message = "quantity must be a positive integer")
    private Integer quantity;

    @NotNull(message = "price is required")
    @DecimalMin(value = "0", message = "price must not be negative")
    private BigDecimal price;
}
