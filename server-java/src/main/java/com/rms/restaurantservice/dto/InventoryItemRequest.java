package com.rms.restaurantservice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigDecimal;

@Data
public class InventoryItemRequest {
    @NotBlank(message = "item_name is required")
    @JsonProperty("item_name")
    private String itemName;

    @NotNull(message = "quantity is required")
    @DecimalMin(value = "0", message = "quantity must not be negative")
    @Digits(integer = 8, fraction = 2, message = "quantity allows at most 2 decimal places")
    private BigDecimal quantity;

    @NotBlank(message = "unit is required")
    private String unit;

    @DecimalMin(value = "0", message = "min_quantity must not be negative")
    @JsonProperty("min_quantity")
    private BigDecimal minQuantity;

    @DecimalMin(value = "0", message = "cost_per_unit must not be negative")
    @JsonProperty("cost_per_unit")
    private BigDecimal costPerUnit;

    private String supplier;
}
