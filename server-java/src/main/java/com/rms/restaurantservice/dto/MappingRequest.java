package com.rms.restaurantservice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigDecimal;

@Data
public class MappingRequest {
    @NotNull(message = "menu_item_id is required")
    @JsonProperty("menu_item_id")
    private Long menuItemId;

    @NotNull(message = "inventory_item_id is required")
    @JsonProperty("inventory_item_id")
    private Long inventoryItemId;

    @NotNull(message = "quantity_required is required")
    @DecimalMin(value = "0", inclusive = false, message = "quantity_required must be positive")
    @Digits(integer = 8, fraction = 2, message = "quantity_required allows at most 2 decimal places")
    @JsonProperty("quantity_required")
    private BigDecimal quantityRequired;
}
