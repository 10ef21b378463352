package com.rms.restaurantservice.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * How much of one inventory ingredient a single unit of a menu item consumes.
 */
@Entity
@Table(name = "menu_inventory_mapping", indexes = {
        @Index(name = "idx_mapping_menu_item", columnList = "menu_item_id")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MenuInventoryMapping {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "menu_item_id", nullable = false)
    @JsonProperty("menu_item_id")
    private Long menuItemId;

    @Column(name = "inventory_item_id", nullable = false)
    @JsonProperty("inventory_item_id")
    private Long inventoryItemId;

    @Column(name = "quantity_required", nullable = false, precision = 10, scale = 2)
    @JsonProperty("quantity_required")
    private BigDecimal quantityRequired;

    public BigDecimal requiredFor(int units) {
        return quantityRequired.multiply(BigDecimal.valueOf(units));
    }
}
