package com.rms.restaurantservice.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Entity
@Table(name = "inventory")
@Data
@NoArgsConstructor
@AllArgsConstructor
public class InventoryItem {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "item_name", nullable = false, length = 100)
    @JsonProperty("item_name")
    private String itemName;

    @Column(nullable = false, precision = 10, scale = 2)
    private BigDecimal quantity;

    @Column(nullable = false, length = 20)
    private String unit;

    @Column(name = "min_quantity", precision = 10, scale = 2)
    @JsonProperty("min_quantity")
    private BigDecimal minQuantity = BigDecimal.TEN;

    @Column(name = "cost_per_unit", precision = 10, scale = 2)
    @JsonProperty("cost_per_unit")
    private BigDecimal costPerUnit = BigDecimal.ZERO;

    @Column(length = 100)
    private String supplier;

    @Column(name = "created_at")
    @JsonProperty("created_at")
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    @JsonProperty("updated_at")
    private LocalDateTime updatedAt;

    @PrePersist
    public void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = createdAt;
        if (minQuantity == null) {
            minQuantity = BigDecimal.TEN;
        }
        if (costPerUnit == null) {
            costPerUnit = BigDecimal.ZERO;
        }
    }

    @PreUpdate
    public void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    @JsonProperty("low_stock")
    public boolean isLowStock() {
        return quantity != null && minQuantity != null && quantity.compareTo(minQuantity) <= 0;
    }
}
