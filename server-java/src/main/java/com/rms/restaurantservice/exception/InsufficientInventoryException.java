package com.rms.restaurantservice.exception;

/**
 * An ingredient ran short while placing an order. The whole order is rolled back.
 */
public class InsufficientInventoryException extends RestaurantException {

    private final String ingredient;
    private final Long menuItemId;

    public InsufficientInventoryException(String ingredient, Long menuItemId) {
        super(ErrorCode.INSUFFICIENT_INVENTORY,
                "Insufficient inventory for " + ingredient + " (menu item " + menuItemId + ")");
        this.ingredient = ingredient;
        this.menuItemId = menuItemId;
    }

    public String getIngredient() {
        return ingredient;
    }

    public Long getMenuItemId() {
        return menuItemId;
    }
}
