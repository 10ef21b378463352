package com.rms.restaurantservice.exception;

public class ResourceNotFoundException extends RestaurantException {

    public ResourceNotFoundException(String resource, Long id) {
        super(ErrorCode.RESOURCE_NOT_FOUND, resource + " not found: " + id);
    }
}
