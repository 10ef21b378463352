package com.rms.restaurantservice.service;

import com.rms.restaurantservice.dto.MenuItemRequest;
import com.rms.restaurantservice.exception.ErrorCode;
import com.rms.restaurantservice.exception.ResourceNotFoundException;
import com.rms.restaurantservice.exception.ValidationException;
import com.rms.restaurantservice.model.MenuCategory;
import com.rms.restaurantservice.model.MenuItem;
import com.rms.restaurantservice.repository.MenuItemRepository;
import com.rms.restaurantservice.repository.inventory.MenuInventoryMappingRepository;
import com.rms.restaurantservice.repository.order.OrderItemRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
public class MenuService {

    private static final Logger logger = LoggerFactory.getLogger(MenuService.class);

    private final MenuItemRepository menuItemRepository;
    private final MenuInventoryMappingRepository mappingRepository;
    private final OrderItemRepository orderItemRepository;

    public MenuService(MenuItemRepository menuItemRepository, MenuInventoryMappingRepository mappingRepository,
                       OrderItemRepository orderItemRepository) {
        this.menuItemRepository = menuItemRepository;
        this.mappingRepository = mappingRepository;
        this.orderItemRepository = orderItemRepository;
    }

    @Transactional(readOnly = true)
    public List<MenuItem> getAvailableMenu() {
        return menuItemRepository.findAvailableOrderByCategoryAndName();
    }

    @Transactional
    public MenuItem create(MenuItemRequest request) {
        MenuItem item = new MenuItem();
        apply(item, request);
        MenuItem saved = menuItemRepository.save(item);
        logger.info("Created menu item #{} '{}'", saved.getId(), saved.getName());
        return saved;
    }

    @Transactional
    public MenuItem update(Long id, MenuItemRequest request) {
        MenuItem item = menuItemRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Menu item", id));
        apply(item, request);
        return menuItemRepository.save(item);
    }

    /**
     * Removes a menu item that nothing refers to yet. Items with a recipe or with past orders stay;
     * mark them unavailable instead.
     */
    @Transactional
    public void delete(Long id) {
        if (!menuItemRepository.existsById(id)) {
            throw new ResourceNotFoundException("Menu item", id);
        }
        if (orderItemRepository.existsByMenuItemId(id)) {
            throw new ValidationException(ErrorCode.RESOURCE_IN_USE,
                    "Menu item " + id + " appears on existing orders; mark it unavailable instead");
        }
        long mappings = mappingRepository.countByMenuItemId(id);
        if (mappings > 0) {
            throw new ValidationException(ErrorCode.RESOURCE_IN_USE, "Menu item " + id
                    + " has " + mappings + " ingredient mapping(s); remove them first");
        }
        menuItemRepository.deleteById(id);
        logger.info("Deleted menu item #{}", id);
    }

    private void apply(MenuItem item, MenuItemRequest request) {
        MenuCategory category;
        try {
            category = MenuCategory.from(request.getCategory());
        } catch (IllegalArgumentException e) {
            throw new ValidationException(e.getMessage());
        }
        item.setName(request.getName().trim());
        item.setDescription(request.getDescription());
        item.setPrice(request.getPrice());
        item.setCategory(category);
        item.setImageUrl(request.getImageUrl());
        item.setAvailable(request.getAvailable() == null ? Boolean.TRUE : request.getAvailable());
    }
}
