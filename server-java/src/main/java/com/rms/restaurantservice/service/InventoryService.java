package com.rms.restaurantservice.service;

import com.rms.restaurantservice.dto.InventoryItemRequest;
import com.rms.restaurantservice.dto.MappingRequest;
import com.rms.restaurantservice.exception.ErrorCode;
import com.rms.restaurantservice.exception.ResourceNotFoundException;
import com.rms.restaurantservice.exception.ValidationException;
import com.rms.restaurantservice.model.InventoryItem;
import com.rms.restaurantservice.model.MenuInventoryMapping;
import com.rms.restaurantservice.repository.MenuItemRepository;
import com.rms.restaurantservice.repository.inventory.InventoryItemRepository;
import com.rms.restaurantservice.repository.inventory.MenuInventoryMappingRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;

/**
 * Stock levels and the ingredient recipe of each menu item.
 */
@Service
public class InventoryService {

    private static final Logger logger = LoggerFactory.getLogger(InventoryService.class);

    private final InventoryItemRepository inventoryItemRepository;
    private final MenuInventoryMappingRepository mappingRepository;
    private final MenuItemRepository menuItemRepository;

    public InventoryService(InventoryItemRepository inventoryItemRepository,
                            MenuInventoryMappingRepository mappingRepository,
                            MenuItemRepository menuItemRepository) {
        this.inventoryItemRepository = inventoryItemRepository;
        this.mappingRepository = mappingRepository;
        this.menuItemRepository = menuItemRepository;
    }

    @Transactional(readOnly = true)
    public List<InventoryItem> getInventory() {
        return inventoryItemRepository.findAllByOrderByItemNameAsc();
    }

    @Transactional
    public InventoryItem create(InventoryItemRequest request) {
        InventoryItem item = new InventoryItem();
        apply(item, request);
        InventoryItem saved = inventoryItemRepository.save(item);
        logger.info("Added inventory item #{} '{}' ({} {})",
                saved.getId(), saved.getItemName(), saved.getQuantity().toPlainString(), saved.getUnit());
        return saved;
    }

    @Transactional
    public InventoryItem update(Long id, InventoryItemRequest request) {
        InventoryItem item = inventoryItemRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Inventory item", id));
        apply(item, request);
        return inventoryItemRepository.save(item);
    }

    @Transactional
    public void delete(Long id) {
        if (!inventoryItemRepository.existsById(id)) {
            throw new ResourceNotFoundException("Inventory item", id);
        }
        long mappings = mappingRepository.countByInventoryItemId(id);
        if (mappings > 0) {
            throw new ValidationException(ErrorCode.RESOURCE_IN_USE, "Inventory item " + id
                    + " is used by " + mappings + " menu item mapping(s); remove them first");
        }
        inventoryItemRepository.deleteById(id);
        logger.info("Deleted inventory item #{}", id);
    }

    @Transactional(readOnly = true)
    public List<MenuInventoryMapping> getMappings(Long menuItemId) {
        return mappingRepository.findByMenuItemIdOrderByIdAsc(menuItemId);
    }

    @Transactional
    public MenuInventoryMapping addMapping(MappingRequest request) {
        if (!menuItemRepository.existsById(request.getMenuItemId())) {
            throw new ResourceNotFoundException("Menu item", request.getMenuItemId());
        }
        if (!inventoryItemRepository.existsById(request.getInventoryItemId())) {
            throw new ResourceNotFoundException("Inventory item", request.getInventoryItemId());
        }
        if (request.getQuantityRequired() == null || request.getQuantityRequired().signum() <= 0) {
            throw new ValidationException("quantity_required must be positive");
        }
        if (mappingRepository.existsByMenuItemIdAndInventoryItemId(request.getMenuItemId(), request.getInventoryItemId())) {
            throw new ValidationException("Menu item " + request.getMenuItemId()
                    + " is already mapped to inventory item " + request.getInventoryItemId());
        }
        MenuInventoryMapping saved = mappingRepository.save(new MenuInventoryMapping(null,
                request.getMenuItemId(), request.getInventoryItemId(), request.getQuantityRequired()));
        logger.info("Mapped menu item #{} to inventory item #{} ({} per unit)",
                saved.getMenuItemId(), saved.getInventoryItemId(), saved.getQuantityRequired().toPlainString());
        return saved;
    }

    @Transactional
    public void deleteMapping(Long id) {
        if (!mappingRepository.existsById(id)) {
            throw new ResourceNotFoundException("Mapping", id);
        }
        mappingRepository.deleteById(id);
    }

    private void apply(InventoryItem item, InventoryItemRequest request) {
        item.setItemName(request.getItemName().trim());
        item.setQuantity(request.getQuantity());
        item.setUnit(request.getUnit().trim());
        item.setMinQuantity(request.getMinQuantity() == null ? BigDecimal.TEN : request.getMinQuantity());
        item.setCostPerUnit(request.getCostPerUnit() == null ? BigDecimal.ZERO : request.getCostPerUnit());
        item.setSupplier(request.getSupplier());
    }
}
