package com.rms.restaurantservice.controller;

import com.rms.restaurantservice.dto.InventoryItemRequest;
import com.rms.restaurantservice.dto.MappingRequest;
import com.rms.restaurantservice.model.InventoryItem;
import com.rms.restaurantservice.model.MenuInventoryMapping;
import com.rms.restaurantservice.service.InventoryService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/inventory")
@PreAuthorize("@accessPolicy.permits(authentication, 'ADMIN', 'STAFF')")
public class InventoryController {

    private final InventoryService inventoryService;

    public InventoryController(InventoryService inventoryService) {
        this.inventoryService = inventoryService;
    }

    @GetMapping
    public List<InventoryItem> getInventory() {
        return inventoryService.getInventory();
    }

    @PostMapping
    public ResponseEntity<Map<String, Object>> addItem(@Valid @RequestBody InventoryItemRequest request) {
        InventoryItem item = inventoryService.create(request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(Map.of("message", "Inventory item added successfully", "id", item.getId()));
    }

    @PutMapping("/{id}")
    public ResponseEntity<Map<String, Object>> updateItem(@PathVariable Long id,
                                                          @Valid @RequestBody InventoryItemRequest request) {
        inventoryService.update(id, request);
        return ResponseEntity.ok(Map.of("message", "Inventory item updated successfully"));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Map<String, Object>> deleteItem(@PathVariable Long id) {
        inventoryService.delete(id);
        return ResponseEntity.ok(Map.of("message", "Inventory item deleted successfully"));
    }

    @GetMapping("/mappings")
    public List<MenuInventoryMapping> getMappings(@RequestParam Long menuItemId) {
        return inventoryService.getMappings(menuItemId);
    }

    @PostMapping("/mappings")
    public ResponseEntity<Map<String, Object>> addMapping(@Valid @RequestBody MappingRequest request) {
        MenuInventoryMapping mapping = inventoryService.addMapping(request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(Map.of("message", "Mapping added successfully", "id", mapping.getId()));
    }

    @DeleteMapping("/mappings/{id}")
    public ResponseEntity<Map<String, Object>> deleteMapping(@PathVariable Long id) {
        inventoryService.deleteMapping(id);
        return ResponseEntity.ok(Map.of("message", "Mapping deleted successfully"));
    }
}
