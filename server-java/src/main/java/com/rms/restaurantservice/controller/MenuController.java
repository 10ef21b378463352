package com.rms.restaurantservice.controller;

import com.rms.restaurantservice.dto.MenuItemRequest;
import com.rms.restaurantservice.model.MenuItem;
import com.rms.restaurantservice.service.MenuService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/menu")
public class MenuController {

    private final MenuService menuService;

    public MenuController(MenuService menuService) {
        this.menuService = menuService;
    }

    @GetMapping
    public List<MenuItem> getMenu() {
        return menuService.getAvailableMenu();
    }

    @PostMapping
    @PreAuthorize("@accessPolicy.permits(authentication, 'ADMIN', 'STAFF')")
    public ResponseEntity<Map<String, Object>> createMenuItem(@Valid @RequestBody MenuItemRequest request) {
        MenuItem item = menuService.create(request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(Map.of("message", "Menu item added successfully", "id", item.getId()));
    }

    @PutMapping("/{id}")
    @PreAuthorize("@accessPolicy.permits(authentication, 'ADMIN', 'STAFF')")
    public ResponseEntity<Map<String, Object>> updateMenuItem(@PathVariable Long id,
                                                              @Valid @RequestBody MenuItemRequest request) {
        menuService.update(id, request);
        return ResponseEntity.ok(Map.of("message", "Menu item updated successfully"));
    }

    @DeleteMapping("/{id}")
    @PreAuthorize("@accessPolicy.permits(authentication, 'ADMIN', 'STAFF')")
    public ResponseEntity<Map<String, Object>> deleteMenuItem(@PathVariable Long id) {
        menuService.delete(id);
        return ResponseEntity.ok(Map.of("message", "Menu item deleted successfully"));
    }
}
