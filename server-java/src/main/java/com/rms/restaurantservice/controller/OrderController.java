package com.rms.restaurantservice.controller;

import com.rms.restaurantservice.dto.OrderStatusUpdateRequest;
import com.rms.restaurantservice.dto.OrderSummaryDto;
import com.rms.restaurantservice.dto.PlaceOrderRequest;
import com.rms.restaurantservice.model.Order;
import com.rms.restaurantservice.service.OrderPlacementService;
import com.rms.restaurantservice.service.OrderService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/orders")
public class OrderController {

    private final OrderPlacementService orderPlacementService;
    private final OrderService orderService;

    public OrderController(OrderPlacementService orderPlacementService, OrderService orderService) {
        this.orderPlacementService = orderPlacementService;
        this.orderService = orderService;
    }

    @PostMapping
    public ResponseEntity<Map<String, Object>> placeOrder(@Valid @RequestBody PlaceOrderRequest request) {
        Order order = orderPlacementService.placeOrder(request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(Map.of("message", "Order placed successfully", "orderId", order.getId()));
    }

    @GetMapping
    @PreAuthorize("@accessPolicy.permits(authentication, 'ADMIN', 'STAFF')")
    public List<OrderSummaryDto> getOrders() {
        return orderService.getOrders();
    }

    @PutMapping("/{id}/status")
    @PreAuthorize("@accessPolicy.permits(authentication, 'ADMIN', 'STAFF')")
    public ResponseEntity<Map<String, Object>> updateStatus(@PathVariable Long id,
                                                            @Valid @RequestBody OrderStatusUpdateRequest request) {
        Order order = orderService.updateStatus(id, request.getStatus());
        return ResponseEntity.ok(Map.of("message", "Order status updated successfully",
                "status", order.getStatus().value()));
    }
}
