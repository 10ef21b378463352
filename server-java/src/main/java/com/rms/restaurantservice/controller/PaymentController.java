package com.rms.restaurantservice.controller;

import com.rms.restaurantservice.dto.PaymentProcessRequest;
import com.rms.restaurantservice.dto.PaymentSummaryDto;
import com.rms.restaurantservice.service.PaymentService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/payments")
public class PaymentController {

    private final PaymentService paymentService;

    public PaymentController(PaymentService paymentService) {
        this.paymentService = paymentService;
    }

    @GetMapping
    @PreAuthorize("@accessPolicy.permits(authentication, 'ADMIN', 'STAFF')")
    public List<PaymentSummaryDto> getPayments() {
        return paymentService.getPayments();
    }

    @PostMapping("/{orderId}/process")
    @PreAuthorize("@accessPolicy.permits(authentication)")
    public ResponseEntity<Map<String, Object>> processPayment(@PathVariable Long orderId,
                                                              @Valid @RequestBody PaymentProcessRequest request) {
        paymentService.processPayment(orderId, request);
        return ResponseEntity.ok(Map.of("message", "Payment processed successfully"));
    }
}
