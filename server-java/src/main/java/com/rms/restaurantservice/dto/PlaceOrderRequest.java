package com.rms.restaurantservice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigDecimal;
import java.util.List;

@Data
public class PlaceOrderRequest {
    @NotBlank(message = "customer_name is required")
    @JsonProperty("customer_name")
    private String customerName;

    @NotBlank(message = "customer_phone is required")
    @JsonProperty("customer_phone")
    private String customerPhone;

    @Email(message = "customer_email must be a valid email address")
    @JsonProperty("customer_email")
    private String customerEmail;

    @Valid
    @NotEmpty(message = "Order must contain at least one item")
    private List<OrderLineRequest> items;

    @NotNull(message = "total_amount is required")
    @DecimalMin(value = "0", message = "total_amount must not be negative")
    @JsonProperty("total_amount")
    private BigDecimal totalAmount;

    @JsonProperty("payment_method")
    private String paymentMethod;
}
