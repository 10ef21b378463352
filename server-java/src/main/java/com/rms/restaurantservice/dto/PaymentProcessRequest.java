package com.rms.restaurantservice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class PaymentProcessRequest {
    @JsonProperty("transaction_id")
    private String transactionId;

    @NotBlank(message = "status is required")
    private String status;
}
