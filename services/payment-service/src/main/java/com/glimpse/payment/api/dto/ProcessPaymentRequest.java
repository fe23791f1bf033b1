package com.glimpse.payment.api.dto;

import jakarta.validation.constraints.NotBlank;

import java.util.Map;

public record ProcessPaymentRequest(
        @NotBlank String userId,
        @NotBlank String provider,
        Map<String, Object> data
) {
}
