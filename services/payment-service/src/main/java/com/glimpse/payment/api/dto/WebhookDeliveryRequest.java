package com.glimpse.payment.api.dto;

import jakarta.validation.constraints.NotBlank;

import java.util.Map;

public record WebhookDeliveryRequest(
        @NotBlank String url,
        Map<String, Object> payload,
        Map<String, String> headers
) {
}
