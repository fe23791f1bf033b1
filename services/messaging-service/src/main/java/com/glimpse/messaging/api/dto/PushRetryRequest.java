package com.glimpse.messaging.api.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

import java.util.Map;

public record PushRetryRequest(
        @NotBlank String recipientId,
        String title,
        String body,
        Map<String, Object> data,
        @Min(0) int attempts
) {
}
