package com.glimpse.messaging.api.dto;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

public record EnqueueOfflineMessageRequest(
        String type,
        @NotNull JsonNode message,
        @Positive Long ttlSeconds
) {
}
