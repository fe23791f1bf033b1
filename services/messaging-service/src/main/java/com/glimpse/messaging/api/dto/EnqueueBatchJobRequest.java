package com.glimpse.messaging.api.dto;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

public record EnqueueBatchJobRequest(
        @NotNull JsonNode data,
        @Positive Long ttlSeconds
) {
}
