package com.glimpse.messaging.api.dto;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

public record ScheduleDelayedJobRequest(
        @NotBlank String type,
        @NotNull JsonNode data,
        @PositiveOrZero long delayMs
) {
}
