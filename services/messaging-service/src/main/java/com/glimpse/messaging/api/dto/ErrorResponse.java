package com.glimpse.messaging.api.dto;

import java.time.Instant;

public record ErrorResponse(String code, String message, Instant timestamp) {
}
