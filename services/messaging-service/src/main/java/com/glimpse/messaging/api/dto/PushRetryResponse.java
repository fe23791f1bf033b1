package com.glimpse.messaging.api.dto;

public record PushRetryResponse(String recipientId, boolean queued, boolean deadLettered) {
}
