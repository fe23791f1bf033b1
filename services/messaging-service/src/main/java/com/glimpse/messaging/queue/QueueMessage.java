package com.glimpse.messaging.queue;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

public record QueueMessage(String id,
                           String type,
                           JsonNode payload,
                           Instant enqueuedAt,
                           int attempts,
                           String recipientId) {
}
