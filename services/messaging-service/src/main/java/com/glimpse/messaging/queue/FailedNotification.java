package com.glimpse.messaging.queue;

import java.time.Instant;

public record FailedNotification(PushNotification notification, Instant failedAt) {
}
