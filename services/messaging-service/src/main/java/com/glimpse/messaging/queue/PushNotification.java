package com.glimpse.messaging.queue;

import java.util.Map;

/**
 * A push notification as handed to the dispatcher. {@code attempts} counts dispatches already made.
 */
public record PushNotification(String recipientId,
                               String title,
                               String body,
                               Map<String, Object> data,
                               int attempts) {

    public PushNotification withAttempts(int attempts) {
        return new PushNotification(recipientId, title, body, data, attempts);
    }
}
