package com.glimpse.messaging.push;

import com.glimpse.messaging.queue.PushNotification;

/**
 * Published when a queued push retry comes due. {@code notification.attempts()} already counts
 * the attempt this event stands for.
 */
public record PushRetryReadyEvent(String messageId, PushNotification notification) {
}
