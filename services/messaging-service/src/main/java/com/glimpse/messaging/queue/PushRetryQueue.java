package com.glimpse.messaging.queue;

import com.glimpse.common.redis.JsonValueCodec;
import com.glimpse.common.redis.KeyValueStore;
import com.glimpse.messaging.metrics.MessagingMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Global retry queue for push notifications, an ordered set scored by due time in epoch millis.
 * Attempt {@code n} becomes due {@code n * retryDelay} after it is enqueued; past
 * {@code maxRetries} the notification goes to the {@link DeadLetterLog} instead.
 */
public class PushRetryQueue {

    private static final Logger log = LoggerFactory.getLogger(PushRetryQueue.class);

    static final String MESSAGE_TYPE = "push_notification_retry";

    private final KeyValueStore store;
    private final JsonValueCodec codec;
    private final DeadLetterLog deadLetterLog;
    private final Clock clock;
    private final String queueKey;
    private final int defaultMaxRetries;
    private final Duration defaultRetryDelay;
    private final MessagingMetrics metrics;

    public PushRetryQueue(KeyValueStore store,
                          JsonValueCodec codec,
                          DeadLetterLog deadLetterLog,
                          Clock clock,
                          String queueKey,
                          int defaultMaxRetries,
                          Duration defaultRetryDelay,
                          MessagingMetrics metrics) {
        this.store = store;
        this.codec = codec;
        this.deadLetterLog = deadLetterLog;
        this.clock = clock;
        this.queueKey = queueKey;
        this.defaultMaxRetries = defaultMaxRetries;
        this.defaultRetryDelay = defaultRetryDelay;
        this.metrics = metrics;
    }

    public boolean enqueueRetry(PushNotification notification) {
        return enqueueRetry(notification, defaultMaxRetries, defaultRetryDelay);
    }

    /**
     * @return {@code true} if queued, {@code false} if the notification was dead-lettered
     */
    public boolean enqueueRetry(PushNotification notification, int maxRetries, Duration retryDelay) {
        int attempts = notification.attempts() + 1;
        if (attempts > maxRetries) {
            log.warn("Push retry limit exceeded recipientId={} attempts={}", notification.recipientId(), attempts);
            deadLetterLog.record(notification);
            metrics.incPushDeadLettered();
            return false;
        }

        Instant now = clock.instant();
        PushNotification next = notification.withAttempts(attempts);
        QueueMessage message = new QueueMessage(
                QueueMessageIds.next("push", clock),
                MESSAGE_TYPE,
                codec.mapper().valueToTree(next),
                now,
                attempts,
                notification.recipientId());
        double dueAt = now.toEpochMilli() + (double) retryDelay.toMillis() * attempts;
        store.addToSortedSet(queueKey, codec.encode(message), dueAt);
        metrics.incPushRetryEnqueued();
        log.info("Enqueued push retry recipientId={} attempt={}", notification.recipientId(), attempts);
        return true;
    }

    public List<DueEntry> findDue() {
        List<DueEntry> due = new ArrayList<>();
        for (String member : store.rangeSortedSetByScore(queueKey, Double.NEGATIVE_INFINITY, clock.millis())) {
            QueueMessage message = codec.decode(member, QueueMessage.class);
            PushNotification notification = toNotification(message);
            if (notification == null) {
                log.warn("Dropping undecodable push retry entry");
                store.removeFromSortedSet(queueKey, member);
                continue;
            }
            due.add(new DueEntry(member, message, notification));
        }
        return due;
    }

    public boolean remove(DueEntry entry) {
        return store.removeFromSortedSet(queueKey, entry.member());
    }

    public List<QueueMessage> pending() {
        List<QueueMessage> out = new ArrayList<>();
        for (String member : store.rangeSortedSet(queueKey)) {
            QueueMessage message = codec.decode(member, QueueMessage.class);
            if (message != null) {
                out.add(message);
            }
        }
        return out;
    }

    private PushNotification toNotification(QueueMessage message) {
        if (message == null || message.payload() == null) {
            return null;
        }
        try {
            return codec.mapper().convertValue(message.payload(), PushNotification.class);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    public record DueEntry(String member, QueueMessage message, PushNotification notification) {
    }
}
