package com.glimpse.messaging.queue;

import com.fasterxml.jackson.databind.JsonNode;
import com.glimpse.common.redis.JsonValueCodec;
import com.glimpse.common.redis.KeyValueStore;
import com.glimpse.messaging.metrics.MessagingMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Per-recipient offline queue: an ordered set at {@code offline_messages:<recipientId>} scored by
 * enqueue time. Each enqueue refreshes the whole queue's ttl.
 */
public class OfflineMessageQueue {

    private static final Logger log = LoggerFactory.getLogger(OfflineMessageQueue.class);

    static final String KEY_PREFIX = "offline_messages:";
    static final String MESSAGE_TYPE = "offline_message";

    private final KeyValueStore store;
    private final JsonValueCodec codec;
    private final Clock clock;
    private final Duration defaultTtl;
    private final MessagingMetrics metrics;

    // micros since epoch of the last score handed out
    private final AtomicLong lastScoreMicros = new AtomicLong();

    public OfflineMessageQueue(KeyValueStore store, JsonValueCodec codec, Clock clock, Duration defaultTtl, MessagingMetrics metrics) {
        this.store = store;
        this.codec = codec;
        this.clock = clock;
        this.defaultTtl = defaultTtl;
        this.metrics = metrics;
    }

    public QueueMessage enqueueOfflineMessage(String recipientId, JsonNode message) {
        return enqueueOfflineMessage(recipientId, message, MESSAGE_TYPE, defaultTtl);
    }

    public QueueMessage enqueueOfflineMessage(String recipientId, JsonNode message, String type, Duration ttl) {
        QueueMessage queued = new QueueMessage(
                QueueMessageIds.next("msg", clock),
                type == null ? MESSAGE_TYPE : type,
                message,
                clock.instant(),
                0,
                recipientId);
        String key = key(recipientId);
        store.addToSortedSet(key, codec.encode(queued), nextScore());
        store.expire(key, ttl == null ? defaultTtl : ttl);
        metrics.incOfflineEnqueued();
        log.debug("Enqueued offline message recipientId={} id={}", recipientId, queued.id());
        return queued;
    }

    /**
     * Returns queued messages in enqueue order without removing them; call
     * {@link #clearOfflineMessages(String)} once they are delivered.
     */
    public List<QueueMessage> drainOfflineMessages(String recipientId) {
        List<QueueMessage> out = new ArrayList<>();
        for (String raw : store.rangeSortedSet(key(recipientId))) {
            QueueMessage message = codec.decode(raw, QueueMessage.class);
            if (message == null) {
                log.warn("Skipping undecodable offline message recipientId={}", recipientId);
                continue;
            }
            out.add(message);
        }
        return out;
    }

    public void clearOfflineMessages(String recipientId) {
        store.delete(key(recipientId));
        log.debug("Cleared offline messages recipientId={}", recipientId);
    }

    public int queueCount() {
        return store.keys(KEY_PREFIX + "*").size();
    }

    private double nextScore() {
        long nowMicros = clock.millis() * 1000;
        long micros = lastScoreMicros.updateAndGet(last -> Math.max(last + 1, nowMicros));
        return micros / 1000.0;
    }

    static String key(String recipientId) {
        return KEY_PREFIX + recipientId;
    }
}
