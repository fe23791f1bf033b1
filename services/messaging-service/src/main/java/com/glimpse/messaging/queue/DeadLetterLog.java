package com.glimpse.messaging.queue;

import com.glimpse.common.redis.JsonValueCodec;
import com.glimpse.common.redis.KeyValueStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * Append-only log of notifications that ran out of retries, one list per UTC day at
 * {@code failed_notifications:<yyyy-MM-dd>}. Entries are never retried.
 */
public class DeadLetterLog {

    private static final Logger log = LoggerFactory.getLogger(DeadLetterLog.class);

    static final String KEY_PREFIX = "failed_notifications:";

    private final KeyValueStore store;
    private final JsonValueCodec codec;
    private final Clock clock;
    private final Duration ttl;

    public DeadLetterLog(KeyValueStore store, JsonValueCodec codec, Clock clock, Duration ttl) {
        this.store = store;
        this.codec = codec;
        this.clock = clock;
        this.ttl = ttl;
    }

    public void record(PushNotification notification) {
        Instant now = clock.instant();
        String key = key(LocalDate.ofInstant(now, ZoneOffset.UTC));
        store.pushToList(key, codec.encode(new FailedNotification(notification, now)));
        store.expire(key, ttl);
        log.warn("Push notification dead-lettered recipientId={} attempts={}",
                notification.recipientId(), notification.attempts());
    }

    /**
     * Newest first.
     */
    public List<FailedNotification> list(LocalDate date) {
        List<FailedNotification> out = new ArrayList<>();
        for (String raw : store.rangeList(key(date))) {
            FailedNotification entry = codec.decode(raw, FailedNotification.class);
            if (entry != null) {
                out.add(entry);
            }
        }
        return out;
    }

    static String key(LocalDate date) {
        return KEY_PREFIX + date;
    }
}
