package com.glimpse.messaging.queue;

import com.fasterxml.jackson.databind.JsonNode;
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
 * Jobs of any type that should run after a delay, kept in one ordered set scored by due time in
 * epoch millis.
 */
public class DelayedJobQueue {

    private static final Logger log = LoggerFactory.getLogger(DelayedJobQueue.class);

    private final KeyValueStore store;
    private final JsonValueCodec codec;
    private final Clock clock;
    private final String queueKey;
    private final MessagingMetrics metrics;

    public DelayedJobQueue(KeyValueStore store, JsonValueCodec codec, Clock clock, String queueKey, MessagingMetrics metrics) {
        this.store = store;
        this.codec = codec;
        this.clock = clock;
        this.queueKey = queueKey;
        this.metrics = metrics;
    }

    public QueueMessage scheduleDelayedJob(String jobType, JsonNode data, Duration delay) {
        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must be >= 0");
        }
        Instant now = clock.instant();
        QueueMessage job = new QueueMessage(QueueMessageIds.next("delayed", clock), jobType, data, now, 0, null);
        store.addToSortedSet(queueKey, codec.encode(job), now.toEpochMilli() + (double) delay.toMillis());
        metrics.incDelayedJobScheduled();
        log.info("Scheduled delayed job type={} id={} delayMs={}", jobType, job.id(), delay.toMillis());
        return job;
    }

    /**
     * Up to {@code limit} due jobs, earliest first. Undecodable entries are removed.
     */
    public List<DueJob> findDue(int limit) {
        List<DueJob> due = new ArrayList<>();
        for (String member : store.rangeSortedSetByScore(queueKey, Double.NEGATIVE_INFINITY, clock.millis())) {
            if (due.size() >= limit) {
                break;
            }
            QueueMessage job = codec.decode(member, QueueMessage.class);
            if (job == null || job.type() == null) {
                log.warn("Dropping undecodable delayed job entry");
                store.removeFromSortedSet(queueKey, member);
                continue;
            }
            due.add(new DueJob(member, job));
        }
        return due;
    }

    public boolean remove(DueJob job) {
        return store.removeFromSortedSet(queueKey, job.member());
    }

    public long size() {
        return store.sortedSetSize(queueKey);
    }

    public record DueJob(String member, QueueMessage job) {
    }
}
