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
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * FIFO queue per job type at {@code batch_jobs:<type>}, drained in batches by whoever handles
 * that type. Each enqueue refreshes the queue's ttl.
 */
public class BatchJobQueue {

    private static final Logger log = LoggerFactory.getLogger(BatchJobQueue.class);

    static final String KEY_PREFIX = "batch_jobs:";

    private final KeyValueStore store;
    private final JsonValueCodec codec;
    private final Clock clock;
    private final Duration defaultTtl;
    private final int defaultBatchSize;
    private final MessagingMetrics metrics;

    public BatchJobQueue(KeyValueStore store,
                         JsonValueCodec codec,
                         Clock clock,
                         Duration defaultTtl,
                         int defaultBatchSize,
                         MessagingMetrics metrics) {
        this.store = store;
        this.codec = codec;
        this.clock = clock;
        this.defaultTtl = defaultTtl;
        this.defaultBatchSize = defaultBatchSize;
        this.metrics = metrics;
    }

    public QueueMessage enqueueBatchJob(String jobType, JsonNode data) {
        return enqueueBatchJob(jobType, data, defaultTtl);
    }

    public QueueMessage enqueueBatchJob(String jobType, JsonNode data, Duration ttl) {
        QueueMessage job = new QueueMessage(QueueMessageIds.next("batch", clock), jobType, data, clock.instant(), 0, null);
        String key = key(jobType);
        store.pushToList(key, codec.encode(job));
        store.expire(key, ttl == null ? defaultTtl : ttl);
        metrics.incBatchJobEnqueued();
        log.debug("Enqueued batch job type={} id={}", jobType, job.id());
        return job;
    }

    public List<QueueMessage> processBatchJobs(String jobType) {
        return processBatchJobs(jobType, defaultBatchSize);
    }

    /**
     * Removes and returns up to {@code batchSize} jobs, oldest first. Undecodable entries are
     * consumed and skipped.
     */
    public List<QueueMessage> processBatchJobs(String jobType, int batchSize) {
        String key = key(jobType);
        List<QueueMessage> jobs = new ArrayList<>();
        for (int i = 0; i < batchSize; i++) {
            Optional<String> raw = store.popFromListTail(key);
            if (raw.isEmpty()) {
                break;
            }
            QueueMessage job = codec.decode(raw.get(), QueueMessage.class);
            if (job == null) {
                log.warn("Skipping undecodable batch job type={}", jobType);
                continue;
            }
            jobs.add(job);
        }
        metrics.incBatchJobsProcessed(jobs.size());
        return jobs;
    }

    /**
     * Pending job count per type, for types with a live queue.
     */
    public Map<String, Long> queueSizes() {
        Map<String, Long> sizes = new TreeMap<>();
        for (String key : store.keys(KEY_PREFIX + "*")) {
            sizes.put(key.substring(KEY_PREFIX.length()), store.listSize(key));
        }
        return sizes;
    }

    static String key(String jobType) {
        return KEY_PREFIX + jobType;
    }
}
