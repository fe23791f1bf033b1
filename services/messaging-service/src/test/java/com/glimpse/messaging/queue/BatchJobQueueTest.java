package com.glimpse.messaging.queue;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.glimpse.common.redis.InMemoryKeyValueStore;
import com.glimpse.common.redis.JsonValueCodec;
import com.glimpse.messaging.MutableClock;
import com.glimpse.messaging.metrics.MessagingMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

class BatchJobQueueTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private MutableClock clock;
    private InMemoryKeyValueStore store;
    private SimpleMeterRegistry registry;
    private BatchJobQueue queue;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T08:00:00Z"));
        JsonValueCodec codec = new JsonValueCodec(mapper);
        store = new InMemoryKeyValueStore(codec, clock, Duration.ofMinutes(5));
        registry = new SimpleMeterRegistry();
        queue = new BatchJobQueue(store, codec, clock, Duration.ofDays(1), 10, new MessagingMetrics(registry));
    }

    @Test
    void jobsAreProcessedOldestFirstInBatches() {
        for (int i = 1; i <= 3; i++) {
            queue.enqueueBatchJob("email", mapper.createObjectNode().put("n", i));
        }

        assertThat(queue.processBatchJobs("email", 2))
                .extracting(j -> j.payload().get("n").asInt())
                .containsExactly(1, 2);
        assertThat(queue.processBatchJobs("email"))
                .extracting(j -> j.payload().get("n").asInt())
                .containsExactly(3);
        assertThat(queue.processBatchJobs("email")).isEmpty();
        assertThat(registry.counter("messaging.jobs.batch.processed").count()).isEqualTo(3.0);
    }

    @Test
    void enqueuedJobCarriesTypeAndBatchId() {
        QueueMessage job = queue.enqueueBatchJob("email", mapper.createObjectNode());

        assertThat(job.id()).startsWith("batch_");
        assertThat(job.type()).isEqualTo("email");
        assertThat(store.listSize("batch_jobs:email")).isEqualTo(1);
    }

    @Test
    void queueExpiresAfterTtl() {
        queue.enqueueBatchJob("email", mapper.createObjectNode(), Duration.ofHours(1));

        clock.advance(Duration.ofHours(1).plusSeconds(1));

        assertThat(queue.processBatchJobs("email")).isEmpty();
    }

    @Test
    void undecodableEntriesAreSkipped() {
        queue.enqueueBatchJob("email", mapper.createObjectNode().put("n", 1));
        store.pushToList("batch_jobs:email", "garbage");
        queue.enqueueBatchJob("email", mapper.createObjectNode().put("n", 2));

        assertThat(queue.processBatchJobs("email", 10))
                .extracting(j -> j.payload().get("n").asInt())
                .containsExactly(1, 2);
        assertThat(store.listSize("batch_jobs:email")).isZero();
    }

    @Test
    void queueSizesArePerType() {
        queue.enqueueBatchJob("email", mapper.createObjectNode());
        queue.enqueueBatchJob("email", mapper.createObjectNode());
        queue.enqueueBatchJob("sms", mapper.createObjectNode());

        assertThat(queue.queueSizes()).containsOnly(
                entry("email", 2L),
                entry("sms", 1L));
    }
}
