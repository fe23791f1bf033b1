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
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DelayedJobQueueTest {

    private static final String QUEUE_KEY = "delayed_jobs";

    private final ObjectMapper mapper = new ObjectMapper();
    private MutableClock clock;
    private InMemoryKeyValueStore store;
    private SimpleMeterRegistry registry;
    private DelayedJobQueue queue;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T08:00:00Z"));
        JsonValueCodec codec = new JsonValueCodec(mapper);
        store = new InMemoryKeyValueStore(codec, clock, Duration.ofMinutes(5));
        registry = new SimpleMeterRegistry();
        queue = new DelayedJobQueue(store, codec, clock, QUEUE_KEY, new MessagingMetrics(registry));
    }

    @Test
    void jobBecomesDueOnceItsDelayElapses() {
        QueueMessage job = queue.scheduleDelayedJob("digest", mapper.createObjectNode().put("userId", "u1"),
                Duration.ofMinutes(5));

        assertThat(job.id()).startsWith("delayed_");
        assertThat(queue.size()).isEqualTo(1);

        clock.advance(Duration.ofMinutes(5).minusMillis(1));
        assertThat(queue.findDue(20)).isEmpty();

        clock.advance(Duration.ofMillis(1));
        List<DelayedJobQueue.DueJob> due = queue.findDue(20);
        assertThat(due).singleElement().satisfies(d -> {
            assertThat(d.job().type()).isEqualTo("digest");
            assertThat(d.job().payload().get("userId").asText()).isEqualTo("u1");
        });
        assertThat(registry.counter("messaging.jobs.delayed.scheduled").count()).isEqualTo(1.0);
    }

    @Test
    void findDueHonoursLimitEarliestFirst() {
        for (int i = 0; i < 3; i++) {
            queue.scheduleDelayedJob("job-" + i, mapper.createObjectNode(), Duration.ofSeconds(3 - i));
        }
        clock.advance(Duration.ofSeconds(3));

        assertThat(queue.findDue(2)).extracting(d -> d.job().type()).containsExactly("job-2", "job-1");
    }

    @Test
    void removeTakesJobOffTheQueue() {
        queue.scheduleDelayedJob("digest", mapper.createObjectNode(), Duration.ZERO);
        DelayedJobQueue.DueJob due = queue.findDue(20).get(0);

        assertThat(queue.remove(due)).isTrue();
        assertThat(queue.size()).isZero();
    }

    @Test
    void negativeDelayIsRejected() {
        assertThatThrownBy(() -> queue.scheduleDelayedJob("digest", mapper.createObjectNode(), Duration.ofSeconds(-1)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void undecodableEntriesAreDropped() {
        store.addToSortedSet(QUEUE_KEY, "garbage", 0);

        assertThat(queue.findDue(20)).isEmpty();
        assertThat(queue.size()).isZero();
    }
}
