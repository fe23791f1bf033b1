package com.glimpse.messaging.jobs;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.glimpse.common.redis.InMemoryKeyValueStore;
import com.glimpse.common.redis.JsonValueCodec;
import com.glimpse.messaging.MutableClock;
import com.glimpse.messaging.metrics.MessagingMetrics;
import com.glimpse.messaging.queue.DelayedJobQueue;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class DelayedJobProcessorTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private MutableClock clock;
    private DelayedJobQueue queue;
    private ApplicationEventPublisher publisher;
    private SimpleMeterRegistry registry;
    private DelayedJobProcessor processor;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T08:00:00Z"));
        JsonValueCodec codec = new JsonValueCodec(mapper);
        InMemoryKeyValueStore store = new InMemoryKeyValueStore(codec, clock, Duration.ofMinutes(5));
        registry = new SimpleMeterRegistry();
        MessagingMetrics metrics = new MessagingMetrics(registry);
        queue = new DelayedJobQueue(store, codec, clock, "delayed_jobs", metrics);
        publisher = mock(ApplicationEventPublisher.class);
        processor = new DelayedJobProcessor(queue, publisher, metrics, 2);
    }

    @Test
    void dueJobIsEmittedOnceAndRemoved() {
        queue.scheduleDelayedJob("digest", mapper.createObjectNode().put("userId", "u1"), Duration.ofMinutes(1));
        clock.advance(Duration.ofMinutes(1));

        processor.processDelayedJobs();
        processor.processDelayedJobs();

        ArgumentCaptor<DelayedJobReadyEvent> captor = ArgumentCaptor.forClass(DelayedJobReadyEvent.class);
        verify(publisher, times(1)).publishEvent(captor.capture());
        assertThat(captor.getValue().jobType()).isEqualTo("digest");
        assertThat(captor.getValue().jobId()).startsWith("delayed_");
        assertThat(captor.getValue().payload().get("userId").asText()).isEqualTo("u1");
        assertThat(queue.size()).isZero();
        assertThat(registry.counter("messaging.jobs.delayed.emitted").count()).isEqualTo(1.0);
    }

    @Test
    void jobsNotYetDueAreLeftAlone() {
        queue.scheduleDelayedJob("digest", mapper.createObjectNode(), Duration.ofMinutes(1));

        processor.processDelayedJobs();

        verify(publisher, never()).publishEvent(any(Object.class));
        assertThat(queue.size()).isEqualTo(1);
    }

    @Test
    void eachRunEmitsAtMostOneBatch() {
        for (int i = 0; i < 3; i++) {
            queue.scheduleDelayedJob("digest", mapper.createObjectNode(), Duration.ZERO);
        }

        processor.processDelayedJobs();

        verify(publisher, times(2)).publishEvent(any(Object.class));
        assertThat(queue.size()).isEqualTo(1);
    }

    @Test
    void failedPublishKeepsJobForNextRun() {
        queue.scheduleDelayedJob("digest", mapper.createObjectNode(), Duration.ZERO);
        doThrow(new IllegalStateException("listener down"))
                .doNothing()
                .when(publisher).publishEvent(any(Object.class));

        processor.processDelayedJobs();
        assertThat(queue.size()).isEqualTo(1);

        processor.processDelayedJobs();
        assertThat(queue.size()).isZero();
    }
}
