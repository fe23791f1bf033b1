package com.glimpse.messaging.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.glimpse.common.redis.InMemoryKeyValueStore;
import com.glimpse.common.redis.JsonValueCodec;
import com.glimpse.messaging.MutableClock;
import com.glimpse.messaging.metrics.MessagingMetrics;
import com.glimpse.messaging.queue.BatchJobQueue;
import com.glimpse.messaging.queue.DeadLetterLog;
import com.glimpse.messaging.queue.DelayedJobQueue;
import com.glimpse.messaging.queue.OfflineMessageQueue;
import com.glimpse.messaging.queue.PushNotification;
import com.glimpse.messaging.queue.PushRetryQueue;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class MessagingControllerTest {

    private MutableClock clock;
    private final ObjectMapper mapper = new ObjectMapper();
    private PushRetryQueue pushRetryQueue;
    private DelayedJobQueue delayedJobQueue;
    private BatchJobQueue batchJobQueue;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T08:00:00Z"));
        JsonValueCodec codec = new JsonValueCodec(mapper);
        InMemoryKeyValueStore store = new InMemoryKeyValueStore(codec, clock, Duration.ofMinutes(5));
        MessagingMetrics metrics = new MessagingMetrics(new SimpleMeterRegistry());
        OfflineMessageQueue offlineQueue = new OfflineMessageQueue(store, codec, clock, Duration.ofDays(7), metrics);
        pushRetryQueue = new PushRetryQueue(store, codec, new DeadLetterLog(store, codec, clock, Duration.ofDays(30)),
                clock, "push_notification_retry_queue", 3, Duration.ofSeconds(60), metrics);
        delayedJobQueue = new DelayedJobQueue(store, codec, clock, "delayed_jobs", metrics);
        batchJobQueue = new BatchJobQueue(store, codec, clock, Duration.ofDays(1), 10, metrics);
        mvc = MockMvcBuilders.standaloneSetup(
                        new MessagingController(offlineQueue, pushRetryQueue, delayedJobQueue, batchJobQueue))
                .setControllerAdvice(new MessagingExceptionHandler(clock))
                .build();
    }

    @Test
    void offlineMessagesAreReturnedInOrderUntilCleared() throws Exception {
        for (String text : new String[]{"A", "B", "C"}) {
            mvc.perform(post("/api/v1/messages/offline/u1")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"message\":{\"text\":\"" + text + "\"}}"))
                    .andExpect(status().isAccepted())
                    .andExpect(jsonPath("$.recipientId").value("u1"))
                    .andExpect(jsonPath("$.type").value("offline_message"));
        }

        mvc.perform(get("/api/v1/messages/offline/u1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(3)))
                .andExpect(jsonPath("$[0].payload.text").value("A"))
                .andExpect(jsonPath("$[1].payload.text").value("B"))
                .andExpect(jsonPath("$[2].payload.text").value("C"));

        mvc.perform(delete("/api/v1/messages/offline/u1"))
                .andExpect(status().isNoContent());

        mvc.perform(get("/api/v1/messages/offline/u1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(0)));
    }

    @Test
    void messageBodyIsRequired() throws Exception {
        mvc.perform(post("/api/v1/messages/offline/u1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"type\":\"chat\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_FAILED"));
    }

    @Test
    void statsCountQueuesRetriesAndJobs() throws Exception {
        mvc.perform(post("/api/v1/messages/offline/u1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"message\":{\"text\":\"A\"}}"));
        mvc.perform(post("/api/v1/messages/offline/u2")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"message\":{\"text\":\"B\"}}"));
        pushRetryQueue.enqueueRetry(new PushNotification("u3", "Hi", "there", Map.of(), 0));
        delayedJobQueue.scheduleDelayedJob("digest", mapper.createObjectNode(), Duration.ofMinutes(5));
        batchJobQueue.enqueueBatchJob("email", mapper.createObjectNode());
        batchJobQueue.enqueueBatchJob("email", mapper.createObjectNode());
        batchJobQueue.enqueueBatchJob("sms", mapper.createObjectNode());

        mvc.perform(get("/api/v1/messages/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.offlineQueues").value(2))
                .andExpect(jsonPath("$.pushRetryQueueSize").value(1))
                .andExpect(jsonPath("$.delayedJobsSize").value(1))
                .andExpect(jsonPath("$.batchJobQueues.email").value(2))
                .andExpect(jsonPath("$.batchJobQueues.sms").value(1));
    }
}
