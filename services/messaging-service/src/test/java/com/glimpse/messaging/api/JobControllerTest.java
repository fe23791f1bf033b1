package com.glimpse.messaging.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.glimpse.common.redis.InMemoryKeyValueStore;
import com.glimpse.common.redis.JsonValueCodec;
import com.glimpse.messaging.MutableClock;
import com.glimpse.messaging.metrics.MessagingMetrics;
import com.glimpse.messaging.queue.BatchJobQueue;
import com.glimpse.messaging.queue.DelayedJobQueue;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class JobControllerTest {

    private MutableClock clock;
    private DelayedJobQueue delayedJobQueue;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T08:00:00Z"));
        JsonValueCodec codec = new JsonValueCodec(new ObjectMapper());
        InMemoryKeyValueStore store = new InMemoryKeyValueStore(codec, clock, Duration.ofMinutes(5));
        MessagingMetrics metrics = new MessagingMetrics(new SimpleMeterRegistry());
        delayedJobQueue = new DelayedJobQueue(store, codec, clock, "delayed_jobs", metrics);
        BatchJobQueue batchJobQueue = new BatchJobQueue(store, codec, clock, Duration.ofDays(1), 10, metrics);
        mvc = MockMvcBuilders.standaloneSetup(new JobController(delayedJobQueue, batchJobQueue))
                .setControllerAdvice(new MessagingExceptionHandler(clock))
                .build();
    }

    @Test
    void delayedJobIsScheduled() throws Exception {
        mvc.perform(post("/api/v1/jobs/delayed")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"type\":\"digest\",\"data\":{\"userId\":\"u1\"},\"delayMs\":30000}"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.id").value(startsWith("delayed_")))
                .andExpect(jsonPath("$.type").value("digest"));

        clock.advance(Duration.ofSeconds(30));
        assertThat(delayedJobQueue.findDue(20)).hasSize(1);
    }

    @Test
    void delayedJobNeedsType() throws Exception {
        mvc.perform(post("/api/v1/jobs/delayed")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"data\":{},\"delayMs\":0}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_FAILED"));
    }

    @Test
    void batchJobsAreTakenOldestFirst() throws Exception {
        for (String n : new String[]{"1", "2", "3"}) {
            mvc.perform(post("/api/v1/jobs/batch/email")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"data\":{\"n\":" + n + "}}"))
                    .andExpect(status().isAccepted())
                    .andExpect(jsonPath("$.id").value(startsWith("batch_")));
        }

        mvc.perform(post("/api/v1/jobs/batch/email/process").param("batchSize", "2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[0].payload.n").value(1))
                .andExpect(jsonPath("$[1].payload.n").value(2));

        mvc.perform(post("/api/v1/jobs/batch/email/process"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)));
    }

    @Test
    void nonPositiveBatchSizeIsRejected() throws Exception {
        mvc.perform(post("/api/v1/jobs/batch/email/process").param("batchSize", "0"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_PARAMETER"));
    }
}
