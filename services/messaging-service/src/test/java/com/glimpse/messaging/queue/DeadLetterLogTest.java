package com.glimpse.messaging.queue;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.glimpse.common.redis.InMemoryKeyValueStore;
import com.glimpse.common.redis.JsonValueCodec;
import com.glimpse.messaging.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DeadLetterLogTest {

    private MutableClock clock;
    private DeadLetterLog deadLetterLog;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T23:59:59Z"));
        JsonValueCodec codec = new JsonValueCodec(new ObjectMapper());
        deadLetterLog = new DeadLetterLog(new InMemoryKeyValueStore(codec, clock, Duration.ofMinutes(5)),
                codec, clock, Duration.ofDays(30));
    }

    @Test
    void entriesAreGroupedByUtcDayNewestFirst() {
        deadLetterLog.record(new PushNotification("u1", "a", "a", Map.of(), 3));
        clock.advance(Duration.ofSeconds(2));
        deadLetterLog.record(new PushNotification("u2", "b", "b", Map.of(), 3));
        deadLetterLog.record(new PushNotification("u3", "c", "c", Map.of(), 3));

        assertThat(deadLetterLog.list(LocalDate.of(2026, 3, 1)))
                .extracting(f -> f.notification().recipientId())
                .containsExactly("u1");
        assertThat(deadLetterLog.list(LocalDate.of(2026, 3, 2)))
                .extracting(f -> f.notification().recipientId())
                .containsExactly("u3", "u2");
    }

    @Test
    void entriesExpireAfterTtl() {
        deadLetterLog.record(new PushNotification("u1", "a", "a", Map.of(), 3));

        clock.advance(Duration.ofDays(30));

        assertThat(deadLetterLog.list(LocalDate.of(2026, 3, 1))).isEmpty();
    }

    @Test
    void recordCarriesFailureTime() {
        deadLetterLog.record(new PushNotification("u1", "a", "a", Map.of(), 3));

        assertThat(deadLetterLog.list(LocalDate.of(2026, 3, 1)).get(0).failedAt())
                .isEqualTo(Instant.parse("2026-03-01T23:59:59Z"));
    }
}
