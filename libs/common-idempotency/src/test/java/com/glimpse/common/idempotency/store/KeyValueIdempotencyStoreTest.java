package com.glimpse.common.idempotency.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.glimpse.common.idempotency.IdempotencyRecord;
import com.glimpse.common.redis.InMemoryKeyValueStore;
import com.glimpse.common.redis.JsonValueCodec;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class KeyValueIdempotencyStoreTest {

    private final Instant now = Instant.parse("2026-03-01T10:00:00Z");
    private final InMemoryKeyValueStore kv = new InMemoryKeyValueStore(
            new JsonValueCodec(new ObjectMapper()), Clock.fixed(now, ZoneOffset.UTC), Duration.ofMinutes(5));
    private final KeyValueIdempotencyStore store = new KeyValueIdempotencyStore(kv, "idempotency");

    @Test
    void savesUnderPrefixedKeyAndReadsBack() {
        IdempotencyRecord record = IdempotencyRecord.of(201, "{\"ok\":true}".getBytes(StandardCharsets.UTF_8),
                Map.of("Content-Type", List.of("application/json")), now);

        store.save("k-1", record, Duration.ofHours(24));

        assertThat(kv.exists("idempotency:k-1")).isTrue();
        IdempotencyRecord loaded = store.find("k-1").orElseThrow();
        assertThat(loaded.statusCode()).isEqualTo(201);
        assertThat(new String(loaded.bodyBytes(), StandardCharsets.UTF_8)).isEqualTo("{\"ok\":true}");
        assertThat(loaded.headers()).containsEntry("Content-Type", List.of("application/json"));
        assertThat(loaded.cachedAt()).isEqualTo(now);
    }

    @Test
    void unknownKeyIsEmpty() {
        assertThat(store.find("missing")).isEmpty();
    }
}
