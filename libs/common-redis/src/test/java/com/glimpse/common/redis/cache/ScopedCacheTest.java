package com.glimpse.common.redis.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.glimpse.common.redis.InMemoryKeyValueStore;
import com.glimpse.common.redis.JsonValueCodec;
import com.glimpse.common.redis.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static com.glimpse.common.redis.cache.ScopedCache.Scope.GROUP;
import static com.glimpse.common.redis.cache.ScopedCache.Scope.USER;
import static org.assertj.core.api.Assertions.assertThat;

class ScopedCacheTest {

    private MutableClock clock;
    private ScopedCache cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        cache = new ScopedCache(new InMemoryKeyValueStore(new JsonValueCodec(new ObjectMapper()), clock, Duration.ofMinutes(5)));
    }

    @Test
    void invalidatingAScopeLeavesOthersAlone() {
        cache.put(USER, "u1", "likes", 3, Duration.ofMinutes(1));
        cache.put(USER, "u1", "matches", 1, Duration.ofMinutes(1));
        cache.put(GROUP, "u1", "likes", 9, Duration.ofMinutes(1));

        cache.invalidate(USER, "u1");

        assertThat(cache.get(USER, "u1", "likes", Integer.class)).isEmpty();
        assertThat(cache.get(GROUP, "u1", "likes", Integer.class)).contains(9);
    }

    @Test
    void premiumStatusLastsTenMinutes() {
        cache.putPremiumStatus("u1", true);

        assertThat(cache.premiumStatus("u1")).contains(true);
        clock.advance(Duration.ofMinutes(10));
        assertThat(cache.premiumStatus("u1")).isEmpty();
    }
}
