package com.glimpse.common.redis;

import org.springframework.util.StringUtils;

import java.time.Duration;

/**
 * Per-call options for {@link KeyValueStore}. A {@code null} ttl means the store default.
 */
public record CacheOptions(Duration ttl, String prefix) {

    private static final CacheOptions DEFAULTS = new CacheOptions(null, null);

    public static CacheOptions defaults() {
        return DEFAULTS;
    }

    public static CacheOptions ttl(Duration ttl) {
        return new CacheOptions(ttl, null);
    }

    public static CacheOptions prefixed(String prefix) {
        return new CacheOptions(null, prefix);
    }

    public CacheOptions withTtl(Duration ttl) {
        return new CacheOptions(ttl, prefix);
    }

    public String buildKey(String key) {
        return StringUtils.hasText(prefix) ? prefix + ":" + key : key;
    }

    public Duration ttlOr(Duration fallback) {
        return ttl == null || ttl.isZero() || ttl.isNegative() ? fallback : ttl;
    }
}
