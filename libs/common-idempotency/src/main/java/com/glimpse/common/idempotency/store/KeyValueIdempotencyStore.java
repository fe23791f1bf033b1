package com.glimpse.common.idempotency.store;

import com.glimpse.common.idempotency.IdempotencyRecord;
import com.glimpse.common.redis.CacheOptions;
import com.glimpse.common.redis.KeyValueStore;

import java.time.Duration;
import java.util.Optional;

/**
 * Stores records under {@code <prefix>:<key>}, by default {@code idempotency:<key>}.
 */
public class KeyValueIdempotencyStore implements IdempotencyStore {

    private final KeyValueStore store;
    private final String prefix;

    public KeyValueIdempotencyStore(KeyValueStore store, String prefix) {
        this.store = store;
        this.prefix = prefix;
    }

    @Override
    public Optional<IdempotencyRecord> find(String key) {
        return store.get(key, IdempotencyRecord.class, CacheOptions.prefixed(prefix));
    }

    @Override
    public void save(String key, IdempotencyRecord record, Duration ttl) {
        store.set(key, record, new CacheOptions(ttl, prefix));
    }
}
