package com.glimpse.common.redis.cache;

import com.glimpse.common.redis.CacheOptions;
import com.glimpse.common.redis.KeyValueStore;

import java.time.Duration;
import java.util.Optional;

/**
 * Entity-scoped views over the {@link KeyValueStore}: {@code user:<id>:<key>},
 * {@code group:<id>:<key>} and {@code match:<id>:<key>}, each invalidated as a whole.
 */
public class ScopedCache {

    public enum Scope {
        USER("user"),
        GROUP("group"),
        MATCH("match");

        private final String namespace;

        Scope(String namespace) {
            this.namespace = namespace;
        }

        public String key(String id, String key) {
            return namespace + ":" + id + ":" + key;
        }

        public String pattern(String id) {
            return namespace + ":" + id + ":*";
        }
    }

    static final String PREMIUM_KEY = "premium";
    static final Duration PREMIUM_TTL = Duration.ofMinutes(10);

    private final KeyValueStore store;

    public ScopedCache(KeyValueStore store) {
        this.store = store;
    }

    public <T> Optional<T> get(Scope scope, String id, String key, Class<T> type) {
        return store.get(scope.key(id, key), type);
    }

    public void put(Scope scope, String id, String key, Object value, Duration ttl) {
        store.set(scope.key(id, key), value, CacheOptions.ttl(ttl));
    }

    public void invalidate(Scope scope, String id) {
        store.invalidate(scope.pattern(id));
    }

    public Optional<Boolean> premiumStatus(String userId) {
        return get(Scope.USER, userId, PREMIUM_KEY, Boolean.class);
    }

    public void putPremiumStatus(String userId, boolean premium) {
        put(Scope.USER, userId, PREMIUM_KEY, premium, PREMIUM_TTL);
    }
}
