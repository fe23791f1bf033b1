package com.glimpse.common.redis;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Remote key-value store used as an optimization and coordination layer.
 *
 * <p>Implementations never propagate store failures: a failed read is reported as a miss
 * (or an empty result), a failed write is logged and dropped. Callers can therefore put
 * the store in front of a primary operation without the store ever failing it.</p>
 */
public interface KeyValueStore {

    <T> Optional<T> get(String key, Class<T> type, CacheOptions options);

    default <T> Optional<T> get(String key, Class<T> type) {
        return get(key, type, CacheOptions.defaults());
    }

    void set(String key, Object value, CacheOptions options);

    void delete(String key, CacheOptions options);

    default void delete(String key) {
        delete(key, CacheOptions.defaults());
    }

    boolean exists(String key, CacheOptions options);

    default boolean exists(String key) {
        return exists(key, CacheOptions.defaults());
    }

    /**
     * Lists keys matching a glob pattern ({@code *}, {@code ?}, {@code [abc]}).
     */
    List<String> keys(String pattern);

    /**
     * Deletes every key matching the pattern.
     */
    void invalidate(String pattern);

    /**
     * Cache-aside read. On a miss {@code compute} is invoked and its result stored.
     * There is no mutual exclusion: concurrent misses may each run {@code compute}.
     */
    default <T> T getOrSet(String key, Class<T> type, Supplier<T> compute, CacheOptions options) {
        Optional<T> cached = get(key, type, options);
        if (cached.isPresent()) {
            return cached.get();
        }
        T fresh = compute.get();
        if (fresh != null) {
            set(key, fresh, options);
        }
        return fresh;
    }

    // ordered sets

    void addToSortedSet(String key, String member, double score);

    /**
     * All members in ascending score order.
     */
    List<String> rangeSortedSet(String key);

    List<String> rangeSortedSetByScore(String key, double min, double max);

    boolean removeFromSortedSet(String key, String member);

    long sortedSetSize(String key);

    // lists

    void pushToList(String key, String value);

    /**
     * Newest first, as pushed by {@link #pushToList(String, String)}.
     */
    List<String> rangeList(String key);

    /**
     * Removes and returns the oldest element, so push and tail-pop form a FIFO queue.
     */
    Optional<String> popFromListTail(String key);

    long listSize(String key);

    void expire(String key, Duration ttl);

    // pub/sub

    void publish(String channel, String message);

    Subscription subscribe(String channel, Consumer<String> listener);
}
