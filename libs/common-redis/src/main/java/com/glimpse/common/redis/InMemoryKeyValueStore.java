package com.glimpse.common.redis;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.regex.Pattern;

/**
 * Process-local {@link KeyValueStore} with Redis semantics for ttl, glob patterns and
 * ordered-set ordering. Backs the {@code memory} store mode (single-instance deployments,
 * local runs, tests).
 */
public class InMemoryKeyValueStore implements KeyValueStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryKeyValueStore.class);

    private final Map<String, Slot> data = new HashMap<>();
    private final Map<String, List<Consumer<String>>> channels = new ConcurrentHashMap<>();
    private final JsonValueCodec codec;
    private final Clock clock;
    private final Duration defaultTtl;

    public InMemoryKeyValueStore(JsonValueCodec codec, Clock clock, Duration defaultTtl) {
        this.codec = codec;
        this.clock = clock;
        this.defaultTtl = defaultTtl;
    }

    @Override
    public synchronized <T> Optional<T> get(String key, Class<T> type, CacheOptions options) {
        String fullKey = options.buildKey(key);
        Slot slot = live(fullKey);
        if (slot == null || !(slot.value instanceof String raw)) {
            return Optional.empty();
        }
        T value = codec.decode(raw, type);
        if (value == null) {
            log.warn("Evicting undecodable cache entry key={} type={}", fullKey, type.getSimpleName());
            data.remove(fullKey);
        }
        return Optional.ofNullable(value);
    }

    @Override
    public synchronized void set(String key, Object value, CacheOptions options) {
        String fullKey = options.buildKey(key);
        String encoded;
        try {
            encoded = codec.encode(value);
        } catch (Exception e) {
            log.warn("Store set failed, degrading key={}", fullKey, e);
            return;
        }
        data.put(fullKey, new Slot(encoded, now().plus(options.ttlOr(defaultTtl))));
    }

    @Override
    public synchronized void delete(String key, CacheOptions options) {
        data.remove(options.buildKey(key));
    }

    @Override
    public synchronized boolean exists(String key, CacheOptions options) {
        return live(options.buildKey(key)) != null;
    }

    @Override
    public synchronized List<String> keys(String pattern) {
        Pattern compiled = KeyPatterns.compile(pattern);
        List<String> out = new ArrayList<>();
        for (String key : new ArrayList<>(data.keySet())) {
            if (compiled.matcher(key).matches() && live(key) != null) {
                out.add(key);
            }
        }
        return out;
    }

    @Override
    public synchronized void invalidate(String pattern) {
        for (String key : keys(pattern)) {
            data.remove(key);
        }
    }

    @Override
    public synchronized void addToSortedSet(String key, String member, double score) {
        SortedMembers set = sortedSet(key, true);
        if (set != null) {
            set.add(member, score);
        }
    }

    @Override
    public synchronized List<String> rangeSortedSet(String key) {
        SortedMembers set = sortedSet(key, false);
        return set == null ? List.of() : set.range(Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY);
    }

    @Override
    public synchronized List<String> rangeSortedSetByScore(String key, double min, double max) {
        SortedMembers set = sortedSet(key, false);
        return set == null ? List.of() : set.range(min, max);
    }

    @Override
    public synchronized boolean removeFromSortedSet(String key, String member) {
        SortedMembers set = sortedSet(key, false);
        if (set == null) {
            return false;
        }
        boolean removed = set.remove(member);
        if (set.isEmpty()) {
            data.remove(key);
        }
        return removed;
    }

    @Override
    @SuppressWarnings("unchecked")
    public synchronized void pushToList(String key, String value) {
        Slot slot = live(key);
        if (slot == null) {
            slot = new Slot(new ArrayDeque<String>(), null);
            data.put(key, slot);
        }
        if (!(slot.value instanceof Deque<?>)) {
            log.warn("Store lpush failed, wrong type key={}", key);
            return;
        }
        ((Deque<String>) slot.value).addFirst(value);
    }

    @Override
    public synchronized long sortedSetSize(String key) {
        SortedMembers set = sortedSet(key, false);
        return set == null ? 0 : set.size();
    }

    @Override
    @SuppressWarnings("unchecked")
    public synchronized Optional<String> popFromListTail(String key) {
        Slot slot = live(key);
        if (slot == null || !(slot.value instanceof Deque<?>)) {
            return Optional.empty();
        }
        Deque<String> list = (Deque<String>) slot.value;
        String last = list.pollLast();
        if (list.isEmpty()) {
            data.remove(key);
        }
        return Optional.ofNullable(last);
    }

    @Override
    public synchronized long listSize(String key) {
        Slot slot = live(key);
        return slot != null && slot.value instanceof Deque<?> list ? list.size() : 0;
    }

    @Override
    @SuppressWarnings("unchecked")
    public synchronized List<String> rangeList(String key) {
        Slot slot = live(key);
        if (slot == null || !(slot.value instanceof Deque<?>)) {
            return List.of();
        }
        return new ArrayList<>((Deque<String>) slot.value);
    }

    @Override
    public synchronized void expire(String key, Duration ttl) {
        Slot slot = live(key);
        if (slot != null) {
            slot.expiresAt = now().plus(ttl);
        }
    }

    @Override
    public void publish(String channel, String message) {
        for (Consumer<String> listener : channels.getOrDefault(channel, List.of())) {
            try {
                listener.accept(message);
            } catch (Exception e) {
                log.warn("Subscriber failed channel={}", channel, e);
            }
        }
    }

    @Override
    public Subscription subscribe(String channel, Consumer<String> listener) {
        channels.computeIfAbsent(channel, c -> new CopyOnWriteArrayList<>()).add(listener);
        return () -> channels.getOrDefault(channel, List.of()).remove(listener);
    }

    private Instant now() {
        return clock.instant();
    }

    private Slot live(String key) {
        Slot slot = data.get(key);
        if (slot == null) {
            return null;
        }
        if (slot.expiresAt != null && !now().isBefore(slot.expiresAt)) {
            data.remove(key);
            return null;
        }
        return slot;
    }

    private SortedMembers sortedSet(String key, boolean create) {
        Slot slot = live(key);
        if (slot == null) {
            if (!create) {
                return null;
            }
            slot = new Slot(new SortedMembers(), null);
            data.put(key, slot);
        }
        if (slot.value instanceof SortedMembers set) {
            return set;
        }
        log.warn("Store sorted-set op failed, wrong type key={}", key);
        return null;
    }

    private static final class Slot {
        private final Object value;
        private Instant expiresAt;

        private Slot(Object value, Instant expiresAt) {
            this.value = value;
            this.expiresAt = expiresAt;
        }
    }

    private record Scored(String member, double score) {
    }

    private static final class SortedMembers {
        private final Map<String, Double> scores = new HashMap<>();
        private final TreeSet<Scored> ordered = new TreeSet<>(
                Comparator.comparingDouble(Scored::score).thenComparing(Scored::member));

        void add(String member, double score) {
            Double previous = scores.put(member, score);
            if (previous != null) {
                ordered.remove(new Scored(member, previous));
            }
            ordered.add(new Scored(member, score));
        }

        boolean remove(String member) {
            Double previous = scores.remove(member);
            if (previous == null) {
                return false;
            }
            ordered.remove(new Scored(member, previous));
            return true;
        }

        List<String> range(double min, double max) {
            List<String> out = new ArrayList<>();
            Iterator<Scored> it = ordered.iterator();
            while (it.hasNext()) {
                Scored s = it.next();
                if (s.score() > max) {
                    break;
                }
                if (s.score() >= min) {
                    out.add(s.member());
                }
            }
            return out;
        }

        boolean isEmpty() {
            return scores.isEmpty();
        }

        int size() {
            return scores.size();
        }
    }
}
