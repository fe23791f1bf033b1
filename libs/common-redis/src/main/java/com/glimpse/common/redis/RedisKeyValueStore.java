package com.glimpse.common.redis;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Supplier;

public class RedisKeyValueStore implements KeyValueStore {

    private static final Logger log = LoggerFactory.getLogger(RedisKeyValueStore.class);

    private static final long SCAN_COUNT = 500;

    private final StringRedisTemplate redis;
    private final RedisMessageListenerContainer listenerContainer;
    private final JsonValueCodec codec;
    private final Duration defaultTtl;

    public RedisKeyValueStore(StringRedisTemplate redis,
                              RedisMessageListenerContainer listenerContainer,
                              JsonValueCodec codec,
                              Duration defaultTtl) {
        this.redis = redis;
        this.listenerContainer = listenerContainer;
        this.codec = codec;
        this.defaultTtl = defaultTtl;
    }

    @Override
    public <T> Optional<T> get(String key, Class<T> type, CacheOptions options) {
        String fullKey = options.buildKey(key);
        String raw = guarded("get", fullKey, () -> redis.opsForValue().get(fullKey), null);
        if (raw == null) {
            return Optional.empty();
        }
        T value = codec.decode(raw, type);
        if (value == null) {
            // self-heal: drop the undecodable entry so it stops producing misses
            log.warn("Evicting undecodable cache entry key={} type={}", fullKey, type.getSimpleName());
            guarded("evict", fullKey, () -> redis.delete(fullKey), null);
        }
        return Optional.ofNullable(value);
    }

    @Override
    public void set(String key, Object value, CacheOptions options) {
        String fullKey = options.buildKey(key);
        Duration ttl = options.ttlOr(defaultTtl);
        guarded("set", fullKey, () -> {
            redis.opsForValue().set(fullKey, codec.encode(value), ttl);
            return null;
        }, null);
    }

    @Override
    public void delete(String key, CacheOptions options) {
        String fullKey = options.buildKey(key);
        guarded("delete", fullKey, () -> redis.delete(fullKey), null);
    }

    @Override
    public boolean exists(String key, CacheOptions options) {
        String fullKey = options.buildKey(key);
        Boolean res = guarded("exists", fullKey, () -> redis.hasKey(fullKey), Boolean.FALSE);
        return Boolean.TRUE.equals(res);
    }

    @Override
    public List<String> keys(String pattern) {
        List<String> res = guarded("scan", pattern, () -> scan(pattern), null);
        return res == null ? List.of() : res;
    }

    private List<String> scan(String pattern) {
        ScanOptions options = ScanOptions.scanOptions().match(pattern).count(SCAN_COUNT).build();
        List<String> out = new ArrayList<>();
        try (Cursor<String> cursor = redis.scan(options)) {
            while (cursor.hasNext()) {
                out.add(cursor.next());
            }
        }
        return out;
    }

    @Override
    public void invalidate(String pattern) {
        List<String> matched = keys(pattern);
        if (matched.isEmpty()) {
            return;
        }
        Long removed = guarded("invalidate", pattern, () -> redis.delete(matched), 0L);
        log.debug("Invalidated pattern={} removed={}", pattern, removed);
    }

    @Override
    public void addToSortedSet(String key, String member, double score) {
        guarded("zadd", key, () -> redis.opsForZSet().add(key, member, score), null);
    }

    @Override
    public List<String> rangeSortedSet(String key) {
        Set<String> res = guarded("zrange", key, () -> redis.opsForZSet().range(key, 0, -1), null);
        return res == null ? List.of() : new ArrayList<>(res);
    }

    @Override
    public List<String> rangeSortedSetByScore(String key, double min, double max) {
        Set<String> res = guarded("zrangebyscore", key, () -> redis.opsForZSet().rangeByScore(key, min, max), null);
        return res == null ? List.of() : new ArrayList<>(res);
    }

    @Override
    public boolean removeFromSortedSet(String key, String member) {
        Long removed = guarded("zrem", key, () -> redis.opsForZSet().remove(key, member), 0L);
        return removed != null && removed > 0;
    }

    @Override
    public long sortedSetSize(String key) {
        Long size = guarded("zcard", key, () -> redis.opsForZSet().zCard(key), 0L);
        return size == null ? 0 : size;
    }

    @Override
    public void pushToList(String key, String value) {
        guarded("lpush", key, () -> redis.opsForList().leftPush(key, value), null);
    }

    @Override
    public List<String> rangeList(String key) {
        List<String> res = guarded("lrange", key, () -> redis.opsForList().range(key, 0, -1), null);
        return res == null ? List.of() : res;
    }

    @Override
    public Optional<String> popFromListTail(String key) {
        return Optional.ofNullable(guarded("rpop", key, () -> redis.opsForList().rightPop(key), null));
    }

    @Override
    public long listSize(String key) {
        Long size = guarded("llen", key, () -> redis.opsForList().size(key), 0L);
        return size == null ? 0 : size;
    }

    @Override
    public void expire(String key, Duration ttl) {
        guarded("expire", key, () -> redis.expire(key, ttl), null);
    }

    @Override
    public void publish(String channel, String message) {
        guarded("publish", channel, () -> redis.convertAndSend(channel, message), null);
    }

    @Override
    public Subscription subscribe(String channel, Consumer<String> listener) {
        ChannelTopic topic = new ChannelTopic(channel);
        MessageListener adapter = (message, pattern) -> {
            try {
                listener.accept(new String(message.getBody(), StandardCharsets.UTF_8));
            } catch (Exception e) {
                log.warn("Subscriber failed channel={}", channel, e);
            }
        };
        listenerContainer.addMessageListener(adapter, topic);
        log.debug("Subscribed channel={}", channel);
        return () -> listenerContainer.removeMessageListener(adapter, topic);
    }

    private <T> T guarded(String op, String key, Supplier<T> action, T fallback) {
        try {
            return action.get();
        } catch (Exception e) {
            log.warn("Redis {} failed, degrading key={}", op, key, e);
            return fallback;
        }
    }
}
