package com.glimpse.messaging.realtime;

import com.glimpse.common.redis.JsonValueCodec;
import com.glimpse.common.redis.KeyValueStore;
import com.glimpse.common.redis.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Consumer;

/**
 * Best-effort JSON events over the store's pub/sub. Nothing is persisted; subscribers that are
 * not connected miss the event.
 */
public class RealtimeEventChannel {

    private static final Logger log = LoggerFactory.getLogger(RealtimeEventChannel.class);

    private final KeyValueStore store;
    private final JsonValueCodec codec;

    public RealtimeEventChannel(KeyValueStore store, JsonValueCodec codec) {
        this.store = store;
        this.codec = codec;
    }

    public void publishEvent(String channel, Object event) {
        String payload;
        try {
            payload = codec.encode(event);
        } catch (IllegalStateException e) {
            log.warn("Realtime event not encodable channel={}", channel, e);
            return;
        }
        store.publish(channel, payload);
    }

    public <T> Subscription subscribeToChannel(String channel, Class<T> type, Consumer<T> callback) {
        return store.subscribe(channel, raw -> {
            T event = codec.decode(raw, type);
            if (event == null) {
                log.warn("Dropping unparseable realtime event channel={}", channel);
                return;
            }
            callback.accept(event);
        });
    }
}
