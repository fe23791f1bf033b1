package com.glimpse.messaging.realtime;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.glimpse.common.redis.InMemoryKeyValueStore;
import com.glimpse.common.redis.JsonValueCodec;
import com.glimpse.common.redis.Subscription;
import com.glimpse.messaging.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RealtimeEventChannelTest {

    private InMemoryKeyValueStore store;
    private RealtimeEventChannel channel;

    @BeforeEach
    void setUp() {
        JsonValueCodec codec = new JsonValueCodec(new ObjectMapper());
        store = new InMemoryKeyValueStore(codec, new MutableClock(Instant.parse("2026-03-01T08:00:00Z")), Duration.ofMinutes(5));
        channel = new RealtimeEventChannel(store, codec);
    }

    @Test
    void subscriberReceivesDecodedEvents() {
        List<TypingEvent> received = new ArrayList<>();
        Subscription subscription = channel.subscribeToChannel("chat:42", TypingEvent.class, received::add);

        channel.publishEvent("chat:42", new TypingEvent("u1", true));
        subscription.unsubscribe();
        channel.publishEvent("chat:42", new TypingEvent("u1", false));

        assertThat(received).containsExactly(new TypingEvent("u1", true));
    }

    @Test
    void unparseableEventIsDropped() {
        List<TypingEvent> received = new ArrayList<>();
        channel.subscribeToChannel("chat:42", TypingEvent.class, received::add);

        store.publish("chat:42", "{broken");
        channel.publishEvent("chat:42", new TypingEvent("u2", true));

        assertThat(received).containsExactly(new TypingEvent("u2", true));
    }

    @Test
    void eventsWithoutSubscribersAreLost() {
        channel.publishEvent("chat:42", new TypingEvent("u1", true));

        List<TypingEvent> received = new ArrayList<>();
        channel.subscribeToChannel("chat:42", TypingEvent.class, received::add);

        assertThat(received).isEmpty();
    }

    record TypingEvent(String userId, boolean typing) {
    }
}
