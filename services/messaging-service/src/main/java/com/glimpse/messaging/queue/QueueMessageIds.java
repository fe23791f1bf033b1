package com.glimpse.messaging.queue;

import java.time.Clock;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Ids of the form {@code <prefix>_<epochMillis>_<random base36>}.
 */
final class QueueMessageIds {

    private QueueMessageIds() {
    }

    static String next(String prefix, Clock clock) {
        String random = Long.toString(ThreadLocalRandom.current().nextLong(Long.MAX_VALUE), 36);
        return prefix + "_" + clock.millis() + "_" + random.substring(0, Math.min(9, random.length()));
    }
}
