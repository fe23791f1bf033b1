package com.glimpse.messaging.push;

import com.glimpse.messaging.metrics.MessagingMetrics;
import com.glimpse.messaging.queue.PushRetryQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Scheduled;

import java.util.List;

/**
 * Polls the push retry queue, emits one {@link PushRetryReadyEvent} per due entry and then
 * removes it. A crash between the two re-emits the entry on the next poll.
 */
public class PushRetryProcessor {

    private static final Logger log = LoggerFactory.getLogger(PushRetryProcessor.class);

    private final PushRetryQueue queue;
    private final ApplicationEventPublisher publisher;
    private final MessagingMetrics metrics;

    public PushRetryProcessor(PushRetryQueue queue, ApplicationEventPublisher publisher, MessagingMetrics metrics) {
        this.queue = queue;
        this.publisher = publisher;
        this.metrics = metrics;
    }

    @Scheduled(fixedDelayString = "${messaging.push.poll-interval-ms:30000}")
    public void poll() {
        List<PushRetryQueue.DueEntry> due;
        try {
            due = queue.findDue();
        } catch (Exception e) {
            log.error("Error reading push retry queue", e);
            return;
        }
        if (due.isEmpty()) return;

        int emitted = 0;
        for (PushRetryQueue.DueEntry entry : due) {
            try {
                publisher.publishEvent(new PushRetryReadyEvent(entry.message().id(), entry.notification()));
                queue.remove(entry);
                metrics.incPushRetryEmitted();
                emitted++;
            } catch (Exception e) {
                log.error("Failed to process push retry id={}", entry.message().id(), e);
            }
        }
        log.debug("Push retry poll emitted={} due={}", emitted, due.size());
    }
}
