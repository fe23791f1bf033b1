package com.glimpse.messaging.jobs;

import com.glimpse.messaging.metrics.MessagingMetrics;
import com.glimpse.messaging.queue.DelayedJobQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Scheduled;

import java.util.List;

/**
 * Emits a {@link DelayedJobReadyEvent} for each due delayed job, at most {@code batchSize} per run,
 * and then removes it.
 */
public class DelayedJobProcessor {

    private static final Logger log = LoggerFactory.getLogger(DelayedJobProcessor.class);

    private final DelayedJobQueue queue;
    private final ApplicationEventPublisher publisher;
    private final MessagingMetrics metrics;
    private final int batchSize;

    public DelayedJobProcessor(DelayedJobQueue queue, ApplicationEventPublisher publisher, MessagingMetrics metrics,
                               int batchSize) {
        this.queue = queue;
        this.publisher = publisher;
        this.metrics = metrics;
        this.batchSize = batchSize;
    }

    @Scheduled(cron = "${messaging.jobs.delayed-cron:0 * * * * *}")
    public void processDelayedJobs() {
        List<DelayedJobQueue.DueJob> due;
        try {
            due = queue.findDue(batchSize);
        } catch (Exception e) {
            log.error("Error reading delayed job queue", e);
            return;
        }

        for (DelayedJobQueue.DueJob entry : due) {
            try {
                publisher.publishEvent(new DelayedJobReadyEvent(entry.job().id(), entry.job().type(), entry.job().payload()));
                queue.remove(entry);
                metrics.incDelayedJobEmitted();
            } catch (Exception e) {
                log.error("Failed to process delayed job id={} type={}", entry.job().id(), entry.job().type(), e);
            }
        }
        if (!due.isEmpty()) {
            log.debug("Delayed job run emitted={}", due.size());
        }
    }
}
