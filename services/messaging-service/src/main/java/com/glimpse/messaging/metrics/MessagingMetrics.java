package com.glimpse.messaging.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

public class MessagingMetrics {

    private final Counter offlineEnqueued;
    private final Counter pushRetryEnqueued;
    private final Counter pushDeadLettered;
    private final Counter pushRetryEmitted;
    private final Counter pushDispatchFailed;
    private final Counter delayedJobScheduled;
    private final Counter delayedJobEmitted;
    private final Counter batchJobEnqueued;
    private final Counter batchJobProcessed;

    public MessagingMetrics(MeterRegistry registry) {
        this.offlineEnqueued = Counter.builder("messaging.offline.enqueued").register(registry);
        this.pushRetryEnqueued = Counter.builder("messaging.push.retry.enqueued").register(registry);
        this.pushDeadLettered = Counter.builder("messaging.push.retry.dead_lettered").register(registry);
        this.pushRetryEmitted = Counter.builder("messaging.push.retry.emitted").register(registry);
        this.pushDispatchFailed = Counter.builder("messaging.push.dispatch.failed").register(registry);
        this.delayedJobScheduled = Counter.builder("messaging.jobs.delayed.scheduled").register(registry);
        this.delayedJobEmitted = Counter.builder("messaging.jobs.delayed.emitted").register(registry);
        this.batchJobEnqueued = Counter.builder("messaging.jobs.batch.enqueued").register(registry);
        this.batchJobProcessed = Counter.builder("messaging.jobs.batch.processed").register(registry);
    }

    public void incOfflineEnqueued() { offlineEnqueued.increment(); }
    public void incPushRetryEnqueued() { pushRetryEnqueued.increment(); }
    public void incPushDeadLettered() { pushDeadLettered.increment(); }
    public void incPushRetryEmitted() { pushRetryEmitted.increment(); }
    public void incPushDispatchFailed() { pushDispatchFailed.increment(); }
    public void incDelayedJobScheduled() { delayedJobScheduled.increment(); }
    public void incDelayedJobEmitted() { delayedJobEmitted.increment(); }
    public void incBatchJobEnqueued() { batchJobEnqueued.increment(); }
    public void incBatchJobsProcessed(int count) { batchJobProcessed.increment(count); }
}
