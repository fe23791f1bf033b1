package com.glimpse.messaging.push;

import com.glimpse.messaging.metrics.MessagingMetrics;
import com.glimpse.messaging.queue.PushRetryQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.event.EventListener;

public class PushRetryDispatchListener {

    private static final Logger log = LoggerFactory.getLogger(PushRetryDispatchListener.class);

    private final ObjectProvider<PushNotificationDispatcher> dispatcher;
    private final PushRetryQueue queue;
    private final MessagingMetrics metrics;

    public PushRetryDispatchListener(ObjectProvider<PushNotificationDispatcher> dispatcher,
                                     PushRetryQueue queue,
                                     MessagingMetrics metrics) {
        this.dispatcher = dispatcher;
        this.queue = queue;
        this.metrics = metrics;
    }

    @EventListener
    public void onRetryReady(PushRetryReadyEvent event) {
        PushNotificationDispatcher target = dispatcher.getIfAvailable();
        if (target == null) {
            log.debug("No push dispatcher configured, retry event left to other listeners id={}", event.messageId());
            return;
        }
        try {
            target.dispatch(event.notification());
            log.debug("Push retry dispatched id={} recipientId={}", event.messageId(), event.notification().recipientId());
        } catch (RuntimeException e) {
            metrics.incPushDispatchFailed();
            log.warn("Push retry dispatch failed, re-enqueueing id={} attempts={}",
                    event.messageId(), event.notification().attempts(), e);
            queue.enqueueRetry(event.notification());
        }
    }
}
