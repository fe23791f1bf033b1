package com.glimpse.messaging.config;

import com.glimpse.common.redis.JsonValueCodec;
import com.glimpse.common.redis.KeyValueStore;
import com.glimpse.messaging.jobs.DelayedJobProcessor;
import com.glimpse.messaging.metrics.MessagingMetrics;
import com.glimpse.messaging.push.PushNotificationDispatcher;
import com.glimpse.messaging.push.PushRetryDispatchListener;
import com.glimpse.messaging.push.PushRetryProcessor;
import com.glimpse.messaging.queue.BatchJobQueue;
import com.glimpse.messaging.queue.DeadLetterLog;
import com.glimpse.messaging.queue.DelayedJobQueue;
import com.glimpse.messaging.queue.OfflineMessageQueue;
import com.glimpse.messaging.queue.PushRetryQueue;
import com.glimpse.messaging.realtime.RealtimeEventChannel;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration(proxyBeanMethods = false)
public class MessagingConfiguration {

    @Bean
    public MessagingMetrics messagingMetrics(MeterRegistry registry) {
        return new MessagingMetrics(registry);
    }

    @Bean
    public OfflineMessageQueue offlineMessageQueue(KeyValueStore store, JsonValueCodec codec, Clock clock,
                                                   MessagingQueueProperties props, MessagingMetrics metrics) {
        return new OfflineMessageQueue(store, codec, clock, props.getOffline().getTtl(), metrics);
    }

    @Bean
    public DeadLetterLog deadLetterLog(KeyValueStore store, JsonValueCodec codec, Clock clock,
                                       MessagingQueueProperties props) {
        return new DeadLetterLog(store, codec, clock, props.getDeadLetter().getTtl());
    }

    @Bean
    public PushRetryQueue pushRetryQueue(KeyValueStore store, JsonValueCodec codec, DeadLetterLog deadLetterLog,
                                         Clock clock, MessagingQueueProperties props, MessagingMetrics metrics) {
        MessagingQueueProperties.Push push = props.getPush();
        return new PushRetryQueue(store, codec, deadLetterLog, clock, push.getQueueKey(),
                push.getMaxRetries(), push.getRetryDelay(), metrics);
    }

    @Bean
    @ConditionalOnProperty(prefix = "messaging.push", name = "poll-enabled", havingValue = "true", matchIfMissing = true)
    public PushRetryProcessor pushRetryProcessor(PushRetryQueue queue, ApplicationEventPublisher publisher,
                                                 MessagingMetrics metrics) {
        return new PushRetryProcessor(queue, publisher, metrics);
    }

    @Bean
    public PushRetryDispatchListener pushRetryDispatchListener(ObjectProvider<PushNotificationDispatcher> dispatcher,
                                                               PushRetryQueue queue, MessagingMetrics metrics) {
        return new PushRetryDispatchListener(dispatcher, queue, metrics);
    }

    @Bean
    public DelayedJobQueue delayedJobQueue(KeyValueStore store, JsonValueCodec codec, Clock clock,
                                           MessagingQueueProperties props, MessagingMetrics metrics) {
        return new DelayedJobQueue(store, codec, clock, props.getJobs().getDelayedKey(), metrics);
    }

    @Bean
    @ConditionalOnProperty(prefix = "messaging.jobs", name = "delayed-poll-enabled", havingValue = "true", matchIfMissing = true)
    public DelayedJobProcessor delayedJobProcessor(DelayedJobQueue queue, ApplicationEventPublisher publisher,
                                                   MessagingQueueProperties props, MessagingMetrics metrics) {
        return new DelayedJobProcessor(queue, publisher, metrics, props.getJobs().getDelayedBatchSize());
    }

    @Bean
    public BatchJobQueue batchJobQueue(KeyValueStore store, JsonValueCodec codec, Clock clock,
                                       MessagingQueueProperties props, MessagingMetrics metrics) {
        MessagingQueueProperties.Jobs jobs = props.getJobs();
        return new BatchJobQueue(store, codec, clock, jobs.getBatchTtl(), jobs.getBatchSize(), metrics);
    }

    @Bean
    public RealtimeEventChannel realtimeEventChannel(KeyValueStore store, JsonValueCodec codec) {
        return new RealtimeEventChannel(store, codec);
    }
}
