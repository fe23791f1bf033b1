package com.glimpse.payment.webhook;

import com.glimpse.common.redis.CacheOptions;
import com.glimpse.common.redis.KeyValueStore;
import com.glimpse.payment.retry.ExponentialBackoff;
import com.glimpse.payment.retry.RetryConfig;
import com.glimpse.payment.retry.RetryError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Redelivers outbound webhooks with the payment backoff schedule. Retries run on in-process
 * timers only; after {@code maxAttempts} failures the delivery is dead-lettered.
 */
public class WebhookRetryService {

    private static final Logger log = LoggerFactory.getLogger(WebhookRetryService.class);

    static final String STATE_PREFIX = "webhook:retry";
    static final String DEAD_LETTER_PREFIX = "webhook:dead_letter";

    private final KeyValueStore store;
    private final WebhookSender sender;
    private final ExponentialBackoff backoff;
    private final TaskScheduler taskScheduler;
    private final Clock clock;
    private final RetryConfig retryConfig;
    private final int maxAttempts;
    private final CacheOptions stateOptions;
    private final CacheOptions deadLetterOptions;

    public WebhookRetryService(KeyValueStore store,
                               WebhookSender sender,
                               ExponentialBackoff backoff,
                               TaskScheduler taskScheduler,
                               Clock clock,
                               RetryConfig retryConfig,
                               int maxAttempts,
                               Duration stateTtl,
                               Duration deadLetterTtl) {
        this.store = store;
        this.sender = sender;
        this.backoff = backoff;
        this.taskScheduler = taskScheduler;
        this.clock = clock;
        this.retryConfig = retryConfig;
        this.maxAttempts = maxAttempts;
        this.stateOptions = new CacheOptions(stateTtl, STATE_PREFIX);
        this.deadLetterOptions = new CacheOptions(deadLetterTtl, DEAD_LETTER_PREFIX);
    }

    public WebhookDeliveryOutcome retryWebhookDelivery(String webhookId,
                                                      String url,
                                                      Map<String, Object> payload,
                                                      Map<String, String> headers) {
        WebhookRetryState state = store.get(webhookId, WebhookRetryState.class, stateOptions)
                .orElseGet(WebhookRetryState::initial);
        if (state.attempts() >= maxAttempts) {
            log.error("Webhook exceeded max attempts webhookId={} attempts={}", webhookId, state.attempts());
            return WebhookDeliveryOutcome.ALREADY_EXHAUSTED;
        }

        try {
            sender.send(url, payload, headers);
        } catch (RuntimeException e) {
            return handleFailure(webhookId, url, payload, headers, state, e);
        }

        store.delete(webhookId, stateOptions);
        log.info("Webhook delivered webhookId={} attempts={}", webhookId, state.attempts() + 1);
        return WebhookDeliveryOutcome.DELIVERED;
    }

    public Optional<WebhookRetryState> retryState(String webhookId) {
        return store.get(webhookId, WebhookRetryState.class, stateOptions);
    }

    public Optional<WebhookDeadLetter> deadLetter(String webhookId) {
        return store.get(webhookId, WebhookDeadLetter.class, deadLetterOptions);
    }

    private WebhookDeliveryOutcome handleFailure(String webhookId,
                                                 String url,
                                                 Map<String, Object> payload,
                                                 Map<String, String> headers,
                                                 WebhookRetryState state,
                                                 RuntimeException error) {
        Instant now = clock.instant();
        String message = error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
        RetryError retryError = new RetryError(now, message, "webhook");
        int attempts = state.attempts() + 1;

        if (attempts < maxAttempts) {
            Duration delay = backoff.delay(attempts, retryConfig);
            Instant nextRetryAt = now.plus(delay);
            store.set(webhookId, state.failed(now, retryError, nextRetryAt), stateOptions);
            schedule(webhookId, url, payload, headers, nextRetryAt);
            log.warn("Webhook delivery failed, retrying webhookId={} attempt={} delayMs={} error={}",
                    webhookId, attempts, delay.toMillis(), message);
            return WebhookDeliveryOutcome.RETRY_SCHEDULED;
        }

        WebhookRetryState exhausted = state.failed(now, retryError, null);
        store.set(webhookId, exhausted, stateOptions);
        store.set(webhookId, new WebhookDeadLetter(webhookId, url, payload, attempts, exhausted.errorHistory(), now),
                deadLetterOptions);
        log.error("Webhook dead-lettered webhookId={} attempts={}", webhookId, attempts, error);
        return WebhookDeliveryOutcome.DEAD_LETTERED;
    }

    private void schedule(String webhookId,
                          String url,
                          Map<String, Object> payload,
                          Map<String, String> headers,
                          Instant at) {
        try {
            taskScheduler.schedule(() -> {
                try {
                    retryWebhookDelivery(webhookId, url, payload, headers);
                } catch (RuntimeException e) {
                    log.error("Webhook retry failed webhookId={}", webhookId, e);
                }
            }, at);
        } catch (RuntimeException e) {
            log.warn("Webhook retry timer not armed webhookId={}", webhookId, e);
        }
    }
}
