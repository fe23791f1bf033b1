package com.glimpse.payment.retry.exception;

import java.time.Duration;
import java.time.Instant;

/**
 * The attempt failed transiently and another one is scheduled. Callers treat this as
 * "accepted, still in progress" rather than as an error.
 */
public class RetryScheduledException extends RuntimeException {

    private final String operationId;
    private final int attempt;
    private final Duration delay;
    private final Instant nextRetryAt;

    public RetryScheduledException(String operationId, int attempt, Duration delay, Instant nextRetryAt, Throwable cause) {
        super("Payment failed, retrying automatically in " + Math.max(1, (delay.toMillis() + 999) / 1000) + " seconds", cause);
        this.operationId = operationId;
        this.attempt = attempt;
        this.delay = delay;
        this.nextRetryAt = nextRetryAt;
    }

    public String getOperationId() {
        return operationId;
    }

    public int getAttempt() {
        return attempt;
    }

    public Duration getDelay() {
        return delay;
    }

    public Instant getNextRetryAt() {
        return nextRetryAt;
    }
}
