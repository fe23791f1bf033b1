package com.glimpse.payment.retry;

import java.time.Instant;

public record CircuitBreakerState(int consecutiveFailures, boolean open, Instant openedAt) {

    public static final CircuitBreakerState CLOSED = new CircuitBreakerState(0, false, null);
}
