package com.glimpse.payment.retry;

import java.time.Duration;

public record RetryConfig(int maxRetries, Duration initialDelay, Duration maxDelay, double backoffFactor) {

    public static final RetryConfig DEFAULT =
            new RetryConfig(3, Duration.ofSeconds(5), Duration.ofMinutes(5), 2.0);

    public RetryConfig {
        if (maxRetries < 1) {
            throw new IllegalArgumentException("maxRetries must be >= 1");
        }
        if (initialDelay == null || initialDelay.isNegative()) {
            throw new IllegalArgumentException("initialDelay must be >= 0");
        }
        if (maxDelay == null || maxDelay.compareTo(initialDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be >= initialDelay");
        }
        if (backoffFactor < 1.0) {
            throw new IllegalArgumentException("backoffFactor must be >= 1");
        }
    }
}
