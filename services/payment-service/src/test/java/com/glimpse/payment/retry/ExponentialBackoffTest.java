package com.glimpse.payment.retry;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class ExponentialBackoffTest {

    private final RetryConfig config = RetryConfig.DEFAULT;

    @Test
    void baseDelayDoublesPerAttemptAndCapsAtMax() {
        ExponentialBackoff backoff = new ExponentialBackoff(0.1, () -> 0.0);

        assertThat(backoff.delay(1, config)).isEqualTo(Duration.ofSeconds(5));
        assertThat(backoff.delay(2, config)).isEqualTo(Duration.ofSeconds(10));
        assertThat(backoff.delay(3, config)).isEqualTo(Duration.ofSeconds(20));
        assertThat(backoff.delay(10, config)).isEqualTo(Duration.ofMinutes(5));
    }

    @Test
    void followsCustomFactorAndCap() {
        ExponentialBackoff backoff = new ExponentialBackoff(0.0);
        Duration initial = Duration.ofMillis(200);
        Duration max = Duration.ofSeconds(2);

        assertThat(backoff.baseDelay(1, initial, max, 3.0)).isEqualTo(Duration.ofMillis(200));
        assertThat(backoff.baseDelay(2, initial, max, 3.0)).isEqualTo(Duration.ofMillis(600));
        assertThat(backoff.baseDelay(3, initial, max, 3.0)).isEqualTo(Duration.ofMillis(1800));
        assertThat(backoff.baseDelay(4, initial, max, 3.0)).isEqualTo(Duration.ofSeconds(2));
        assertThat(backoff.baseDelay(50, initial, max, 3.0)).isEqualTo(Duration.ofSeconds(2));
    }

    @Test
    void constantFactorKeepsInitialDelay() {
        ExponentialBackoff backoff = new ExponentialBackoff(0.0);

        assertThat(backoff.baseDelay(5, Duration.ofSeconds(1), Duration.ofSeconds(30), 1.0))
                .isEqualTo(Duration.ofSeconds(1));
    }

    @Test
    void jitterAddsAtMostTenPercent() {
        ExponentialBackoff max = new ExponentialBackoff(0.1, () -> 0.999999);
        ExponentialBackoff real = new ExponentialBackoff(0.1);

        assertThat(max.delay(2, config)).isBetween(Duration.ofSeconds(10), Duration.ofSeconds(11));
        for (int attempt = 1; attempt <= 12; attempt++) {
            Duration base = real.baseDelay(attempt, config.initialDelay(), config.maxDelay(), config.backoffFactor());
            Duration delay = real.delay(attempt, config);
            assertThat(delay).isGreaterThanOrEqualTo(base);
            assertThat(delay.toMillis()).isLessThanOrEqualTo((long) (base.toMillis() * 1.1));
        }
    }
}
