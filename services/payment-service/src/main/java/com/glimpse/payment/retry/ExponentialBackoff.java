package com.glimpse.payment.retry;

import org.springframework.util.backoff.BackOffExecution;
import org.springframework.util.backoff.ExponentialBackOff;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Delay before retry {@code attempt}: the {@code attempt}-th interval of a Spring
 * {@link ExponentialBackOff} ({@code initialDelay}, {@code backoffFactor}, capped at
 * {@code maxDelay}) plus a random jitter in {@code [0, jitterRatio)} of that interval.
 */
public class ExponentialBackoff {

    private final double jitterRatio;
    private final DoubleSupplier random;

    public ExponentialBackoff(double jitterRatio) {
        this(jitterRatio, () -> ThreadLocalRandom.current().nextDouble());
    }

    public ExponentialBackoff(double jitterRatio, DoubleSupplier random) {
        if (jitterRatio < 0) {
            throw new IllegalArgumentException("jitterRatio must be >= 0");
        }
        this.jitterRatio = jitterRatio;
        this.random = random;
    }

    public Duration baseDelay(int attempt, Duration initialDelay, Duration maxDelay, double backoffFactor) {
        BackOffExecution execution = policy(initialDelay, maxDelay, backoffFactor).start();
        long interval = execution.nextBackOff();
        for (int i = 1; i < attempt; i++) {
            interval = execution.nextBackOff();
        }
        return Duration.ofMillis(interval);
    }

    public Duration delay(int attempt, RetryConfig config) {
        return delay(attempt, config.initialDelay(), config.maxDelay(), config.backoffFactor());
    }

    public Duration delay(int attempt, Duration initialDelay, Duration maxDelay, double backoffFactor) {
        Duration base = baseDelay(attempt, initialDelay, maxDelay, backoffFactor);
        long jitter = (long) (random.getAsDouble() * base.toMillis() * jitterRatio);
        return base.plusMillis(jitter);
    }

    private static ExponentialBackOff policy(Duration initialDelay, Duration maxDelay, double backoffFactor) {
        ExponentialBackOff backOff = new ExponentialBackOff(initialDelay.toMillis(), backoffFactor);
        backOff.setMaxInterval(maxDelay.toMillis());
        return backOff;
    }
}
