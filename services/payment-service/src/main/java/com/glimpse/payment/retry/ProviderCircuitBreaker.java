package com.glimpse.payment.retry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-provider breaker held in process memory. Opens after {@code failureThreshold} consecutive
 * failures; after {@code cooldown} the next check closes it and clears the count.
 */
public class ProviderCircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(ProviderCircuitBreaker.class);

    private final Map<String, CircuitBreakerState> states = new ConcurrentHashMap<>();
    private final int failureThreshold;
    private final Duration cooldown;
    private final Clock clock;

    public ProviderCircuitBreaker(int failureThreshold, Duration cooldown, Clock clock) {
        this.failureThreshold = failureThreshold;
        this.cooldown = cooldown;
        this.clock = clock;
    }

    public boolean isOpen(String provider) {
        return snapshot(provider).open();
    }

    public CircuitBreakerState snapshot(String provider) {
        Instant now = clock.instant();
        CircuitBreakerState state = states.computeIfPresent(provider, (p, s) -> {
            if (s.open() && !now.isBefore(s.openedAt().plus(cooldown))) {
                log.info("Circuit cooldown elapsed, closing provider={}", p);
                return CircuitBreakerState.CLOSED;
            }
            return s;
        });
        return state == null ? CircuitBreakerState.CLOSED : state;
    }

    public void recordSuccess(String provider) {
        CircuitBreakerState previous = states.put(provider, CircuitBreakerState.CLOSED);
        if (previous != null && previous.open()) {
            log.info("Circuit closed after success provider={}", provider);
        }
    }

    public void recordFailure(String provider) {
        Instant now = clock.instant();
        boolean[] opened = new boolean[1];
        CircuitBreakerState state = states.compute(provider, (p, s) -> {
            CircuitBreakerState current = s == null ? CircuitBreakerState.CLOSED : s;
            int failures = current.consecutiveFailures() + 1;
            if (current.open()) {
                return new CircuitBreakerState(failures, true, current.openedAt());
            }
            if (failures >= failureThreshold) {
                opened[0] = true;
                return new CircuitBreakerState(failures, true, now);
            }
            return new CircuitBreakerState(failures, false, null);
        });
        if (opened[0]) {
            log.warn("Circuit opened provider={} failures={}", provider, state.consecutiveFailures());
        }
    }
}
