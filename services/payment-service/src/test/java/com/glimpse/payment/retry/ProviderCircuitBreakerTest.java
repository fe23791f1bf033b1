package com.glimpse.payment.retry;

import com.glimpse.payment.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class ProviderCircuitBreakerTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2026-02-01T00:00:00Z"));
    private final ProviderCircuitBreaker breaker = new ProviderCircuitBreaker(5, Duration.ofMinutes(5), clock);

    @Test
    void opensAfterFiveConsecutiveFailures() {
        for (int i = 0; i < 4; i++) {
            breaker.recordFailure("card");
        }
        assertThat(breaker.isOpen("card")).isFalse();

        breaker.recordFailure("card");

        assertThat(breaker.isOpen("card")).isTrue();
        assertThat(breaker.snapshot("card").openedAt()).isEqualTo(clock.instant());
        assertThat(breaker.isOpen("wallet")).isFalse();
    }

    @Test
    void closesAndClearsCountAfterCooldown() {
        for (int i = 0; i < 5; i++) {
            breaker.recordFailure("card");
        }
        clock.advance(Duration.ofMinutes(4));
        assertThat(breaker.isOpen("card")).isTrue();

        clock.advance(Duration.ofMinutes(1));

        assertThat(breaker.isOpen("card")).isFalse();
        assertThat(breaker.snapshot("card").consecutiveFailures()).isZero();
    }

    @Test
    void successResetsFailureCount() {
        for (int i = 0; i < 4; i++) {
            breaker.recordFailure("card");
        }
        breaker.recordSuccess("card");
        breaker.recordFailure("card");

        assertThat(breaker.snapshot("card")).isEqualTo(new CircuitBreakerState(1, false, null));
    }
}
