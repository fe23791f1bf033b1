package com.glimpse.payment.retry;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Persisted under {@code payment:retry:<operationId>}. Instances are immutable; every transition
 * returns a new state that the orchestrator writes back.
 */
public record RetryState(int attempts,
                         Instant lastAttemptAt,
                         Instant nextRetryAt,
                         List<RetryError> errorHistory,
                         RetryPhase phase,
                         PaymentContext context) {

    public RetryState {
        errorHistory = errorHistory == null ? List.of() : List.copyOf(errorHistory);
        phase = phase == null ? RetryPhase.NEW : phase;
    }

    public static RetryState initial(PaymentContext context) {
        return new RetryState(0, null, null, List.of(), RetryPhase.NEW, context);
    }

    public RetryState startAttempt(Instant now, PaymentContext context) {
        return new RetryState(attempts + 1, now, null, errorHistory, RetryPhase.RUNNING, context);
    }

    public RetryState scheduleNext(RetryError error, Instant nextRetryAt) {
        return new RetryState(attempts, lastAttemptAt, nextRetryAt, append(error), RetryPhase.RETRY_SCHEDULED, context);
    }

    public RetryState failTerminally(RetryError error) {
        return new RetryState(attempts, lastAttemptAt, null, error == null ? errorHistory : append(error),
                RetryPhase.FAILED_TERMINAL, context);
    }

    public boolean exhaustedFor(RetryConfig config) {
        return attempts >= config.maxRetries();
    }

    public boolean dueAt(Instant now) {
        return phase == RetryPhase.RETRY_SCHEDULED && nextRetryAt != null && !now.isBefore(nextRetryAt);
    }

    private List<RetryError> append(RetryError error) {
        List<RetryError> history = new ArrayList<>(errorHistory);
        history.add(error);
        return history;
    }
}
