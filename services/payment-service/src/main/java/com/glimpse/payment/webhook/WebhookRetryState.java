package com.glimpse.payment.webhook;

import com.glimpse.payment.retry.RetryError;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

public record WebhookRetryState(int attempts, Instant lastAttemptAt, Instant nextRetryAt, List<RetryError> errorHistory) {

    public WebhookRetryState {
        errorHistory = errorHistory == null ? List.of() : List.copyOf(errorHistory);
    }

    public static WebhookRetryState initial() {
        return new WebhookRetryState(0, null, null, List.of());
    }

    public WebhookRetryState failed(Instant at, RetryError error, Instant nextRetryAt) {
        List<RetryError> history = new ArrayList<>(errorHistory);
        history.add(error);
        return new WebhookRetryState(attempts + 1, at, nextRetryAt, history);
    }
}
