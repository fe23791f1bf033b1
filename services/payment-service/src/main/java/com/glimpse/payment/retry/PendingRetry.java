package com.glimpse.payment.retry;

public record PendingRetry(String operationId, RetryState state) {
}
