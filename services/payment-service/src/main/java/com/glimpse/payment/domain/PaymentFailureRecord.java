package com.glimpse.payment.domain;

import java.time.Instant;

public record PaymentFailureRecord(String operationId, int attempts, String reason, Instant failedAt) {
}
