package com.glimpse.payment.api.dto;

import com.glimpse.payment.domain.PaymentStatus;
import com.glimpse.payment.retry.RetryState;

import java.time.Instant;

public record PaymentStatusResponse(
        String operationId,
        PaymentStatus status,
        String transactionId,
        String reason,
        Instant updatedAt,
        RetryState retry
) {
}
