package com.glimpse.payment.api.dto;

import java.time.Instant;
import java.util.Map;

public record PaymentResponse(
        String operationId,
        String status,
        String transactionId,
        Map<String, Object> details,
        Instant nextRetryAt,
        String message
) {
}
