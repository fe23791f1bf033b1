package com.glimpse.payment.domain;

import java.time.Instant;

public record PaymentStatusRecord(String operationId,
                                  PaymentStatus status,
                                  String transactionId,
                                  String reason,
                                  Instant updatedAt) {
}
