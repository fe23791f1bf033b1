package com.glimpse.payment.infrastructure;

import com.glimpse.payment.domain.PaymentStatus;
import com.glimpse.payment.domain.PaymentStatusRecord;

import java.util.Optional;

/**
 * Status of the payment that owns a retried operation.
 */
public interface PaymentStatusRepository {

    Optional<PaymentStatusRecord> find(String operationId);

    default Optional<PaymentStatus> status(String operationId) {
        return find(operationId).map(PaymentStatusRecord::status);
    }

    /**
     * Marks the operation PENDING unless it already has a status.
     */
    void markPendingIfAbsent(String operationId);

    void markCompleted(String operationId, String transactionId);

    void markFailed(String operationId, String reason);
}
