package com.glimpse.payment.retry.exception;

/**
 * Non-retryable failure. The operation is marked failed and the provider's reason is kept as the cause.
 */
public class PaymentClientException extends RuntimeException {

    private final String operationId;

    public PaymentClientException(String operationId, String message, Throwable cause) {
        super(message, cause);
        this.operationId = operationId;
    }

    public String getOperationId() {
        return operationId;
    }
}
