package com.glimpse.payment.retry.exception;

/**
 * Another attempt for the same operation is running in this process.
 */
public class RetryInProgressException extends RuntimeException {

    private final String operationId;

    public RetryInProgressException(String operationId) {
        super("Payment " + operationId + " is already being processed");
        this.operationId = operationId;
    }

    public String getOperationId() {
        return operationId;
    }
}
