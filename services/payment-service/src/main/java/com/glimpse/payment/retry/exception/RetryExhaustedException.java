package com.glimpse.payment.retry.exception;

public class RetryExhaustedException extends RuntimeException {

    private final String operationId;
    private final int attempts;

    public RetryExhaustedException(String operationId, int attempts, Throwable cause) {
        super("Payment could not be processed after " + attempts
                + " attempts, please use a different payment method", cause);
        this.operationId = operationId;
        this.attempts = attempts;
    }

    public String getOperationId() {
        return operationId;
    }

    public int getAttempts() {
        return attempts;
    }
}
