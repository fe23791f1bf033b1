package com.glimpse.payment.retry.exception;

/**
 * Raised by a {@link com.glimpse.payment.processor.PaymentProcessor} when the provider answered
 * with an error. {@code statusCode} is the provider's HTTP status, or 0 when there was none.
 */
public class PaymentProviderException extends RuntimeException {

    private final int statusCode;

    public PaymentProviderException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public PaymentProviderException(int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
