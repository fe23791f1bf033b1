package com.glimpse.payment.retry.exception;

public class TransientProviderException extends PaymentProviderException {

    public TransientProviderException(String message) {
        super(0, message);
    }

    public TransientProviderException(int statusCode, String message, Throwable cause) {
        super(statusCode, message, cause);
    }
}
