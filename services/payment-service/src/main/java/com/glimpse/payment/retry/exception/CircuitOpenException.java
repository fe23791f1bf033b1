package com.glimpse.payment.retry.exception;

public class CircuitOpenException extends RuntimeException {

    private final String provider;

    public CircuitOpenException(String provider) {
        super("Payment provider " + provider + " is temporarily unavailable");
        this.provider = provider;
    }

    public String getProvider() {
        return provider;
    }
}
