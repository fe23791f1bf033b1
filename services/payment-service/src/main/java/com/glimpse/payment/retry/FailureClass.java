package com.glimpse.payment.retry;

public enum FailureClass {
    CLIENT,
    TRANSIENT;

    public boolean retryable() {
        return this == TRANSIENT;
    }
}
