package com.glimpse.payment.retry;

public enum RetryPhase {
    NEW,
    RUNNING,
    SUCCEEDED,
    RETRY_SCHEDULED,
    FAILED_TERMINAL
}
