package com.glimpse.payment.domain;

public enum PaymentStatus {
    PENDING,
    COMPLETED,
    FAILED
}
