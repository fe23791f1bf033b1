package com.glimpse.payment.webhook;

public enum WebhookDeliveryOutcome {
    DELIVERED,
    RETRY_SCHEDULED,
    DEAD_LETTERED,
    ALREADY_EXHAUSTED
}
