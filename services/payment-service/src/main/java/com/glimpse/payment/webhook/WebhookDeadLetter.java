package com.glimpse.payment.webhook;

import com.glimpse.payment.retry.RetryError;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record WebhookDeadLetter(String webhookId,
                                String url,
                                Map<String, Object> payload,
                                int attempts,
                                List<RetryError> errorHistory,
                                Instant deadLetteredAt) {
}
