package com.glimpse.payment.api.dto;

import com.glimpse.payment.webhook.WebhookDeliveryOutcome;

public record WebhookDeliveryResponse(String webhookId, WebhookDeliveryOutcome outcome) {
}
