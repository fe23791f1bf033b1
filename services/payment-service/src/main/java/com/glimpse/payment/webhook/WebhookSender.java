package com.glimpse.payment.webhook;

import java.util.Map;

/**
 * Delivers one webhook. Any non-2xx answer or transport error is reported by throwing.
 */
public interface WebhookSender {

    void send(String url, Map<String, Object> payload, Map<String, String> headers);
}
