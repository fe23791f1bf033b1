package com.glimpse.payment.api;

import com.glimpse.payment.api.dto.WebhookDeliveryRequest;
import com.glimpse.payment.api.dto.WebhookDeliveryResponse;
import com.glimpse.payment.webhook.WebhookDeliveryOutcome;
import com.glimpse.payment.webhook.WebhookRetryService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/webhooks")
public class WebhookController {

    private final WebhookRetryService webhookRetryService;

    public WebhookController(WebhookRetryService webhookRetryService) {
        this.webhookRetryService = webhookRetryService;
    }

    @PostMapping("/{webhookId}/deliveries")
    public ResponseEntity<WebhookDeliveryResponse> deliver(@PathVariable("webhookId") String webhookId,
                                                           @Valid @RequestBody WebhookDeliveryRequest request) {
        WebhookDeliveryOutcome outcome = webhookRetryService.retryWebhookDelivery(
                webhookId, request.url(), request.payload(), request.headers());
        HttpStatus status = switch (outcome) {
            case DELIVERED -> HttpStatus.OK;
            case RETRY_SCHEDULED -> HttpStatus.ACCEPTED;
            case DEAD_LETTERED -> HttpStatus.BAD_GATEWAY;
            case ALREADY_EXHAUSTED -> HttpStatus.CONFLICT;
        };
        return ResponseEntity.status(status).body(new WebhookDeliveryResponse(webhookId, outcome));
    }
}
