package com.glimpse.payment.processor;

import com.glimpse.payment.retry.exception.PaymentProviderException;
import com.glimpse.payment.retry.exception.TransientProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Generic JSON gateway: {@code POST <baseUrl><processPath>} with
 * {@code {operationId, userId, data}}; provider status codes are carried on the thrown exception.
 */
public class RestPaymentGatewayClient implements PaymentProcessor {

    private static final Logger log = LoggerFactory.getLogger(RestPaymentGatewayClient.class);

    private static final ParameterizedTypeReference<Map<String, Object>> RESPONSE_TYPE =
            new ParameterizedTypeReference<>() {
            };

    private final RestTemplate restTemplate;
    private final String processPath;

    public RestPaymentGatewayClient(RestTemplate restTemplate, String processPath) {
        this.restTemplate = restTemplate;
        this.processPath = processPath;
    }

    @Override
    public PaymentResult process(String operationId, String userId, Map<String, Object> data) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("operationId", operationId);
        body.put("userId", userId);
        body.put("data", data);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set("Idempotency-Key", operationId);

        try {
            ResponseEntity<Map<String, Object>> response = restTemplate.exchange(
                    processPath, HttpMethod.POST, new HttpEntity<>(body, headers), RESPONSE_TYPE, operationId);
            Map<String, Object> payload = response.getBody() == null ? Map.of() : response.getBody();
            log.debug("Gateway processed operationId={} status={}", operationId, response.getStatusCode().value());
            return new PaymentResult(
                    operationId,
                    asString(payload.get("transactionId")),
                    asString(payload.getOrDefault("status", "COMPLETED")),
                    payload);
        } catch (HttpStatusCodeException e) {
            int status = e.getStatusCode().value();
            String message = "Gateway responded " + status + ": " + e.getResponseBodyAsString();
            if (e.getStatusCode().is5xxServerError()) {
                throw new TransientProviderException(status, message, e);
            }
            throw new PaymentProviderException(status, message, e);
        } catch (ResourceAccessException e) {
            throw new TransientProviderException(0, "Gateway unreachable: " + e.getMessage(), e);
        }
    }

    private static String asString(Object value) {
        return value == null ? null : String.valueOf(value);
    }
}
