package com.glimpse.payment.webhook;

import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestTemplate;

import java.util.Map;

public class HttpWebhookSender implements WebhookSender {

    private final RestTemplate restTemplate;

    public HttpWebhookSender(RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
    }

    @Override
    public void send(String url, Map<String, Object> payload, Map<String, String> headers) {
        HttpHeaders httpHeaders = new HttpHeaders();
        httpHeaders.setContentType(MediaType.APPLICATION_JSON);
        if (headers != null) {
            headers.forEach(httpHeaders::set);
        }
        // RestTemplate raises HttpStatusCodeException for 4xx/5xx
        restTemplate.postForEntity(url, new HttpEntity<>(payload, httpHeaders), Void.class);
    }
}
