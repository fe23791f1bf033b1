package com.glimpse.payment.config;

import com.glimpse.common.redis.KeyValueStore;
import com.glimpse.payment.infrastructure.KeyValuePaymentStatusRepository;
import com.glimpse.payment.infrastructure.PaymentFailureLog;
import com.glimpse.payment.infrastructure.PaymentStatusRepository;
import com.glimpse.payment.processor.PaymentProcessor;
import com.glimpse.payment.processor.RestPaymentGatewayClient;
import com.glimpse.payment.retry.ExponentialBackoff;
import com.glimpse.payment.retry.PaymentErrorClassifier;
import com.glimpse.payment.retry.PaymentRetryMetrics;
import com.glimpse.payment.retry.PaymentRetryOrchestrator;
import com.glimpse.payment.retry.PaymentRetrySweepScheduler;
import com.glimpse.payment.retry.ProviderCircuitBreaker;
import com.glimpse.payment.webhook.HttpWebhookSender;
import com.glimpse.payment.webhook.WebhookRetryService;
import com.glimpse.payment.webhook.WebhookSender;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;

@Configuration(proxyBeanMethods = false)
public class PaymentRetryConfiguration {

    @Bean
    public ProviderCircuitBreaker providerCircuitBreaker(PaymentRetryProperties props, Clock clock) {
        return new ProviderCircuitBreaker(props.getBreaker().getFailureThreshold(), props.getBreaker().getCooldown(), clock);
    }

    @Bean
    public PaymentErrorClassifier paymentErrorClassifier() {
        return new PaymentErrorClassifier();
    }

    @Bean
    public ExponentialBackoff exponentialBackoff(PaymentRetryProperties props) {
        return new ExponentialBackoff(props.getJitterRatio());
    }

    @Bean
    public PaymentRetryMetrics paymentRetryMetrics(MeterRegistry registry) {
        return new PaymentRetryMetrics(registry);
    }

    @Bean
    @ConditionalOnMissingBean
    public PaymentStatusRepository paymentStatusRepository(KeyValueStore store, Clock clock, PaymentRetryProperties props) {
        return new KeyValuePaymentStatusRepository(store, clock, props.getStatusTtl());
    }

    @Bean
    public PaymentFailureLog paymentFailureLog(KeyValueStore store, PaymentRetryProperties props) {
        return new PaymentFailureLog(store, props.getFailureRecordTtl());
    }

    @Bean
    @ConditionalOnMissingBean
    public PaymentProcessor paymentProcessor(RestTemplateBuilder builder, PaymentGatewayProperties gateway) {
        RestTemplate restTemplate = builder
                .rootUri(gateway.getBaseUrl())
                .setConnectTimeout(gateway.getConnectTimeout())
                .setReadTimeout(gateway.getReadTimeout())
                .build();
        return new RestPaymentGatewayClient(restTemplate, gateway.getProcessPath());
    }

    @Bean
    @ConditionalOnMissingBean
    public WebhookSender webhookSender(RestTemplateBuilder builder, PaymentGatewayProperties gateway) {
        return new HttpWebhookSender(builder
                .setConnectTimeout(gateway.getConnectTimeout())
                .setReadTimeout(gateway.getReadTimeout())
                .build());
    }

    @Bean
    public PaymentRetryOrchestrator paymentRetryOrchestrator(KeyValueStore store,
                                                             PaymentProcessor processor,
                                                             PaymentStatusRepository statusRepository,
                                                             PaymentFailureLog failureLog,
                                                             ProviderCircuitBreaker circuitBreaker,
                                                             PaymentErrorClassifier classifier,
                                                             ExponentialBackoff backoff,
                                                             TaskScheduler taskScheduler,
                                                             PaymentRetryMetrics metrics,
                                                             Clock clock,
                                                             PaymentRetryProperties props) {
        return new PaymentRetryOrchestrator(store, processor, statusRepository, failureLog, circuitBreaker,
                classifier, backoff, taskScheduler, metrics, clock, props.toRetryConfig(), props.getStateTtl());
    }

    @Bean
    public WebhookRetryService webhookRetryService(KeyValueStore store,
                                                   WebhookSender sender,
                                                   ExponentialBackoff backoff,
                                                   TaskScheduler taskScheduler,
                                                   Clock clock,
                                                   PaymentRetryProperties props) {
        PaymentRetryProperties.Webhook webhook = props.getWebhook();
        return new WebhookRetryService(store, sender, backoff, taskScheduler, clock, props.toRetryConfig(),
                webhook.getMaxAttempts(), webhook.getStateTtl(), webhook.getDeadLetterTtl());
    }

    @Bean
    @ConditionalOnProperty(prefix = "payment.retry", name = "sweep-enabled", havingValue = "true", matchIfMissing = true)
    public PaymentRetrySweepScheduler paymentRetrySweepScheduler(PaymentRetryOrchestrator orchestrator) {
        return new PaymentRetrySweepScheduler(orchestrator);
    }
}
