package com.glimpse.payment.processor;

import java.util.Map;

/**
 * Provider integration invoked by the retry orchestrator. Implementations signal failures with
 * unchecked exceptions, preferably {@link com.glimpse.payment.retry.exception.PaymentProviderException}
 * carrying the provider's status code.
 */
public interface PaymentProcessor {

    PaymentResult process(String operationId, String userId, Map<String, Object> data);
}
