package com.glimpse.payment.processor;

import java.util.Map;

public record PaymentResult(String operationId, String transactionId, String status, Map<String, Object> details) {
}
