package com.glimpse.payment.retry;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What a resumed attempt needs to call the processor again.
 */
public record PaymentContext(String userId, String provider, Map<String, Object> data) {

    public PaymentContext {
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }
}
