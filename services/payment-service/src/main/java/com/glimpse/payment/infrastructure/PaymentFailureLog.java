package com.glimpse.payment.infrastructure;

import com.glimpse.common.redis.CacheOptions;
import com.glimpse.common.redis.KeyValueStore;
import com.glimpse.payment.domain.PaymentFailureRecord;

import java.time.Duration;
import java.util.Optional;

/**
 * Terminal failures kept under {@code payment:failed:<operationId>} for manual follow-up.
 */
public class PaymentFailureLog {

    static final String PREFIX = "payment:failed";

    private final KeyValueStore store;
    private final CacheOptions options;

    public PaymentFailureLog(KeyValueStore store, Duration ttl) {
        this.store = store;
        this.options = new CacheOptions(ttl, PREFIX);
    }

    public void record(PaymentFailureRecord failure) {
        store.set(failure.operationId(), failure, options);
    }

    public Optional<PaymentFailureRecord> find(String operationId) {
        return store.get(operationId, PaymentFailureRecord.class, options);
    }
}
