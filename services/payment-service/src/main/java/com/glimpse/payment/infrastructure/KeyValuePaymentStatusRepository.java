package com.glimpse.payment.infrastructure;

import com.glimpse.common.redis.CacheOptions;
import com.glimpse.common.redis.KeyValueStore;
import com.glimpse.payment.domain.PaymentStatus;
import com.glimpse.payment.domain.PaymentStatusRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

public class KeyValuePaymentStatusRepository implements PaymentStatusRepository {

    private static final Logger log = LoggerFactory.getLogger(KeyValuePaymentStatusRepository.class);

    static final String PREFIX = "payment:status";

    private final KeyValueStore store;
    private final Clock clock;
    private final CacheOptions options;

    public KeyValuePaymentStatusRepository(KeyValueStore store, Clock clock, Duration ttl) {
        this.store = store;
        this.clock = clock;
        this.options = new CacheOptions(ttl, PREFIX);
    }

    @Override
    public Optional<PaymentStatusRecord> find(String operationId) {
        return store.get(operationId, PaymentStatusRecord.class, options);
    }

    @Override
    public void markPendingIfAbsent(String operationId) {
        if (find(operationId).isEmpty()) {
            write(operationId, PaymentStatus.PENDING, null, null);
        }
    }

    @Override
    public void markCompleted(String operationId, String transactionId) {
        write(operationId, PaymentStatus.COMPLETED, transactionId, null);
    }

    @Override
    public void markFailed(String operationId, String reason) {
        write(operationId, PaymentStatus.FAILED, null, reason);
    }

    private void write(String operationId, PaymentStatus status, String transactionId, String reason) {
        store.set(operationId, new PaymentStatusRecord(operationId, status, transactionId, reason, clock.instant()), options);
        log.debug("Payment status operationId={} status={}", operationId, status);
    }
}
