package com.glimpse.common.idempotency.store;

import com.glimpse.common.idempotency.IdempotencyRecord;

import java.time.Duration;
import java.util.Optional;

public interface IdempotencyStore {

    Optional<IdempotencyRecord> find(String key);

    void save(String key, IdempotencyRecord record, Duration ttl);
}
