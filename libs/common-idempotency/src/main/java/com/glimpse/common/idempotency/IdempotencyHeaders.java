package com.glimpse.common.idempotency;

public final class IdempotencyHeaders {

    public static final String IDEMPOTENCY_KEY = "Idempotency-Key";
    public static final String X_IDEMPOTENCY_KEY = "X-Idempotency-Key";
    public static final String REPLAYED = "X-Idempotent-Replayed";

    private IdempotencyHeaders() {
    }
}
