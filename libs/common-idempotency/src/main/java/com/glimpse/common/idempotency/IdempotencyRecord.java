package com.glimpse.common.idempotency;

import java.time.Instant;
import java.util.Base64;
import java.util.List;
import java.util.Map;

/**
 * A successful response captured for replay. The body is kept as base64 so it replays
 * byte-for-byte regardless of content type.
 */
public record IdempotencyRecord(int statusCode,
                                String body,
                                Map<String, List<String>> headers,
                                Instant cachedAt) {

    public static IdempotencyRecord of(int statusCode, byte[] body, Map<String, List<String>> headers, Instant cachedAt) {
        return new IdempotencyRecord(statusCode, Base64.getEncoder().encodeToString(body), Map.copyOf(headers), cachedAt);
    }

    public byte[] bodyBytes() {
        return body == null ? new byte[0] : Base64.getDecoder().decode(body);
    }
}
