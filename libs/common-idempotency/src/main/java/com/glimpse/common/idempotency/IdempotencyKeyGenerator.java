package com.glimpse.common.idempotency;

import jakarta.servlet.http.HttpServletRequest;

import java.util.Optional;

/**
 * Derives a deduplication key for requests that arrive without a client-supplied one.
 * Register a bean to opt in; returning empty leaves the request to the normal resolution.
 */
@FunctionalInterface
public interface IdempotencyKeyGenerator {

    Optional<String> generate(HttpServletRequest request);
}
