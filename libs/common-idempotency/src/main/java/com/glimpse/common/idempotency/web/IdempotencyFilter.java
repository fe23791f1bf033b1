package com.glimpse.common.idempotency.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.glimpse.common.idempotency.IdempotencyHeaders;
import com.glimpse.common.idempotency.IdempotencyKeyGenerator;
import com.glimpse.common.idempotency.IdempotencyKeyValidator;
import com.glimpse.common.idempotency.IdempotencyRecord;
import com.glimpse.common.idempotency.store.IdempotencyStore;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.util.AntPathMatcher;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.ContentCachingResponseWrapper;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Executor;

/**
 * Deduplicates mutating requests by idempotency key.
 *
 * <p>Key resolution: {@code Idempotency-Key}, then {@code X-Idempotency-Key}, then the optional
 * {@link IdempotencyKeyGenerator}. Requests without a key on a required path are rejected with 400;
 * other requests without a key pass through unprotected.</p>
 *
 * <p>A stored record is replayed verbatim with {@code X-Idempotent-Replayed: true} and the handler
 * is not invoked. Only 2xx outcomes are stored, from a background task, so a failed attempt stays
 * retryable under the same key.</p>
 */
public class IdempotencyFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(IdempotencyFilter.class);

    private static final Set<String> MUTATING_METHODS = Set.of("POST", "PUT", "PATCH", "DELETE");
    private static final Set<String> SKIPPED_HEADERS = Set.of(
            HttpHeaders.CONTENT_LENGTH.toLowerCase(),
            HttpHeaders.TRANSFER_ENCODING.toLowerCase(),
            IdempotencyHeaders.REPLAYED.toLowerCase()
    );

    private final IdempotencyStore store;
    private final IdempotencyKeyValidator validator;
    private final Optional<IdempotencyKeyGenerator> keyGenerator;
    private final List<String> requiredPaths;
    private final Duration ttl;
    private final Executor writeExecutor;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final AntPathMatcher pathMatcher = new AntPathMatcher();

    public IdempotencyFilter(IdempotencyStore store,
                             IdempotencyKeyValidator validator,
                             Optional<IdempotencyKeyGenerator> keyGenerator,
                             List<String> requiredPaths,
                             Duration ttl,
                             Executor writeExecutor,
                             ObjectMapper objectMapper,
                             Clock clock) {
        this.store = store;
        this.validator = validator;
        this.keyGenerator = keyGenerator;
        this.requiredPaths = List.copyOf(requiredPaths);
        this.ttl = ttl;
        this.writeExecutor = writeExecutor;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !MUTATING_METHODS.contains(request.getMethod().toUpperCase());
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String clientKey = clientSuppliedKey(request);
        String key;
        if (clientKey != null) {
            if (!validator.isValid(clientKey)) {
                reject(response, "INVALID_IDEMPOTENCY_KEY",
                        "Idempotency key must be a UUID or 32-64 hex characters");
                return;
            }
            key = clientKey;
        } else {
            key = keyGenerator.flatMap(g -> g.generate(request)).filter(StringUtils::hasText).orElse(null);
        }

        if (key == null) {
            if (isKeyRequired(request)) {
                reject(response, "IDEMPOTENCY_KEY_REQUIRED",
                        IdempotencyHeaders.IDEMPOTENCY_KEY + " header is required");
                return;
            }
            filterChain.doFilter(request, response);
            return;
        }

        Optional<IdempotencyRecord> existing = store.find(key);
        if (existing.isPresent()) {
            log.debug("Idempotent replay key={} status={}", key, existing.get().statusCode());
            replay(existing.get(), response);
            return;
        }

        ContentCachingResponseWrapper wrapper = new ContentCachingResponseWrapper(response);
        try {
            filterChain.doFilter(request, wrapper);
            int status = wrapper.getStatus();
            if (HttpStatusCode.valueOf(status).is2xxSuccessful()) {
                persistInBackground(key, IdempotencyRecord.of(status, wrapper.getContentAsByteArray(),
                        captureHeaders(wrapper), clock.instant()));
            } else {
                log.debug("Idempotent key not recorded, non-2xx key={} status={}", key, status);
            }
        } finally {
            wrapper.copyBodyToResponse();
        }
    }

    private String clientSuppliedKey(HttpServletRequest request) {
        String key = request.getHeader(IdempotencyHeaders.IDEMPOTENCY_KEY);
        if (!StringUtils.hasText(key)) {
            key = request.getHeader(IdempotencyHeaders.X_IDEMPOTENCY_KEY);
        }
        return StringUtils.hasText(key) ? key.trim() : null;
    }

    private boolean isKeyRequired(HttpServletRequest request) {
        String path = request.getRequestURI();
        for (String pattern : requiredPaths) {
            if (pathMatcher.match(pattern, path)) {
                return true;
            }
        }
        return false;
    }

    private void persistInBackground(String key, IdempotencyRecord record) {
        try {
            writeExecutor.execute(() -> {
                try {
                    store.save(key, record, ttl);
                } catch (Exception e) {
                    log.warn("Idempotency record write failed key={}", key, e);
                }
            });
        } catch (Exception e) {
            log.warn("Idempotency record write not scheduled key={}", key, e);
        }
    }

    private Map<String, List<String>> captureHeaders(HttpServletResponse response) {
        Map<String, List<String>> headers = new LinkedHashMap<>();
        for (String name : response.getHeaderNames()) {
            if (SKIPPED_HEADERS.contains(name.toLowerCase())) {
                continue;
            }
            headers.put(name, new ArrayList<>(response.getHeaders(name)));
        }
        if (response.getContentType() != null && headers.keySet().stream()
                .noneMatch(HttpHeaders.CONTENT_TYPE::equalsIgnoreCase)) {
            headers.put(HttpHeaders.CONTENT_TYPE, List.of(response.getContentType()));
        }
        return headers;
    }

    private void replay(IdempotencyRecord record, HttpServletResponse response) throws IOException {
        response.setStatus(record.statusCode());
        if (record.headers() != null) {
            record.headers().forEach((name, values) -> {
                if (HttpHeaders.CONTENT_TYPE.equalsIgnoreCase(name) && !values.isEmpty()) {
                    response.setContentType(values.get(0));
                    return;
                }
                values.forEach(v -> response.addHeader(name, v));
            });
        }
        response.setHeader(IdempotencyHeaders.REPLAYED, "true");
        byte[] body = record.bodyBytes();
        response.setContentLength(body.length);
        response.getOutputStream().write(body);
        response.flushBuffer();
    }

    private void reject(HttpServletResponse response, String code, String message) throws IOException {
        response.setStatus(HttpStatus.BAD_REQUEST.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        objectMapper.writeValue(response.getOutputStream(), Map.of("code", code, "message", message));
    }
}
