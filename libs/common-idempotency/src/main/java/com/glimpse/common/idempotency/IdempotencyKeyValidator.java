package com.glimpse.common.idempotency;

import org.springframework.util.StringUtils;

import java.util.regex.Pattern;

/**
 * Accepts UUID-shaped keys or 32 to 64 hex characters.
 */
public class IdempotencyKeyValidator {

    private static final Pattern UUID_LIKE =
            Pattern.compile("^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$");
    private static final Pattern HEX = Pattern.compile("^[0-9a-fA-F]{32,64}$");

    public boolean isValid(String key) {
        if (!StringUtils.hasText(key)) {
            return false;
        }
        return UUID_LIKE.matcher(key).matches() || HEX.matcher(key).matches();
    }
}
