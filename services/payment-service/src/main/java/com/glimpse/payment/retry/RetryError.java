package com.glimpse.payment.retry;

import java.time.Instant;

public record RetryError(Instant timestamp, String error, String provider) {
}
