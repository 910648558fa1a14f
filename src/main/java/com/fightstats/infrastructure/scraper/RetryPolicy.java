package com.fightstats.infrastructure.scraper;

import java.time.Duration;

/**
 * Backoff schedule for rate-limited requests: {@code maxRetries} sleeps of
 * {@code baseBackoff * 2^attempt}, then one last attempt.
 */
public record RetryPolicy(int maxRetries, Duration baseBackoff) {

    public static final int MAX_RETRIES_LIMIT = 30;

    public RetryPolicy {
        if (maxRetries < 0 || maxRetries > MAX_RETRIES_LIMIT) {
            throw new IllegalArgumentException(
                "maxRetries must be between 0 and " + MAX_RETRIES_LIMIT + ", got " + maxRetries);
        }
        if (baseBackoff == null || baseBackoff.isNegative()) {
            throw new IllegalArgumentException("baseBackoff must be a non-negative duration");
        }
    }

    public Duration backoffFor(int attempt) {
        return baseBackoff.multipliedBy(1L << attempt);
    }
}
