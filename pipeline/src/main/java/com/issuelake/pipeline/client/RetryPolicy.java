package com.issuelake.pipeline.client;

import java.time.Duration;

/**
 * Bounded exponential backoff: attempt {@code n} waits {@code base * 2^(n-1)}.
 */
public record RetryPolicy(int maxAttempts, Duration backoffBase) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts);
        }
        if (backoffBase == null || backoffBase.isNegative()) {
            throw new IllegalArgumentException("backoffBase must be non-negative");
        }
    }

    public static RetryPolicy ofSeconds(int maxAttempts, double backoffSeconds) {
        return new RetryPolicy(maxAttempts, Duration.ofMillis(Math.round(backoffSeconds * 1_000)));
    }

    public Duration backoff(int attempt) {
        return backoffBase.multipliedBy(1L << Math.max(0, attempt - 1));
    }
}
