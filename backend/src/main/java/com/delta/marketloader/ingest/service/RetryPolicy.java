package com.delta.marketloader.ingest.service;

import com.delta.marketloader.config.LoaderProperties;

import java.time.Duration;

/**
 * Exponential backoff: attempt n waits {@code base * 2^(n-1)}, capped at {@code maxDelay}.
 */
public record RetryPolicy(int maxRetries, Duration baseDelay, Duration maxDelay) {

    public static RetryPolicy from(LoaderProperties.Retry retry) {
        return new RetryPolicy(
            retry.getMaxRetries(),
            Duration.ofMillis(retry.getBaseDelayMs()),
            Duration.ofMillis(retry.getMaxDelayMs())
        );
    }

    public Duration delayForAttempt(int attempt) {
        long base = baseDelay.toMillis();
        if (base <= 0) {
            return Duration.ZERO;
        }
        int shift = Math.min(30, Math.max(0, attempt - 1));
        long delay = base * (1L << shift);
        long cap = maxDelay.toMillis();
        if (cap > 0) {
            delay = Math.min(delay, cap);
        }
        return Duration.ofMillis(delay);
    }
}
