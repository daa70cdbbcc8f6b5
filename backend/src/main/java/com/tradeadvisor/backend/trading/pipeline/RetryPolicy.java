package com.tradeadvisor.backend.trading.pipeline;

import com.tradeadvisor.backend.exception.AdvisorUnavailableException;
import io.github.resilience4j.retry.RetryConfig;

import java.time.Duration;

/**
 * Bounded exponential backoff: the wait after the n-th failed attempt is
 * {@code min(baseDelay * 2^(n-1), capDelay)}.
 */
public record RetryPolicy(int maxAttempts, Duration baseDelay, Duration capDelay) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (baseDelay == null || baseDelay.isNegative() || capDelay == null || capDelay.isNegative()) {
            throw new IllegalArgumentException("delays must be non-negative");
        }
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(3, Duration.ofSeconds(2), Duration.ofSeconds(8));
    }

    public Duration delayAfterAttempt(int failedAttempts) {
        int exponent = Math.max(0, Math.min(failedAttempts - 1, 30));
        long delayMs = baseDelay.toMillis() * (1L << exponent);
        return Duration.ofMillis(Math.min(delayMs, capDelay.toMillis()));
    }

    /**
     * Retries only {@link AdvisorUnavailableException}s flagged retryable.
     */
    public RetryConfig toRetryConfig() {
        return RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(attempt -> delayAfterAttempt(attempt).toMillis())
                .retryOnException(ex -> ex instanceof AdvisorUnavailableException unavailable && unavailable.isRetryable())
                .build();
    }
}
