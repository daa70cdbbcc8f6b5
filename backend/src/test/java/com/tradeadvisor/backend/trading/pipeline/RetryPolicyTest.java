package com.tradeadvisor.backend.trading.pipeline;

import com.tradeadvisor.backend.exception.AdvisorUnavailableException;
import io.github.resilience4j.retry.Retry;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryPolicyTest {

    @Test
    void backoffDoublesUpToCap() {
        RetryPolicy policy = RetryPolicy.defaults();

        assertThat(policy.delayAfterAttempt(1)).isEqualTo(Duration.ofSeconds(2));
        assertThat(policy.delayAfterAttempt(2)).isEqualTo(Duration.ofSeconds(4));
        assertThat(policy.delayAfterAttempt(3)).isEqualTo(Duration.ofSeconds(8));
        assertThat(policy.delayAfterAttempt(4)).isEqualTo(Duration.ofSeconds(8));
    }

    @Test
    void retriesOnlyRetryableFailures() {
        RetryPolicy policy = new RetryPolicy(3, Duration.ofMillis(1), Duration.ofMillis(2));
        AtomicInteger retryable = new AtomicInteger();
        AtomicInteger fatal = new AtomicInteger();

        assertThatThrownBy(() -> Retry.decorateSupplier(Retry.of("t1", policy.toRetryConfig()), () -> {
            retryable.incrementAndGet();
            throw new AdvisorUnavailableException("503", true);
        }).get()).isInstanceOf(AdvisorUnavailableException.class);
        assertThatThrownBy(() -> Retry.decorateSupplier(Retry.of("t2", policy.toRetryConfig()), () -> {
            fatal.incrementAndGet();
            throw new AdvisorUnavailableException("401", false);
        }).get()).isInstanceOf(AdvisorUnavailableException.class);

        assertThat(retryable.get()).isEqualTo(3);
        assertThat(fatal.get()).isEqualTo(1);
    }

    @Test
    void rejectsInvalidPolicies() {
        assertThatThrownBy(() -> new RetryPolicy(0, Duration.ZERO, Duration.ZERO)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RetryPolicy(1, Duration.ofMillis(-1), Duration.ZERO)).isInstanceOf(IllegalArgumentException.class);
    }
}
