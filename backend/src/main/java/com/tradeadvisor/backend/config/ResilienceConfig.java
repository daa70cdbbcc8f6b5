package com.tradeadvisor.backend.config;

import com.tradeadvisor.backend.exception.AdvisorUnavailableException;
import com.tradeadvisor.backend.trading.pipeline.RetryPolicy;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;

import java.time.Duration;

@Configuration
public class ResilienceConfig {

    @Bean
    public CircuitBreaker advisorCircuitBreaker(AdvisorProperties advisorProperties) {
        AdvisorProperties.Circuit circuit = advisorProperties.getCircuit();
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .failureRateThreshold(circuit.getFailureRateThreshold())
                .waitDurationInOpenState(Duration.ofSeconds(circuit.getWaitOpenSeconds()))
                .slidingWindowSize(circuit.getSlidingWindowSize())
                .recordException(ex -> ex instanceof AdvisorUnavailableException)
                .build();
        return CircuitBreaker.of("advisor", config);
    }

    @Bean
    public RetryPolicy advisorRetryPolicy(AdvisorProperties advisorProperties) {
        AdvisorProperties.Retry retry = advisorProperties.getRetry();
        return new RetryPolicy(
                retry.getMaxAttempts(),
                Duration.ofMillis(retry.getBaseDelayMs()),
                Duration.ofMillis(retry.getCapDelayMs()));
    }

    @Bean
    public Retry tradePersistenceRetry(ExecutionProperties executionProperties) {
        ExecutionProperties.PersistenceRetry settings = executionProperties.getPersistenceRetry();
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(settings.getMaxAttempts())
                .waitDuration(Duration.ofMillis(settings.getDelayMs()))
                .retryExceptions(TransientDataAccessException.class, RecoverableDataAccessException.class)
                .build();
        return Retry.of("trade-persistence", config);
    }
}
