package com.tradeadvisor.backend.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;

@Configuration
@Data
@Validated
@ConfigurationProperties(prefix = "execution")
public class ExecutionProperties {

    @NotNull
    @DecimalMin("0.0")
    private BigDecimal commissionRate = new BigDecimal("0.0005");

    @NotNull
    @DecimalMin("0.0")
    private BigDecimal slippageBps = new BigDecimal("5");

    @Valid
    private PersistenceRetry persistenceRetry = new PersistenceRetry();

    @Data
    public static class PersistenceRetry {
        @Min(1)
        private int maxAttempts = 3;
        @Min(0)
        private long delayMs = 200;
    }
}
