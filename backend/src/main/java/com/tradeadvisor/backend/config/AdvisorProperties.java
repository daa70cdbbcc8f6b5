package com.tradeadvisor.backend.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Settings for the recommendation pipeline: the AI advisor endpoint, its retry budget,
 * the overall deadline and the cache/lifecycle timings.
 */
@Configuration
@Data
@Validated
@ConfigurationProperties(prefix = "advisor")
public class AdvisorProperties {

    @NotBlank
    private String defaultTicker = "GAZP";

    @Min(1)
    private long deadlineMs = 30_000;

    @Valid
    private Api api = new Api();

    @Valid
    private Retry retry = new Retry();

    @Valid
    private Circuit circuit = new Circuit();

    @Valid
    private Cache cache = new Cache();

    @Valid
    private Recommendation recommendation = new Recommendation();

    @Valid
    private Heuristic heuristic = new Heuristic();

    public Duration getDeadline() {
        return Duration.ofMillis(deadlineMs);
    }

    @Data
    public static class Api {
        @NotBlank
        private String baseUrl = "https://api.openai.com/v1";
        private String apiKey;
        @NotBlank
        private String model = "gpt-4o-mini";
        private double temperature = 0.2;
        @Min(1)
        private int maxTokens = 800;
        @Min(1)
        private int connectTimeoutMs = 5_000;
        @Min(1)
        private int readTimeoutMs = 20_000;
    }

    @Data
    public static class Retry {
        @Min(1)
        private int maxAttempts = 3;
        @Min(0)
        private long baseDelayMs = 2_000;
        @Min(0)
        private long capDelayMs = 8_000;
    }

    @Data
    public static class Circuit {
        private float failureRateThreshold = 50;
        @Min(1)
        private long waitOpenSeconds = 60;
        @Min(1)
        private int slidingWindowSize = 10;
    }

    @Data
    public static class Cache {
        @Min(1)
        private long ttlMinutes = 15;

        public Duration getTtl() {
            return Duration.ofMinutes(ttlMinutes);
        }
    }

    @Data
    public static class Recommendation {
        @Min(1)
        private long ttlMinutes = 15;
        @Min(1)
        private long sweepIntervalMs = 60_000;
        @Min(1)
        private int historyLimit = 20;

        public Duration getTtl() {
            return Duration.ofMinutes(ttlMinutes);
        }
    }

    @Data
    public static class Heuristic {
        private double oversoldRsi = 30;
        private double overboughtRsi = 70;
        private int confidence = 60;
    }
}
