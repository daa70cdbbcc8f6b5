package com.tradeadvisor.backend.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@Data
@Validated
@ConfigurationProperties(prefix = "market-data")
public class MarketDataProperties {

    @NotBlank
    private String baseUrl = "https://iss.moex.com/iss";

    @NotBlank
    private String board = "TQBR";

    @Min(30)
    private int lookbackDays = 300;

    @Min(1)
    private int connectTimeoutMs = 5_000;

    @Min(1)
    private int readTimeoutMs = 10_000;
}
