package com.tradeadvisor.backend.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@Data
@Validated
@ConfigurationProperties(prefix = "session")
public class SessionProperties {

    @NotBlank
    private String timezone = "Europe/Moscow";

    @Pattern(regexp = "\\d{2}:\\d{2}")
    private String open = "10:00";

    @Pattern(regexp = "\\d{2}:\\d{2}")
    private String close = "18:45";
}
