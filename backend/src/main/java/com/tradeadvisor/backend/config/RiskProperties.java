package com.tradeadvisor.backend.config;

import com.tradeadvisor.backend.model.RiskProfile;
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
@ConfigurationProperties(prefix = "risk")
public class RiskProperties {

    @Min(0)
    private int blackoutMinutes = 15;

    @NotNull
    @DecimalMin("0.01")
    private BigDecimal initialCapital = new BigDecimal("100000");

    @Valid
    private Defaults defaults = new Defaults();

    /**
     * Values applied to a user's settings row when it is first created.
     */
    @Data
    public static class Defaults {
        @NotNull
        private RiskProfile riskProfile = RiskProfile.MODERATE;
        @NotNull
        private BigDecimal maxPositionSizePct = new BigDecimal("0.30");
        @NotNull
        private BigDecimal stopLossPct = new BigDecimal("0.05");
        @NotNull
        private BigDecimal takeProfitPct = new BigDecimal("0.10");
        @NotNull
        private BigDecimal minRiskRewardRatio = new BigDecimal("2.0");
        @Min(1)
        private int maxTradesPerDay = 10;
        @NotNull
        private BigDecimal dailyLossLimitPct = new BigDecimal("0.05");
        private boolean autoConfirm = false;
    }
}
