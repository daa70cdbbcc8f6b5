package com.tradeadvisor.backend.dto;

import com.tradeadvisor.backend.model.RiskProfile;
import com.tradeadvisor.backend.model.UserSettings;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Settings as exchanged over the API. On update, null fields are left unchanged.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SettingsDTO {

    private RiskProfile riskProfile;

    @DecimalMin(value = "0.0", inclusive = false)
    @DecimalMax("1.0")
    private BigDecimal maxPositionSizePct;

    @DecimalMin(value = "0.0", inclusive = false)
    @DecimalMax("1.0")
    private BigDecimal stopLossPct;

    @DecimalMin(value = "0.0", inclusive = false)
    @DecimalMax("1.0")
    private BigDecimal takeProfitPct;

    @DecimalMin(value = "0.0", inclusive = false)
    private BigDecimal minRiskRewardRatio;

    @Min(1)
    private Integer maxTradesPerDay;

    @DecimalMin(value = "0.0", inclusive = false)
    @DecimalMax("1.0")
    private BigDecimal dailyLossLimitPct;

    private Boolean autoConfirm;

    public static SettingsDTO from(UserSettings settings) {
        return SettingsDTO.builder()
                .riskProfile(settings.getRiskProfile())
                .maxPositionSizePct(settings.getMaxPositionSizePct())
                .stopLossPct(settings.getStopLossPct())
                .takeProfitPct(settings.getTakeProfitPct())
                .minRiskRewardRatio(settings.getMinRiskRewardRatio())
                .maxTradesPerDay(settings.getMaxTradesPerDay())
                .dailyLossLimitPct(settings.getDailyLossLimitPct())
                .autoConfirm(settings.isAutoConfirm())
                .build();
    }
}
