package com.tradeadvisor.backend.dto;

import com.tradeadvisor.backend.model.RiskLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RiskMetricsDTO {
    private BigDecimal totalValue;
    private BigDecimal positionsValue;
    private BigDecimal concentrationPct;
    private BigDecimal liquidityPct;
    private BigDecimal potentialLossOnDrop;
    private RiskLevel riskLevel;
}
