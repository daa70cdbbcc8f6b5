package com.tradeadvisor.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PerformanceMetricsDTO {
    private int periodDays;
    private int totalTrades;
    private int buyTrades;
    private int sellTrades;
    private BigDecimal totalVolume;
    private BigDecimal avgTradeSize;
    private BigDecimal realizedPnl;
    private BigDecimal currentValue;
    private BigDecimal pnl;
    private BigDecimal pnlPct;
}
