package com.tradeadvisor.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PortfolioSummaryDTO {
    private Long userId;
    private BigDecimal cash;
    private BigDecimal initialCapital;
    private BigDecimal sharesValue;
    private BigDecimal totalValue;
    private BigDecimal pnl;
    private BigDecimal pnlPct;
    private BigDecimal unrealizedPnl;
    private List<PositionDTO> positions;
}
