package com.tradeadvisor.backend.trading.pipeline;

import java.math.BigDecimal;
import java.util.List;

/**
 * Read-only view of a user's portfolio at one instant, valued at the supplied market prices.
 */
public record PortfolioSnapshot(
        Long userId,
        BigDecimal cash,
        BigDecimal initialCapital,
        List<PositionSnapshot> positions,
        BigDecimal totalValue,
        int tradesToday,
        BigDecimal realizedPnlToday
) {

    public PortfolioSnapshot {
        positions = positions == null ? List.of() : List.copyOf(positions);
    }

    public int sharesOf(String ticker) {
        return positions.stream()
                .filter(position -> position.ticker().equalsIgnoreCase(ticker))
                .mapToInt(PositionSnapshot::shares)
                .sum();
    }
}
