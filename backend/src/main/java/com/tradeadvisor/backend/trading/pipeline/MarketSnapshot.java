package com.tradeadvisor.backend.trading.pipeline;

import com.tradeadvisor.backend.model.Candle;

import java.math.BigDecimal;
import java.util.List;

public record MarketSnapshot(BigDecimal currentPrice, List<Candle> recentCandles) {

    public MarketSnapshot {
        recentCandles = recentCandles == null ? List.of() : List.copyOf(recentCandles);
    }

    public static MarketSnapshot unavailable() {
        return new MarketSnapshot(null, List.of());
    }

    public boolean hasPrice() {
        return currentPrice != null && currentPrice.signum() > 0;
    }
}
