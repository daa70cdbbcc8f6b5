package com.tradeadvisor.backend.trading.pipeline;

import com.tradeadvisor.backend.model.Candle;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

public interface MarketDataProvider {

    /**
     * Last trade price, falling back to the latest daily close when nothing traded today.
     */
    Optional<BigDecimal> currentPrice(String ticker);

    /**
     * Last trade price only; empty when nothing traded today.
     */
    Optional<BigDecimal> lastTradePrice(String ticker);

    List<Candle> dailyCandles(String ticker, int days);
}
