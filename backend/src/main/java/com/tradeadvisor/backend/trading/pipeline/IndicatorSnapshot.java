package com.tradeadvisor.backend.trading.pipeline;

/**
 * Technical indicators over daily candles. A field is null when there was not enough history to compute it.
 */
public record IndicatorSnapshot(
        Double rsi14,
        Double macd,
        Double macdSignal,
        Double sma20,
        Double sma50,
        Double sma200,
        Double volumeAvg
) {

    public static IndicatorSnapshot empty() {
        return new IndicatorSnapshot(null, null, null, null, null, null, null);
    }
}
