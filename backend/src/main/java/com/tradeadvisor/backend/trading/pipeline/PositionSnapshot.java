package com.tradeadvisor.backend.trading.pipeline;

import com.tradeadvisor.backend.util.MoneyUtils;

import java.math.BigDecimal;

/**
 * A held position. {@code costBasis} is the exact amount paid for the shares still held;
 * {@code avgPurchasePrice} is its rounded per-share view.
 */
public record PositionSnapshot(String ticker, int shares, BigDecimal avgPurchasePrice, BigDecimal costBasis) {

    public PositionSnapshot(String ticker, int shares, BigDecimal avgPurchasePrice) {
        this(ticker, shares, avgPurchasePrice, MoneyUtils.multiply(avgPurchasePrice, shares));
    }
}
