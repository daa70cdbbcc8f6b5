package com.tradeadvisor.backend.service;

import com.tradeadvisor.backend.model.TradeAction;

import java.math.BigDecimal;

public record TradeInstruction(
        Long userId,
        TradeAction action,
        String ticker,
        int shares,
        BigDecimal price,
        BigDecimal commission,
        BigDecimal slippage,
        Long recommendationId
) {}
