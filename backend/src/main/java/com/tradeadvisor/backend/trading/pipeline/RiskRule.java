package com.tradeadvisor.backend.trading.pipeline;

public enum RiskRule {
    POSITION_SIZE,
    STOP_LOSS,
    TAKE_PROFIT,
    RISK_REWARD,
    SESSION_BLACKOUT,
    INVENTORY,
    DAILY_TRADE_LIMIT,
    DAILY_LOSS_LIMIT
}
