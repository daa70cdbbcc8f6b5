package com.tradeadvisor.backend.model;

public enum TradeAction {
    BUY, SELL, HOLD
}
