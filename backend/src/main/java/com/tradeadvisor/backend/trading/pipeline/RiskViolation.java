package com.tradeadvisor.backend.trading.pipeline;

public record RiskViolation(RiskRule rule, String message) {}
