package com.tradeadvisor.backend.model;

public enum RiskProfile {
    CONSERVATIVE, MODERATE, AGGRESSIVE
}
