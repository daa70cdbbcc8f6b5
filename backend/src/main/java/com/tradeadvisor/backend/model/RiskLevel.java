package com.tradeadvisor.backend.model;

public enum RiskLevel {
    LOW, MEDIUM, HIGH
}
