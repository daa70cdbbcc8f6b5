package com.tradeadvisor.backend.model;

public enum RecommendationStatus {
    PENDING,
    CONFIRMED,
    REJECTED,
    EXPIRED;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
