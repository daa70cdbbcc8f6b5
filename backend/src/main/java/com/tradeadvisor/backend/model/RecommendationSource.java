package com.tradeadvisor.backend.model;

public enum RecommendationSource {
    ADVISOR, HEURISTIC, DEFAULT
}
