package com.tradeadvisor.backend.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class RecommendationExpirySweeper {

    private final RecommendationLifecycleService lifecycleService;
    private final RecommendationCache recommendationCache;

    @Scheduled(fixedDelayString = "${advisor.recommendation.sweep-interval-ms:60000}")
    public void sweep() {
        MDC.put("correlationId", "sweep-" + UUID.randomUUID());
        try {
            int expired = lifecycleService.expireOverdue();
            int evicted = recommendationCache.evictExpired();
            if (expired > 0 || evicted > 0) {
                log.info("Expiry sweep: {} recommendations expired, {} cache entries evicted", expired, evicted);
            }
        } finally {
            MDC.remove("correlationId");
        }
    }
}
