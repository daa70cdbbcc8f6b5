package com.tradeadvisor.backend.service;

import com.tradeadvisor.backend.exception.NotFoundException;
import com.tradeadvisor.backend.exception.RejectionReason;
import com.tradeadvisor.backend.exception.TradeRejectedException;
import com.tradeadvisor.backend.model.Recommendation;
import com.tradeadvisor.backend.model.RecommendationStatus;
import com.tradeadvisor.backend.repository.RecommendationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Non-executing status changes: explicit rejection, expiry on read and the bulk expiry sweep.
 * Every transition is a conditional update, so it cannot overwrite a concurrent confirmation.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RecommendationLifecycleService {

    private final RecommendationRepository recommendationRepository;
    private final RecommendationCache recommendationCache;
    private final AuditEventService auditEventService;
    private final Clock clock;

    @Transactional
    public Recommendation find(Long recommendationId, Long userId) {
        Recommendation recommendation = load(recommendationId, userId);
        Instant now = Instant.now(clock);
        if (recommendation.getStatus() == RecommendationStatus.PENDING && recommendation.isExpired(now)) {
            if (recommendationRepository.expireIfOverdue(recommendationId, RecommendationStatus.PENDING,
                    RecommendationStatus.EXPIRED, now) > 0) {
                log.info("Recommendation {} expired on read", recommendationId);
            }
            recommendation = load(recommendationId, userId);
        }
        return recommendation;
    }

    @Transactional(readOnly = true)
    public List<Recommendation> history(Long userId, int limit) {
        int size = Math.max(1, Math.min(limit, 100));
        return recommendationRepository.findByUserIdOrderByCreatedAtDesc(userId, PageRequest.of(0, size));
    }

    @Transactional(noRollbackFor = TradeRejectedException.class)
    public Recommendation reject(Long recommendationId, Long userId) {
        Recommendation current = find(recommendationId, userId);
        if (current.getStatus() == RecommendationStatus.EXPIRED) {
            throw new TradeRejectedException(RejectionReason.EXPIRED, "Recommendation " + recommendationId + " has expired");
        }
        int updated = recommendationRepository.resolveIfPending(recommendationId, userId,
                RecommendationStatus.PENDING, RecommendationStatus.REJECTED, Instant.now(clock));
        if (updated == 0) {
            Recommendation latest = load(recommendationId, userId);
            if (latest.getStatus() == RecommendationStatus.PENDING || latest.getStatus() == RecommendationStatus.EXPIRED) {
                throw new TradeRejectedException(RejectionReason.EXPIRED, "Recommendation " + recommendationId + " has expired");
            }
            throw new TradeRejectedException(RejectionReason.ALREADY_RESOLVED,
                    "Recommendation " + recommendationId + " is already " + latest.getStatus());
        }
        recommendationCache.invalidate(new RecommendationCache.CacheKey(userId, current.getTicker()));
        auditEventService.recordEvent(userId, AuditEventService.RECOMMENDATION, "REJECTED",
                "Recommendation rejected by user", Map.of("recommendationId", recommendationId));
        log.info("Recommendation {} rejected by user {}", recommendationId, userId);
        return load(recommendationId, userId);
    }

    /**
     * Marks one recommendation expired after a confirmation found it past due.
     */
    @Transactional
    public void expire(Long recommendationId) {
        recommendationRepository.expireIfOverdue(recommendationId, RecommendationStatus.PENDING,
                RecommendationStatus.EXPIRED, Instant.now(clock));
    }

    @Transactional
    public int expireOverdue() {
        return recommendationRepository.expireAllOverdue(RecommendationStatus.PENDING, RecommendationStatus.EXPIRED,
                Instant.now(clock));
    }

    private Recommendation load(Long recommendationId, Long userId) {
        return recommendationRepository.findByIdAndUserId(recommendationId, userId)
                .orElseThrow(() -> new NotFoundException("Recommendation " + recommendationId + " not found"));
    }
}
