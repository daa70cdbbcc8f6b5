package com.tradeadvisor.backend.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A recommendation surfaced to the user. Status moves out of PENDING exactly once;
 * the transitions are conditional updates in {@code RecommendationRepository}.
 */
@Entity
@Table(name = "recommendations")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Recommendation {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(nullable = false, length = 32)
    private String ticker;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 8)
    private TradeAction action;

    @Column(nullable = false)
    private Integer quantity;

    @Column(precision = 19, scale = 4)
    private BigDecimal price;

    @Column(name = "stop_loss", precision = 19, scale = 4)
    private BigDecimal stopLoss;

    @Column(name = "take_profit", precision = 19, scale = 4)
    private BigDecimal takeProfit;

    @Column(length = 4000)
    private String reasoning;

    @Enumerated(EnumType.STRING)
    @Column(name = "risk_level", nullable = false, length = 8)
    private RiskLevel riskLevel;

    @Column(nullable = false)
    private Integer confidence;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private RecommendationStatus status;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private RecommendationSource source;

    @Column(name = "time_horizon", length = 64)
    private String timeHorizon;

    @Column(name = "key_factors", length = 2000)
    private String keyFactors;

    @Column(name = "risk_violations", length = 512)
    private String riskViolations;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    @Column(name = "resolved_at")
    private Instant resolvedAt;

    public boolean isExpired(Instant now) {
        return now.isAfter(expiresAt);
    }
}
