package com.tradeadvisor.backend.dto;

import com.tradeadvisor.backend.model.Recommendation;
import com.tradeadvisor.backend.model.RecommendationSource;
import com.tradeadvisor.backend.model.RecommendationStatus;
import com.tradeadvisor.backend.model.RiskLevel;
import com.tradeadvisor.backend.model.TradeAction;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecommendationDTO {
    private Long id;
    private String ticker;
    private TradeAction action;
    private int quantity;
    private BigDecimal price;
    private BigDecimal stopLoss;
    private BigDecimal takeProfit;
    private String reasoning;
    private RiskLevel riskLevel;
    private int confidence;
    private RecommendationStatus status;
    private RecommendationSource source;
    private String timeHorizon;
    private List<String> keyFactors;
    private List<String> riskViolations;
    private Instant createdAt;
    private Instant expiresAt;
    private Instant resolvedAt;

    public static RecommendationDTO from(Recommendation recommendation) {
        return RecommendationDTO.builder()
                .id(recommendation.getId())
                .ticker(recommendation.getTicker())
                .action(recommendation.getAction())
                .quantity(recommendation.getQuantity())
                .price(recommendation.getPrice())
                .stopLoss(recommendation.getStopLoss())
                .takeProfit(recommendation.getTakeProfit())
                .reasoning(recommendation.getReasoning())
                .riskLevel(recommendation.getRiskLevel())
                .confidence(recommendation.getConfidence())
                .status(recommendation.getStatus())
                .source(recommendation.getSource())
                .timeHorizon(recommendation.getTimeHorizon())
                .keyFactors(split(recommendation.getKeyFactors(), ";"))
                .riskViolations(split(recommendation.getRiskViolations(), ","))
                .createdAt(recommendation.getCreatedAt())
                .expiresAt(recommendation.getExpiresAt())
                .resolvedAt(recommendation.getResolvedAt())
                .build();
    }

    private static List<String> split(String joined, String separator) {
        if (joined == null || joined.isBlank()) {
            return List.of();
        }
        return Arrays.stream(joined.split(separator))
                .map(String::trim)
                .filter(part -> !part.isEmpty())
                .toList();
    }
}
