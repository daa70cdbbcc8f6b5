package com.tradeadvisor.backend.trading.pipeline;

import com.tradeadvisor.backend.model.RecommendationSource;
import com.tradeadvisor.backend.model.RiskLevel;
import com.tradeadvisor.backend.model.TradeAction;
import com.tradeadvisor.backend.util.MoneyUtils;
import lombok.Builder;

import java.math.BigDecimal;
import java.util.List;

/**
 * A trade suggestion before it is persisted: the output of the advisor, the heuristic or the default.
 */
@Builder(toBuilder = true)
public record TradeProposal(
        String ticker,
        TradeAction action,
        int quantity,
        BigDecimal price,
        BigDecimal stopLoss,
        BigDecimal takeProfit,
        String reasoning,
        RiskLevel riskLevel,
        int confidence,
        String timeHorizon,
        List<String> keyFactors,
        RecommendationSource source
) {

    public static final String ADVISOR_UNAVAILABLE = "advisor unavailable";

    public TradeProposal {
        keyFactors = keyFactors == null ? List.of() : List.copyOf(keyFactors);
    }

    public boolean isHold() {
        return action == TradeAction.HOLD;
    }

    public BigDecimal notional() {
        return MoneyUtils.multiply(price, quantity);
    }

    public static TradeProposal conservativeDefault(String ticker, BigDecimal price) {
        return TradeProposal.builder()
                .ticker(ticker)
                .action(TradeAction.HOLD)
                .quantity(0)
                .price(price)
                .reasoning(ADVISOR_UNAVAILABLE)
                .riskLevel(RiskLevel.LOW)
                .confidence(50)
                .source(RecommendationSource.DEFAULT)
                .build();
    }
}
