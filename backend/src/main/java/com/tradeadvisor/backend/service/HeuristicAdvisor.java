package com.tradeadvisor.backend.service;

import com.tradeadvisor.backend.config.AdvisorProperties;
import com.tradeadvisor.backend.model.RecommendationSource;
import com.tradeadvisor.backend.model.RiskLevel;
import com.tradeadvisor.backend.model.TradeAction;
import com.tradeadvisor.backend.model.UserSettings;
import com.tradeadvisor.backend.trading.pipeline.AnalysisContext;
import com.tradeadvisor.backend.trading.pipeline.PortfolioSnapshot;
import com.tradeadvisor.backend.trading.pipeline.TradeProposal;
import com.tradeadvisor.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * RSI rule used when the advisor cannot answer: oversold buys, overbought sells the holding,
 * anything else holds. Empty when price or RSI is unknown.
 */
@Component
@RequiredArgsConstructor
public class HeuristicAdvisor {

    private final AdvisorProperties advisorProperties;

    public Optional<TradeProposal> propose(AnalysisContext context) {
        BigDecimal price = context.market().currentPrice();
        Double rsi = context.indicators().rsi14();
        if (price == null || price.signum() <= 0 || rsi == null || rsi.isNaN()) {
            return Optional.empty();
        }
        AdvisorProperties.Heuristic rules = advisorProperties.getHeuristic();
        String rsiText = String.format(Locale.ROOT, "%.1f", rsi);

        if (rsi < rules.getOversoldRsi()) {
            return Optional.of(buy(context, price, "RSI " + rsiText + " below " + format(rules.getOversoldRsi()) + ": oversold"));
        }
        if (rsi > rules.getOverboughtRsi()) {
            int held = context.portfolio().sharesOf(context.ticker());
            String reason = "RSI " + rsiText + " above " + format(rules.getOverboughtRsi()) + ": overbought";
            if (held <= 0) {
                return Optional.of(hold(context, price, reason + ", but no shares are held"));
            }
            return Optional.of(base(context, price)
                    .action(TradeAction.SELL)
                    .quantity(held)
                    .reasoning(reason)
                    .build());
        }
        return Optional.of(hold(context, price, "RSI " + rsiText + " in neutral range"));
    }

    private TradeProposal buy(AnalysisContext context, BigDecimal price, String reason) {
        UserSettings settings = context.settings();
        PortfolioSnapshot portfolio = context.portfolio();
        BigDecimal budget = settings.getMaxPositionSizePct().multiply(portfolio.totalValue()).min(portfolio.cash());
        int quantity = budget.divide(price, 0, RoundingMode.FLOOR).intValue();
        if (quantity <= 0) {
            return hold(context, price, reason + ", but available cash buys no shares");
        }
        BigDecimal stopPct = settings.getStopLossPct();
        BigDecimal takePct = settings.getTakeProfitPct().max(settings.getMinRiskRewardRatio().multiply(stopPct));
        // round the stop down and the target up so both stay outside the configured minimum distances
        BigDecimal stopLoss = price.multiply(BigDecimal.ONE.subtract(stopPct)).setScale(MoneyUtils.SCALE, RoundingMode.FLOOR);
        BigDecimal takeProfit = price.multiply(BigDecimal.ONE.add(takePct)).setScale(MoneyUtils.SCALE, RoundingMode.CEILING);
        return base(context, price)
                .action(TradeAction.BUY)
                .quantity(quantity)
                .stopLoss(stopLoss)
                .takeProfit(takeProfit)
                .reasoning(reason)
                .build();
    }

    private TradeProposal hold(AnalysisContext context, BigDecimal price, String reason) {
        return base(context, price)
                .action(TradeAction.HOLD)
                .quantity(0)
                .reasoning(reason)
                .build();
    }

    private TradeProposal.TradeProposalBuilder base(AnalysisContext context, BigDecimal price) {
        return TradeProposal.builder()
                .ticker(context.ticker())
                .price(MoneyUtils.scale(price))
                .riskLevel(RiskLevel.MEDIUM)
                .confidence(advisorProperties.getHeuristic().getConfidence())
                .timeHorizon("short-term")
                .keyFactors(List.of("RSI(14)"))
                .source(RecommendationSource.HEURISTIC);
    }

    private static String format(double threshold) {
        return String.format(Locale.ROOT, "%.0f", threshold);
    }
}
