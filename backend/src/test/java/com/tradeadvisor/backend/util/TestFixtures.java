package com.tradeadvisor.backend.util;

import com.tradeadvisor.backend.model.Portfolio;
import com.tradeadvisor.backend.model.Recommendation;
import com.tradeadvisor.backend.model.RecommendationSource;
import com.tradeadvisor.backend.model.RecommendationStatus;
import com.tradeadvisor.backend.model.RiskLevel;
import com.tradeadvisor.backend.model.RiskProfile;
import com.tradeadvisor.backend.model.TradeAction;
import com.tradeadvisor.backend.model.User;
import com.tradeadvisor.backend.model.UserSettings;
import com.tradeadvisor.backend.trading.pipeline.AnalysisContext;
import com.tradeadvisor.backend.trading.pipeline.IndicatorSnapshot;
import com.tradeadvisor.backend.trading.pipeline.MarketSnapshot;
import com.tradeadvisor.backend.trading.pipeline.PortfolioSnapshot;
import com.tradeadvisor.backend.trading.pipeline.PositionSnapshot;
import com.tradeadvisor.backend.trading.pipeline.SessionClock;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.jdbc.JdbcTestUtils;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

public final class TestFixtures {

    private TestFixtures() {}

    public static void clearDatabase(JdbcTemplate jdbcTemplate) {
        JdbcTestUtils.deleteFromTables(jdbcTemplate,
                "transactions", "positions", "recommendations", "portfolios", "user_settings", "audit_events", "users");
    }

    public static User user(Long id) {
        return User.builder()
                .id(id)
                .username("user" + id)
                .createdAt(Instant.now())
                .build();
    }

    public static Portfolio portfolio(Long userId, String capital) {
        return Portfolio.builder()
                .userId(userId)
                .initialCapital(MoneyUtils.bd(capital))
                .cash(MoneyUtils.bd(capital))
                .build();
    }

    public static Recommendation pending(Long userId, TradeAction action, int quantity, String price, Instant now) {
        BigDecimal entry = MoneyUtils.bd(price);
        return Recommendation.builder()
                .userId(userId)
                .ticker("GAZP")
                .action(action)
                .quantity(quantity)
                .price(entry)
                .stopLoss(MoneyUtils.multiply(entry, new BigDecimal("0.94")))
                .takeProfit(MoneyUtils.multiply(entry, new BigDecimal("1.12")))
                .reasoning("fixture")
                .riskLevel(RiskLevel.MEDIUM)
                .confidence(70)
                .status(RecommendationStatus.PENDING)
                .source(RecommendationSource.ADVISOR)
                .createdAt(now)
                .expiresAt(now.plus(Duration.ofMinutes(15)))
                .build();
    }

    public static AnalysisContext analysisContext(Long userId, Double rsi, String price, List<PositionSnapshot> positions) {
        UserSettings settings = UserSettings.builder()
                .userId(userId)
                .riskProfile(RiskProfile.MODERATE)
                .maxPositionSizePct(new BigDecimal("0.30"))
                .stopLossPct(new BigDecimal("0.05"))
                .takeProfitPct(new BigDecimal("0.10"))
                .minRiskRewardRatio(new BigDecimal("2.0"))
                .maxTradesPerDay(10)
                .dailyLossLimitPct(new BigDecimal("0.05"))
                .build();
        PortfolioSnapshot portfolio = new PortfolioSnapshot(userId, MoneyUtils.bd("100000"), MoneyUtils.bd("100000"),
                positions, MoneyUtils.bd("100000"), 0, MoneyUtils.ZERO);
        IndicatorSnapshot indicators = new IndicatorSnapshot(rsi, null, null, null, null, null, null);
        MarketSnapshot market = new MarketSnapshot(price == null ? null : new BigDecimal(price), List.of());
        return new AnalysisContext(userId, "GAZP", portfolio, market, indicators, settings, List.of(),
                new SessionClock(true, 120, 400), Instant.parse("2024-03-05T09:00:00Z"));
    }
}
