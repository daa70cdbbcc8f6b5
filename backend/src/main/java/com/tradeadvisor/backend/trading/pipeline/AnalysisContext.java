package com.tradeadvisor.backend.trading.pipeline;

import com.tradeadvisor.backend.model.UserSettings;

import java.time.Instant;
import java.util.List;

public record AnalysisContext(
        Long userId,
        String ticker,
        PortfolioSnapshot portfolio,
        MarketSnapshot market,
        IndicatorSnapshot indicators,
        UserSettings settings,
        List<NewsItem> news,
        SessionClock session,
        Instant timestamp
) {

    public AnalysisContext {
        news = news == null ? List.of() : List.copyOf(news);
        indicators = indicators == null ? IndicatorSnapshot.empty() : indicators;
        market = market == null ? MarketSnapshot.unavailable() : market;
    }
}
