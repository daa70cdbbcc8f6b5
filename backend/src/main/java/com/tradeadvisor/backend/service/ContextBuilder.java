package com.tradeadvisor.backend.service;

import com.tradeadvisor.backend.config.MarketDataProperties;
import com.tradeadvisor.backend.model.Candle;
import com.tradeadvisor.backend.model.UserSettings;
import com.tradeadvisor.backend.service.indicator.IndicatorEngine;
import com.tradeadvisor.backend.trading.pipeline.AnalysisContext;
import com.tradeadvisor.backend.trading.pipeline.IndicatorSnapshot;
import com.tradeadvisor.backend.trading.pipeline.MarketDataProvider;
import com.tradeadvisor.backend.trading.pipeline.MarketSnapshot;
import com.tradeadvisor.backend.trading.pipeline.NewsFeed;
import com.tradeadvisor.backend.trading.pipeline.NewsItem;
import com.tradeadvisor.backend.trading.pipeline.PortfolioSnapshot;
import com.tradeadvisor.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Gathers everything the advisor and the heuristic look at. Collaborator failures degrade to
 * missing fields; only a missing account fails the build.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ContextBuilder {

    static final int RECENT_CANDLES = 10;
    static final int NEWS_LIMIT = 5;

    private final MarketDataProvider marketDataProvider;
    private final IndicatorEngine indicatorEngine;
    private final MarketDataProperties marketDataProperties;
    private final NewsFeed newsFeed;
    private final PortfolioLedger portfolioLedger;
    private final UserSettingsService userSettingsService;
    private final TradingSessionService tradingSessionService;
    private final Clock clock;

    public AnalysisContext build(Long userId, String ticker) {
        Instant now = Instant.now(clock);
        UserSettings settings = userSettingsService.getOrCreate(userId);
        // one candle fetch feeds the recent window, the indicators and the close fallback
        List<Candle> candles = loadCandles(ticker);
        MarketSnapshot market = new MarketSnapshot(loadPrice(ticker, candles),
                candles.subList(Math.max(0, candles.size() - RECENT_CANDLES), candles.size()));
        IndicatorSnapshot indicators = indicatorEngine.calculate(candles);
        Map<String, BigDecimal> prices = market.hasPrice() ? Map.of(ticker, market.currentPrice()) : Map.of();
        PortfolioSnapshot portfolio = portfolioLedger.snapshot(userId, prices, tradingSessionService.startOfTradingDay(now));
        return new AnalysisContext(
                userId,
                ticker,
                portfolio,
                market,
                indicators,
                settings,
                loadNews(ticker),
                tradingSessionService.clockAt(now),
                now);
    }

    private List<Candle> loadCandles(String ticker) {
        try {
            return marketDataProvider.dailyCandles(ticker, marketDataProperties.getLookbackDays());
        } catch (RuntimeException e) {
            log.warn("Daily candles unavailable for {}: {}", ticker, e.getMessage());
            return List.of();
        }
    }

    private BigDecimal loadPrice(String ticker, List<Candle> candles) {
        try {
            Optional<BigDecimal> last = marketDataProvider.lastTradePrice(ticker);
            if (last.isPresent()) {
                return last.get();
            }
        } catch (RuntimeException e) {
            log.warn("Current price unavailable for {}: {}", ticker, e.getMessage());
        }
        return candles.isEmpty() ? null : MoneyUtils.bd(candles.get(candles.size() - 1).getClose());
    }

    private List<NewsItem> loadNews(String ticker) {
        try {
            return newsFeed.recentNews(ticker, NEWS_LIMIT);
        } catch (RuntimeException e) {
            log.warn("News unavailable for {}: {}", ticker, e.getMessage());
            return List.of();
        }
    }
}
