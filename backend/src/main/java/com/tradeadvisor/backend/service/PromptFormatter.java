package com.tradeadvisor.backend.service;

import com.tradeadvisor.backend.model.Candle;
import com.tradeadvisor.backend.model.UserSettings;
import com.tradeadvisor.backend.trading.pipeline.AdvisorPrompt;
import com.tradeadvisor.backend.trading.pipeline.AnalysisContext;
import com.tradeadvisor.backend.trading.pipeline.IndicatorSnapshot;
import com.tradeadvisor.backend.trading.pipeline.NewsItem;
import com.tradeadvisor.backend.trading.pipeline.PortfolioSnapshot;
import com.tradeadvisor.backend.trading.pipeline.PositionSnapshot;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Locale;

@Component
public class PromptFormatter {

    static final String SYSTEM_PROMPT = String.join("\n",
            "You are a disciplined equity trading advisor for a simulated single-instrument portfolio.",
            "Answer with exactly one JSON object and nothing else, using these fields:",
            "{\"action\": \"BUY\" | \"SELL\" | \"HOLD\",",
            "\"quantity\": integer number of shares (0 for HOLD),",
            "\"price\": number, the expected execution price,",
            "\"stop_loss\": number or null,",
            "\"take_profit\": number or null,",
            "\"reasoning\": string,",
            "\"risk_level\": \"LOW\" | \"MEDIUM\" | \"HIGH\",",
            "\"confidence\": integer from 0 to 100,",
            "\"time_horizon\": string,",
            "\"key_factors\": array of strings}",
            "A BUY must have stop_loss below price and take_profit above price.",
            "Never suggest selling more shares than the portfolio holds.");

    public AdvisorPrompt format(AnalysisContext context) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("Instrument: ").append(context.ticker()).append('\n');
        prompt.append("Time (UTC): ").append(context.timestamp()).append('\n');
        appendMarket(prompt, context);
        appendIndicators(prompt, context.indicators());
        appendPortfolio(prompt, context.portfolio(), context.ticker());
        appendSettings(prompt, context.settings());
        appendNews(prompt, context);
        prompt.append("\nRecommend one action for ").append(context.ticker()).append(" now.");
        return new AdvisorPrompt(SYSTEM_PROMPT, prompt.toString());
    }

    private void appendMarket(StringBuilder prompt, AnalysisContext context) {
        prompt.append("\nMarket\n");
        prompt.append("- current price: ").append(orUnknown(context.market().currentPrice())).append('\n');
        if (!context.market().recentCandles().isEmpty()) {
            prompt.append("- recent daily closes:");
            for (Candle candle : context.market().recentCandles()) {
                prompt.append(' ').append(decimal(candle.getClose()));
            }
            prompt.append('\n');
        }
        prompt.append("- session: ").append(context.session().open() ? "open" : "closed")
                .append(", ").append(context.session().minutesUntilClose()).append(" min until close\n");
    }

    private void appendIndicators(StringBuilder prompt, IndicatorSnapshot indicators) {
        prompt.append("\nIndicators\n");
        prompt.append("- RSI(14): ").append(orUnknown(indicators.rsi14())).append('\n');
        prompt.append("- MACD: ").append(orUnknown(indicators.macd()))
                .append(", signal: ").append(orUnknown(indicators.macdSignal())).append('\n');
        prompt.append("- SMA20/50/200: ").append(orUnknown(indicators.sma20())).append(" / ")
                .append(orUnknown(indicators.sma50())).append(" / ")
                .append(orUnknown(indicators.sma200())).append('\n');
        prompt.append("- average volume: ").append(orUnknown(indicators.volumeAvg())).append('\n');
    }

    private void appendPortfolio(StringBuilder prompt, PortfolioSnapshot portfolio, String ticker) {
        prompt.append("\nPortfolio\n");
        prompt.append("- cash: ").append(portfolio.cash().toPlainString()).append('\n');
        prompt.append("- total value: ").append(portfolio.totalValue().toPlainString()).append('\n');
        prompt.append("- shares of ").append(ticker).append(" held: ").append(portfolio.sharesOf(ticker)).append('\n');
        for (PositionSnapshot position : portfolio.positions()) {
            prompt.append("- position ").append(position.ticker()).append(": ").append(position.shares())
                    .append(" @ avg ").append(position.avgPurchasePrice().toPlainString()).append('\n');
        }
        prompt.append("- trades today: ").append(portfolio.tradesToday()).append('\n');
    }

    private void appendSettings(StringBuilder prompt, UserSettings settings) {
        prompt.append("\nRisk settings\n");
        prompt.append("- profile: ").append(settings.getRiskProfile()).append('\n');
        prompt.append("- max position size: ").append(percent(settings.getMaxPositionSizePct())).append(" of portfolio\n");
        prompt.append("- stop-loss at least ").append(percent(settings.getStopLossPct())).append(" below price\n");
        prompt.append("- take-profit at least ").append(percent(settings.getTakeProfitPct())).append(" above price\n");
        prompt.append("- minimum risk/reward: ").append(settings.getMinRiskRewardRatio().toPlainString()).append('\n');
    }

    private void appendNews(StringBuilder prompt, AnalysisContext context) {
        if (context.news().isEmpty()) {
            return;
        }
        prompt.append("\nNews (sentiment -1..1)\n");
        for (NewsItem item : context.news()) {
            prompt.append("- [").append(decimal(item.sentiment())).append("] ").append(item.title()).append('\n');
        }
    }

    private static String orUnknown(Object value) {
        if (value == null) {
            return "n/a";
        }
        if (value instanceof Double number) {
            return decimal(number);
        }
        if (value instanceof BigDecimal number) {
            return number.toPlainString();
        }
        return value.toString();
    }

    private static String decimal(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }

    private static String percent(BigDecimal fraction) {
        return fraction.multiply(BigDecimal.valueOf(100)).stripTrailingZeros().toPlainString() + "%";
    }
}
