package com.tradeadvisor.backend.service.indicator;

import com.tradeadvisor.backend.model.Candle;
import com.tradeadvisor.backend.trading.pipeline.IndicatorSnapshot;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * RSI (Wilder smoothing), MACD and simple moving averages over daily closes, oldest candle first.
 */
@Service
public class IndicatorEngine {

    public static final int RSI_PERIOD = 14;
    public static final int MACD_FAST = 12;
    public static final int MACD_SLOW = 26;
    public static final int MACD_SIGNAL = 9;
    public static final int VOLUME_WINDOW = 20;

    public IndicatorSnapshot calculate(List<Candle> candles) {
        if (candles == null || candles.isEmpty()) {
            return IndicatorSnapshot.empty();
        }
        List<Double> closes = candles.stream().map(Candle::getClose).toList();
        MacdResult macd = macd(closes);
        return new IndicatorSnapshot(
                rsi(closes, RSI_PERIOD),
                macd == null ? null : macd.macdLine(),
                macd == null ? null : macd.signalLine(),
                sma(closes, 20),
                sma(closes, 50),
                sma(closes, 200),
                averageVolume(candles, VOLUME_WINDOW));
    }

    public Double rsi(List<Double> closes, int period) {
        if (closes.size() < period + 1) {
            return null;
        }
        double avgGain = 0.0;
        double avgLoss = 0.0;
        for (int i = 1; i <= period; i++) {
            double change = closes.get(i) - closes.get(i - 1);
            if (change > 0) {
                avgGain += change;
            } else {
                avgLoss += Math.abs(change);
            }
        }
        avgGain /= period;
        avgLoss /= period;

        for (int i = period + 1; i < closes.size(); i++) {
            double change = closes.get(i) - closes.get(i - 1);
            double gain = Math.max(change, 0.0);
            double loss = Math.max(-change, 0.0);
            avgGain = ((avgGain * (period - 1)) + gain) / period;
            avgLoss = ((avgLoss * (period - 1)) + loss) / period;
        }

        if (avgLoss == 0) {
            return avgGain == 0 ? 50.0 : 100.0;
        }
        double rs = avgGain / avgLoss;
        return 100.0 - (100.0 / (1.0 + rs));
    }

    public MacdResult macd(List<Double> closes) {
        List<Double> fastSeries = emaSeries(closes, MACD_FAST);
        List<Double> slowSeries = emaSeries(closes, MACD_SLOW);

        List<Double> macdSeries = new ArrayList<>();
        for (int i = 0; i < closes.size(); i++) {
            Double fastVal = fastSeries.get(i);
            Double slowVal = slowSeries.get(i);
            if (fastVal != null && slowVal != null) {
                macdSeries.add(fastVal - slowVal);
            }
        }
        if (macdSeries.size() < MACD_SIGNAL) {
            return null;
        }
        List<Double> signalSeries = emaSeries(macdSeries, MACD_SIGNAL);
        double macdLine = macdSeries.get(macdSeries.size() - 1);
        double signalLine = signalSeries.get(signalSeries.size() - 1);
        return new MacdResult(macdLine, signalLine, macdLine - signalLine);
    }

    public Double sma(List<Double> values, int period) {
        if (values.size() < period) {
            return null;
        }
        return values.subList(values.size() - period, values.size()).stream()
                .mapToDouble(Double::doubleValue)
                .average()
                .orElse(0.0);
    }

    private Double averageVolume(List<Candle> candles, int window) {
        int from = Math.max(0, candles.size() - window);
        return candles.subList(from, candles.size()).stream()
                .mapToLong(Candle::getVolume)
                .average()
                .orElse(0.0);
    }

    private List<Double> emaSeries(List<Double> values, int period) {
        List<Double> series = new ArrayList<>();
        for (int i = 0; i < values.size(); i++) {
            series.add(null);
        }
        if (values.size() < period) {
            return series;
        }
        double sma = values.subList(0, period).stream().mapToDouble(d -> d).average().orElse(0.0);
        series.set(period - 1, sma);
        double k = 2.0 / (period + 1);
        double ema = sma;
        for (int i = period; i < values.size(); i++) {
            ema = (values.get(i) * k) + (ema * (1 - k));
            series.set(i, ema);
        }
        return series;
    }

    public record MacdResult(double macdLine, double signalLine, double histogram) {}
}
