package org.nowstart.tradecore.regime;

import org.nowstart.tradecore.data.dto.RegimeIndicators;
import org.nowstart.tradecore.data.dto.RegimeSignal;
import org.nowstart.tradecore.data.type.MarketRegime;
import org.nowstart.tradecore.indicator.TechnicalIndicators;
import org.springframework.stereotype.Component;

/**
 * Classifies one bar as bullish, bearish or neutral from trend, momentum and volatility sub-scores.
 *
 * <p>Trend blends price against SMA20/50/200, the SMA50/SMA200 cross, SMA20 against SMA50, EMA12 against
 * EMA26 and a moving-average alignment bonus. Momentum blends the MACD histogram, MACD against its signal line,
 * the MACD sign, an RSI zone score and 20/50-bar rates of change. Volatility is the mean absolute 20-bar return
 * scaled into [0, 1].
 */
@Component
public class MarketRegimeDetector {

    public static final int MIN_INDEX = 50;

    private static final double BULLISH_THRESHOLD = 0.05;
    private static final double BEARISH_THRESHOLD = -0.05;
    private static final double MIN_STRENGTH = 0.1;
    private static final double SIGNIFICANT_CROSS = 0.02;
    private static final int VOLATILITY_LOOKBACK = 20;
    private static final int HISTOGRAM_RANGE_WINDOW = 50;

    public RegimeSignal detect(RegimeIndicatorSet set, int index) {
        if (index < MIN_INDEX || set.barCount() < MIN_INDEX) {
            return RegimeSignal.NEUTRAL;
        }
        if (index >= set.barCount()) {
            throw new IllegalArgumentException("index must be in [0, barCount-1]");
        }

        double[] closes = set.closes();
        double price = closes[index];
        double sma20 = set.sma20()[index];
        double sma50 = set.sma50()[index];
        double sma200 = set.sma200()[index];

        Accumulator trend = new Accumulator();
        if (Double.isFinite(sma20)) {
            trend.add(clampUnit(relative(price, sma20) * 10.0), 1.0);
        }
        if (Double.isFinite(sma50)) {
            trend.add(clampUnit(relative(price, sma50) * 10.0), 1.0);
        }
        if (Double.isFinite(sma200)) {
            trend.add(clampUnit(relative(price, sma200) * 8.0), 1.5);
        }
        if (Double.isFinite(sma50) && Double.isFinite(sma200)) {
            trend.add(clampUnit(relative(sma50, sma200) * 30.0), 2.0);
        }
        if (Double.isFinite(sma20) && Double.isFinite(sma50)) {
            trend.add(clampUnit(relative(sma20, sma50) * 20.0), 1.0);
        }
        double ema12 = set.ema12()[index];
        double ema26 = set.ema26()[index];
        if (Double.isFinite(ema12) && Double.isFinite(ema26)) {
            trend.add(clampUnit(relative(ema12, ema26) * 20.0), 1.0);
        }
        if (Double.isFinite(sma20) && Double.isFinite(sma50) && Double.isFinite(sma200)) {
            if (price > sma20 && sma20 > sma50 && sma50 > sma200) {
                trend.add(0.5, 1.0);
            } else if (price < sma20 && sma20 < sma50 && sma50 < sma200) {
                trend.add(-0.5, 1.0);
            }
        }

        Accumulator momentum = new Accumulator();
        double histogram = set.macd().histogram()[index];
        if (Double.isFinite(histogram)) {
            double priceRange = TechnicalIndicators.range(closes, index, HISTOGRAM_RANGE_WINDOW);
            double scale = priceRange > 0.0 ? priceRange / 100.0 : 1.0;
            momentum.add(clampUnit(histogram / scale), 1.5);
        }
        double macdValue = set.macd().macd()[index];
        double signalValue = set.macd().signal()[index];
        if (Double.isFinite(macdValue) && Double.isFinite(signalValue)) {
            double direction = macdValue > signalValue ? 1.0 : -1.0;
            double denominator = signalValue == 0.0 ? 1.0 : Math.abs(signalValue);
            double strength = Math.min(1.0, (Math.abs(macdValue - signalValue) / denominator) * 10.0);
            momentum.add(direction * strength, 1.0);
            momentum.add(macdValue > 0.0 ? 0.3 : -0.3, 1.0);
        }
        double rsi = set.rsi()[index];
        if (Double.isFinite(rsi)) {
            momentum.add(rsiMomentum(rsi), 1.0);
        }
        if (index >= 20 && closes[index - 20] != 0.0) {
            momentum.add(clampUnit(relative(price, closes[index - 20]) * 5.0), 1.0);
        }
        if (index >= 50 && closes[index - 50] != 0.0) {
            momentum.add(clampUnit(relative(price, closes[index - 50]) * 3.0), 1.2);
        }

        double trendScore = clampUnit(trend.average());
        double momentumScore = clampUnit(momentum.average());
        double volatility = volatility(closes, index);

        double combined = (trendScore * 0.5) + (momentumScore * 0.5);
        double strength = (trend.averageStrength() + momentum.averageStrength()) / 2.0;

        MarketRegime regime;
        double confidence;
        if (combined > BULLISH_THRESHOLD && strength > MIN_STRENGTH) {
            regime = MarketRegime.BULLISH;
            confidence = Math.min(1.0, (Math.abs(combined) * 0.7) + (strength * 0.3));
        } else if (combined < BEARISH_THRESHOLD && strength > MIN_STRENGTH) {
            regime = MarketRegime.BEARISH;
            confidence = Math.min(1.0, (Math.abs(combined) * 0.7) + (strength * 0.3));
        } else {
            regime = MarketRegime.NEUTRAL;
            confidence = Math.max(0.0, 1.0 - Math.abs(combined) - strength);
        }

        if ((trendScore > 0.0 && momentumScore > 0.0) || (trendScore < 0.0 && momentumScore < 0.0)) {
            double agreement = Math.min(Math.abs(trendScore), Math.abs(momentumScore));
            confidence = Math.min(1.0, confidence * (1.0 + (agreement * 0.5)));
        }
        if (Double.isFinite(sma50) && Double.isFinite(sma200) && Math.abs(relative(sma50, sma200)) > SIGNIFICANT_CROSS) {
            confidence = Math.min(1.0, confidence * 1.3);
        }

        return new RegimeSignal(regime, confidence, new RegimeIndicators(trendScore, momentumScore, volatility));
    }

    static double rsiMomentum(double rsi) {
        if (rsi > 70.0) {
            return -((rsi - 70.0) / 30.0);
        }
        if (rsi < 30.0) {
            return (30.0 - rsi) / 30.0;
        }
        if (rsi > 50.0) {
            return (rsi - 50.0) / 20.0;
        }
        return -((50.0 - rsi) / 20.0);
    }

    private double volatility(double[] closes, int index) {
        int lookback = Math.min(VOLATILITY_LOOKBACK, index);
        double sum = 0.0;
        int count = 0;
        for (int i = index - lookback + 1; i <= index; i++) {
            if (closes[i - 1] > 0.0) {
                sum += Math.abs((closes[i] - closes[i - 1]) / closes[i - 1]);
                count++;
            }
        }
        double average = count > 0 ? sum / count : 0.0;
        return Math.min(1.0, average * 20.0);
    }

    private static double relative(double value, double base) {
        return (value - base) / base;
    }

    private static double clampUnit(double value) {
        return TechnicalIndicators.clamp(value, -1.0, 1.0);
    }

    private static final class Accumulator {

        private double score;
        private double strength;
        private int count;

        private void add(double signal, double weight) {
            score += signal * weight;
            strength += Math.abs(signal) * weight;
            count++;
        }

        private double average() {
            return count > 0 ? score / count : 0.0;
        }

        private double averageStrength() {
            return count > 0 ? strength / count : 0.0;
        }
    }
}
