package org.nowstart.tradecore.indicator;

import java.util.Collection;
import org.nowstart.tradecore.data.dto.TradingSignal;
import org.nowstart.tradecore.strategy.core.PriceSeries;
import org.springframework.stereotype.Component;

/**
 * Execution confidence in [0, 1] from a generated signal and the recent price context.
 *
 * <p>Weighted factors: signal strength 0.30, indicator agreement 0.25, calm volatility 0.20, distance from the
 * 20-bar SMA 0.15, relative volume 0.10. With too little history the result falls back to half the signal
 * strength; a signal without indicator scores yields 0.
 */
@Component
public class ConfidenceCalculator {

    private static final int LOOKBACK = 20;
    private static final int MIN_SMA_PERIOD = 5;
    private static final double VOLATILITY_CEILING = 0.1;
    private static final double DEFAULT_VOLUME_CONFIDENCE = 0.5;

    private static final double SIGNAL_WEIGHT = 0.3;
    private static final double AGREEMENT_WEIGHT = 0.25;
    private static final double VOLATILITY_WEIGHT = 0.2;
    private static final double TREND_WEIGHT = 0.15;
    private static final double VOLUME_WEIGHT = 0.1;

    public double calculate(TradingSignal signal, PriceSeries series, int index) {
        if (signal == null || series == null || series.size() == 0 || index < 0 || index >= series.size()) {
            return 0.0;
        }
        Collection<Double> scores = signal.indicatorScores().values();
        if (scores.isEmpty()) {
            return 0.0;
        }

        double signalStrength = Math.abs(signal.signal());
        double agreement = agreement(signal.signal(), scores);

        int lookback = Math.min(LOOKBACK, index);
        if (lookback < 2) {
            return signalStrength * 0.5;
        }
        double[] closes = series.closes();
        double volatility = returnStdDev(closes, index - lookback, index);
        if (Double.isNaN(volatility)) {
            return signalStrength * 0.5;
        }
        double volatilityConfidence = 1.0 - Math.min(1.0, volatility / VOLATILITY_CEILING);

        int smaPeriod = Math.min(LOOKBACK, index + 1);
        if (smaPeriod < MIN_SMA_PERIOD) {
            return signalStrength * 0.5;
        }
        double sma = 0.0;
        for (int i = index - smaPeriod + 1; i <= index; i++) {
            sma += closes[i];
        }
        sma /= smaPeriod;
        double trendStrength = sma == 0.0 ? 0.0 : Math.min(1.0, Math.abs((closes[index] - sma) / sma) * 10.0);

        double volumeConfidence = volumeConfidence(series, index);

        double confidence = (signalStrength * SIGNAL_WEIGHT)
                + (agreement * AGREEMENT_WEIGHT)
                + (volatilityConfidence * VOLATILITY_WEIGHT)
                + (trendStrength * TREND_WEIGHT)
                + (volumeConfidence * VOLUME_WEIGHT);
        return TechnicalIndicators.clamp(confidence, 0.0, 1.0);
    }

    private double agreement(double signal, Collection<Double> scores) {
        long agreeing = scores.stream()
                .filter(score -> signal > 0.0 ? score > 0.0 : score < 0.0)
                .count();
        return agreeing / (double) scores.size();
    }

    private double returnStdDev(double[] closes, int from, int to) {
        double sum = 0.0;
        int count = 0;
        double[] returns = new double[to - from];
        for (int i = from + 1; i <= to; i++) {
            if (closes[i - 1] > 0.0) {
                returns[count] = (closes[i] - closes[i - 1]) / closes[i - 1];
                sum += returns[count];
                count++;
            }
        }
        if (count == 0) {
            return Double.NaN;
        }
        double mean = sum / count;
        double variance = 0.0;
        for (int i = 0; i < count; i++) {
            variance += (returns[i] - mean) * (returns[i] - mean);
        }
        return Math.sqrt(variance / count);
    }

    private double volumeConfidence(PriceSeries series, int index) {
        double volume = series.bar(index).volume();
        if (volume <= 0.0) {
            return DEFAULT_VOLUME_CONFIDENCE;
        }
        int start = Math.max(0, index - LOOKBACK);
        double total = 0.0;
        for (int i = start; i <= index; i++) {
            total += series.bar(i).volume();
        }
        double average = total / (index - start + 1);
        if (average <= 0.0) {
            return DEFAULT_VOLUME_CONFIDENCE;
        }
        return Math.min(1.0, (volume / average) / 2.0);
    }
}
