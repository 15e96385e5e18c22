package org.nowstart.tradecore.risk;

import org.nowstart.tradecore.indicator.TechnicalIndicators;
import org.nowstart.tradecore.strategy.config.VolatilitySizingConfig;
import org.nowstart.tradecore.strategy.core.PriceSeries;
import org.springframework.stereotype.Component;

/**
 * Shrinks position size when the current ATR% runs well above its recent average.
 */
@Component
public class VolatilityPositionSizer {

    private static final int AVERAGE_LOOKBACK = 30;

    /**
     * Multiplier in {@code [1 - maxPositionReduction, 1]}. 1.0 when disabled or when ATR history is too short.
     */
    public double multiplier(PriceSeries series, int index, VolatilitySizingConfig config) {
        if (config == null || !config.enabled() || series == null || index < config.atrPeriod() || index >= series.size()) {
            return 1.0;
        }
        double[] closes = series.closes();
        double[] atr = TechnicalIndicators.averageTrueRange(
                series.highs(),
                series.lows(),
                closes,
                config.atrPeriod(),
                config.useEma()
        );
        double currentAtrPct = atrPercent(atr, closes, index);
        if (!Double.isFinite(currentAtrPct)) {
            return 1.0;
        }

        int lookback = Math.min(AVERAGE_LOOKBACK, index);
        double sum = 0.0;
        int count = 0;
        for (int i = index - lookback + 1; i <= index; i++) {
            if (i < config.atrPeriod()) {
                continue;
            }
            double pct = atrPercent(atr, closes, i);
            if (Double.isFinite(pct)) {
                sum += pct;
                count++;
            }
        }
        if (count == 0 || sum <= 0.0) {
            return 1.0;
        }

        double ratio = currentAtrPct / (sum / count);
        double threshold = config.highVolatilityThreshold();
        if (ratio <= threshold) {
            return 1.0;
        }
        double reduction = Math.min(1.0, (ratio - threshold) / threshold);
        double maxReduction = config.maxPositionReduction();
        return Math.max(1.0 - maxReduction, 1.0 - (reduction * maxReduction));
    }

    private double atrPercent(double[] atr, double[] closes, int index) {
        double value = atr[index];
        if (!Double.isFinite(value) || closes[index] <= 0.0) {
            return Double.NaN;
        }
        return (value / closes[index]) * 100.0;
    }
}
