package org.nowstart.tradecore.regime;

import org.nowstart.tradecore.indicator.MacdSeries;
import org.nowstart.tradecore.indicator.TechnicalIndicators;
import org.nowstart.tradecore.strategy.core.PriceSeries;

/**
 * Index-aligned indicator arrays the regime classifier reads. Each entry depends only on bars up to its index,
 * so one set computed over a full series serves every bar of it.
 */
public record RegimeIndicatorSet(
        int barCount,
        double[] closes,
        double[] sma20,
        double[] sma50,
        double[] sma200,
        double[] ema12,
        double[] ema26,
        MacdSeries macd,
        double[] rsi
) {

    public static RegimeIndicatorSet compute(PriceSeries series) {
        double[] closes = series.closes();
        return new RegimeIndicatorSet(
                closes.length,
                closes,
                TechnicalIndicators.simpleMovingAverage(closes, 20),
                TechnicalIndicators.simpleMovingAverage(closes, 50),
                TechnicalIndicators.simpleMovingAverage(closes, 200),
                TechnicalIndicators.exponentialMovingAverage(closes, 12),
                TechnicalIndicators.exponentialMovingAverage(closes, 26),
                TechnicalIndicators.macd(closes, 12, 26, 9),
                TechnicalIndicators.relativeStrengthIndex(closes, 14)
        );
    }
}
