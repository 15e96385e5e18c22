package org.nowstart.tradecore.indicator;

/**
 * MACD line, signal line and histogram, each aligned to the price index.
 */
public record MacdSeries(
        double[] macd,
        double[] signal,
        double[] histogram
) {
}
