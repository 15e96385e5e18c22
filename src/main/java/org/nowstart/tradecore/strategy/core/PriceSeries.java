package org.nowstart.tradecore.strategy.core;

import java.util.List;

/**
 * Ordered, immutable bar sequence with a stable identifier.
 *
 * <p>The identifier keys the regime and indicator cache, so two different underlying series must never share
 * one. Bars are expected in strictly increasing timestamp order with no gaps.
 *
 * @param seriesId stable identifier, for example {@code ETH-USD:1h:2025-01}
 * @param bars     price bars, oldest first
 */
public record PriceSeries(
        String seriesId,
        List<PriceBar> bars
) {

    public PriceSeries {
        if (seriesId == null || seriesId.isBlank()) {
            throw new IllegalArgumentException("seriesId is required");
        }
        if (bars == null) {
            throw new IllegalArgumentException("bars are required");
        }
        bars = List.copyOf(bars);
    }

    public int size() {
        return bars.size();
    }

    public PriceBar bar(int index) {
        return bars.get(index);
    }

    public double close(int index) {
        return bars.get(index).close();
    }

    public double[] closes() {
        return bars.stream().mapToDouble(PriceBar::close).toArray();
    }

    public double[] highs() {
        return bars.stream().mapToDouble(PriceBar::high).toArray();
    }

    public double[] lows() {
        return bars.stream().mapToDouble(PriceBar::low).toArray();
    }

    public double[] volumes() {
        return bars.stream().mapToDouble(PriceBar::volume).toArray();
    }

    /**
     * Returns the series truncated to {@code [0, index]}. The identifier is kept.
     */
    public PriceSeries upTo(int index) {
        if (index < 0 || index >= bars.size()) {
            throw new IllegalArgumentException("index must be in [0, bars.size()-1]");
        }
        return new PriceSeries(seriesId, bars.subList(0, index + 1));
    }
}
