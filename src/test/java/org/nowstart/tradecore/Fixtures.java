package org.nowstart.tradecore;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.nowstart.tradecore.data.type.IndicatorKind;
import org.nowstart.tradecore.strategy.config.AdaptiveStrategyConfig;
import org.nowstart.tradecore.strategy.config.IndicatorConfig;
import org.nowstart.tradecore.strategy.config.StrategyConfig;
import org.nowstart.tradecore.strategy.core.PriceBar;
import org.nowstart.tradecore.strategy.core.PriceSeries;

public final class Fixtures {

    public static final Instant START = Instant.parse("2025-01-01T00:00:00Z");

    private Fixtures() {
    }

    /**
     * Daily bars with the given closes, a 1% high/low band and constant volume.
     */
    public static PriceSeries series(String seriesId, double... closes) {
        List<PriceBar> bars = new ArrayList<>(closes.length);
        for (int i = 0; i < closes.length; i++) {
            double close = closes[i];
            double open = i == 0 ? close : closes[i - 1];
            bars.add(new PriceBar(START.plus(Duration.ofDays(i)), open, close * 1.005, close * 0.995, close, 1000.0));
        }
        return new PriceSeries(seriesId, bars);
    }

    /**
     * {@code start x (1 + rate)^i} for {@code i in [0, size)}.
     */
    public static PriceSeries geometric(String seriesId, int size, double start, double rate) {
        double[] closes = new double[size];
        for (int i = 0; i < size; i++) {
            closes[i] = start * Math.pow(1.0 + rate, i);
        }
        return series(seriesId, closes);
    }

    public static PriceSeries flat(String seriesId, int size, double price) {
        double[] closes = new double[size];
        Arrays.fill(closes, price);
        return series(seriesId, closes);
    }

    public static StrategyConfig strategy(String name, double maxPositionFraction) {
        return new StrategyConfig(
                name,
                "1d",
                List.of(
                        IndicatorConfig.of(IndicatorKind.SMA, 0.5, Map.of("period", 20.0)),
                        IndicatorConfig.of(IndicatorKind.EMA, 0.5, Map.of("period", 12.0))
                ),
                0.3,
                -0.3,
                maxPositionFraction,
                1000.0
        );
    }

    public static StrategyConfig bullish() {
        return strategy("Bullish", 0.5);
    }

    public static StrategyConfig bearish() {
        return strategy("Bearish", 0.3);
    }

    public static AdaptiveStrategyConfig adaptive() {
        return AdaptiveStrategyConfig.defaults(bullish(), bearish()).build();
    }
}
