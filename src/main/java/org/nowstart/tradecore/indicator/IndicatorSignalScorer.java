package org.nowstart.tradecore.indicator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import org.nowstart.tradecore.data.type.TradeAction;
import org.nowstart.tradecore.strategy.config.IndicatorConfig;
import org.nowstart.tradecore.strategy.config.StrategyConfig;
import org.nowstart.tradecore.strategy.core.PriceBar;
import org.nowstart.tradecore.strategy.core.PriceSeries;
import org.springframework.stereotype.Component;

/**
 * Maps one indicator reading at a bar to a normalized score in [-1, 1], and blends weighted scores.
 *
 * <p>Only bars {@code [0, index]} are read. An indicator whose warm-up period has not elapsed scores 0.
 * Indicator arrays are causal, so they are computed once per series instance and memoized until
 * {@link #invalidate()}.
 */
@Component
public class IndicatorSignalScorer {

    static final int DEFAULT_MA_PERIOD = 20;
    static final int DEFAULT_RSI_PERIOD = 14;
    static final int DEFAULT_MACD_FAST = 12;
    static final int DEFAULT_MACD_SLOW = 26;
    static final int DEFAULT_MACD_SIGNAL = 9;
    static final double DEFAULT_BOLLINGER_STD_DEV = 2.0;
    private static final int MACD_RANGE_WINDOW = 20;
    private static final double DISTANCE_SCALE = 10.0;
    private static final String OBV_KEY = "obv.series";

    private final Map<String, SeriesArrays> seriesArrays = new ConcurrentHashMap<>();

    public double score(IndicatorConfig indicator, PriceSeries series, int index) {
        validateIndex(series, index);
        SeriesArrays cached = arrays(series);
        double[] closes = cached.closes();
        List<PriceBar> bars = series.bars();
        double price = closes[index];
        String key = scoreKey(indicator);

        return switch (indicator.kind()) {
            case SMA -> distanceScore(price, cached.<double[]>get(key, () -> TechnicalIndicators.simpleMovingAverage(
                    closes, indicator.intParam("period", DEFAULT_MA_PERIOD)))[index]);
            case EMA -> distanceScore(price, cached.<double[]>get(key, () -> TechnicalIndicators.exponentialMovingAverage(
                    closes, indicator.intParam("period", DEFAULT_MA_PERIOD)))[index]);
            case MACD -> histogramScore(cached.get(key, () -> macd(indicator, closes)), closes, index);
            case RSI -> rsiScore(cached.<double[]>get(key, () -> TechnicalIndicators.relativeStrengthIndex(
                    closes, indicator.intParam("period", DEFAULT_RSI_PERIOD)))[index]);
            case BOLLINGER -> bollingerScore(price, cached.get(key, () -> TechnicalIndicators.bollingerBands(
                    closes,
                    indicator.intParam("period", DEFAULT_MA_PERIOD),
                    indicator.param("stdDev", DEFAULT_BOLLINGER_STD_DEV)
            )), index);
            case VWAP -> distanceScore(price, VolumeIndicators.vwap(
                    bars, indicator.intParam("period", DEFAULT_MA_PERIOD), index));
            case OBV -> obvScore(
                    bars,
                    cached.get(OBV_KEY, () -> VolumeIndicators.onBalanceVolume(bars)),
                    indicator.intParam("period", DEFAULT_MA_PERIOD),
                    index
            );
            case VWMACD -> histogramScore(cached.get(key, () -> VolumeIndicators.volumeWeightedMacd(
                    bars,
                    indicator.intParam("fastPeriod", DEFAULT_MACD_FAST),
                    indicator.intParam("slowPeriod", DEFAULT_MACD_SLOW),
                    indicator.intParam("signalPeriod", DEFAULT_MACD_SIGNAL)
            )), closes, index);
        };
    }

    /**
     * Weighted average of indicator scores normalized by total weight. An empty or zero-weight list yields 0.
     */
    public BlendedSignal blend(List<IndicatorConfig> indicators, PriceSeries series, int index) {
        validateIndex(series, index);
        List<String> keys = scoreKeys(indicators);
        Map<String, Double> scores = new LinkedHashMap<>();
        double weighted = 0.0;
        double totalWeight = 0.0;
        for (int i = 0; i < indicators.size(); i++) {
            IndicatorConfig indicator = indicators.get(i);
            double score = score(indicator, series, index);
            scores.put(keys.get(i), score);
            weighted += score * indicator.weight();
            totalWeight += indicator.weight();
        }
        double signal = totalWeight > 0.0 ? weighted / totalWeight : 0.0;
        return new BlendedSignal(signal, scores);
    }

    /**
     * Drops memoized indicator arrays for every series.
     */
    public void invalidate() {
        seriesArrays.clear();
    }

    public void invalidate(String seriesId) {
        if (seriesId != null) {
            seriesArrays.remove(seriesId);
        }
    }

    public static TradeAction resolveAction(double signal, StrategyConfig strategy) {
        if (signal > strategy.buyThreshold()) {
            return TradeAction.BUY;
        }
        if (signal < strategy.sellThreshold()) {
            return TradeAction.SELL;
        }
        return TradeAction.HOLD;
    }

    /**
     * Bars of history the indicator needs before it produces a non-zero score.
     */
    public static int warmupBars(IndicatorConfig indicator) {
        return switch (indicator.kind()) {
            case SMA, EMA, BOLLINGER, VWAP -> indicator.intParam("period", DEFAULT_MA_PERIOD);
            case RSI -> indicator.intParam("period", DEFAULT_RSI_PERIOD) + 1;
            case OBV -> indicator.intParam("period", DEFAULT_MA_PERIOD) + 1;
            case MACD, VWMACD -> indicator.intParam("slowPeriod", DEFAULT_MACD_SLOW)
                    + indicator.intParam("signalPeriod", DEFAULT_MACD_SIGNAL) - 1;
        };
    }

    public static String scoreKey(IndicatorConfig indicator) {
        if (indicator.params().isEmpty()) {
            return indicator.kind().key();
        }
        return indicator.kind().key() + "_" + new TreeMap<>(indicator.params());
    }

    /**
     * Score keys in configuration order. A repeated indicator gets its position appended so every entry keeps
     * its own score.
     */
    public static List<String> scoreKeys(List<IndicatorConfig> indicators) {
        List<String> keys = new ArrayList<>(indicators.size());
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < indicators.size(); i++) {
            String key = scoreKey(indicators.get(i));
            keys.add(seen.add(key) ? key : key + "#" + i);
        }
        return keys;
    }

    /**
     * RSI above 70 maps linearly to [-1, 0), below 30 to (0, 1], and the band in between to 0.
     */
    public static double rsiScore(double rsi) {
        if (!Double.isFinite(rsi)) {
            return 0.0;
        }
        if (rsi > 70.0) {
            return -((rsi - 70.0) / 30.0);
        }
        if (rsi < 30.0) {
            return (30.0 - rsi) / 30.0;
        }
        return 0.0;
    }

    private MacdSeries macd(IndicatorConfig indicator, double[] closes) {
        return TechnicalIndicators.macd(
                closes,
                indicator.intParam("fastPeriod", DEFAULT_MACD_FAST),
                indicator.intParam("slowPeriod", DEFAULT_MACD_SLOW),
                indicator.intParam("signalPeriod", DEFAULT_MACD_SIGNAL)
        );
    }

    private double distanceScore(double price, double average) {
        if (!Double.isFinite(average) || average == 0.0) {
            return 0.0;
        }
        return TechnicalIndicators.clamp(((price - average) / average) * DISTANCE_SCALE, -1.0, 1.0);
    }

    private double histogramScore(MacdSeries macd, double[] closes, int index) {
        double histogram = macd.histogram()[index];
        if (!Double.isFinite(histogram)) {
            return 0.0;
        }
        double priceRange = TechnicalIndicators.range(closes, index, MACD_RANGE_WINDOW);
        double scale = priceRange > 0.0 ? priceRange / 100.0 : 1.0;
        return TechnicalIndicators.clamp(histogram / scale, -1.0, 1.0);
    }

    private double bollingerScore(double price, BollingerBands bands, int index) {
        double upper = bands.upper()[index];
        double lower = bands.lower()[index];
        if (!Double.isFinite(upper) || !Double.isFinite(lower)) {
            return 0.0;
        }
        double bandWidth = upper - lower;
        if (bandWidth == 0.0) {
            return 0.0;
        }
        if (price >= upper) {
            return -1.0;
        }
        if (price <= lower) {
            return 1.0;
        }
        double position = (price - lower) / bandWidth;
        return (position - 0.5) * 2.0;
    }

    private double obvScore(List<PriceBar> bars, double[] obv, int period, int index) {
        if (index < period) {
            return 0.0;
        }
        double windowVolume = 0.0;
        for (int i = index - period + 1; i <= index; i++) {
            windowVolume += bars.get(i).volume();
        }
        if (windowVolume <= 0.0) {
            return 0.0;
        }
        return TechnicalIndicators.clamp((obv[index] - obv[index - period]) / windowVolume, -1.0, 1.0);
    }

    /**
     * Arrays are keyed by series id and reused only for the same series instance, so a truncated or rebuilt
     * series never reads another instance's values.
     */
    private SeriesArrays arrays(PriceSeries series) {
        return seriesArrays.compute(series.seriesId(), (seriesId, current) ->
                current != null && current.series() == series ? current : new SeriesArrays(series, series.closes()));
    }

    private void validateIndex(PriceSeries series, int index) {
        if (series == null) {
            throw new IllegalArgumentException("series is required");
        }
        if (index < 0 || index >= series.size()) {
            throw new IllegalArgumentException("index must be in [0, series.size()-1]");
        }
    }

    private record SeriesArrays(PriceSeries series, double[] closes, Map<String, Object> values) {

        SeriesArrays(PriceSeries series, double[] closes) {
            this(series, closes, new ConcurrentHashMap<>());
        }

        @SuppressWarnings("unchecked")
        <T> T get(String key, Supplier<T> loader) {
            return (T) values.computeIfAbsent(key, ignored -> loader.get());
        }
    }

    /**
     * @param signal blended score in [-1, 1]
     * @param scores per-indicator scores in configuration order
     */
    public record BlendedSignal(double signal, Map<String, Double> scores) {

        public BlendedSignal {
            scores = scores == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(scores));
        }
    }
}
