package org.nowstart.tradecore.indicator;

import java.util.List;
import org.nowstart.tradecore.strategy.core.PriceBar;

/**
 * Volume-derived indicators. Array results are aligned to the bar index like {@link TechnicalIndicators}.
 */
public final class VolumeIndicators {

    private static final int VWMACD_VOLUME_WINDOW = 5;
    private static final double VWMACD_VOLUME_SCALE = 0.1;

    private VolumeIndicators() {
    }

    /**
     * Rolling VWAP of the typical price over the {@code period} bars ending at {@code index}. {@code NaN} when
     * the window is incomplete or carries no volume.
     */
    public static double vwap(List<PriceBar> bars, int period, int index) {
        if (period <= 0 || index < period - 1 || index >= bars.size()) {
            return Double.NaN;
        }
        double priceVolume = 0.0;
        double volume = 0.0;
        for (int i = index - period + 1; i <= index; i++) {
            PriceBar bar = bars.get(i);
            priceVolume += bar.typicalPrice() * bar.volume();
            volume += bar.volume();
        }
        return volume == 0.0 ? Double.NaN : priceVolume / volume;
    }

    /**
     * On-balance volume, seeded with the first bar's volume.
     */
    public static double[] onBalanceVolume(List<PriceBar> bars) {
        int n = bars.size();
        double[] obv = new double[n];
        if (n == 0) {
            return obv;
        }
        obv[0] = bars.get(0).volume();
        for (int i = 1; i < n; i++) {
            double close = bars.get(i).close();
            double previousClose = bars.get(i - 1).close();
            double delta = 0.0;
            if (close > previousClose) {
                delta = bars.get(i).volume();
            } else if (close < previousClose) {
                delta = -bars.get(i).volume();
            }
            obv[i] = obv[i - 1] + delta;
        }
        return obv;
    }

    /**
     * Volume rate of change in percent against the bar {@code period} back.
     */
    public static double volumeRateOfChange(List<PriceBar> bars, int period, int index) {
        if (period <= 0 || index < period || index >= bars.size()) {
            return Double.NaN;
        }
        double pastVolume = bars.get(index - period).volume();
        if (pastVolume == 0.0) {
            return Double.NaN;
        }
        return ((bars.get(index).volume() - pastVolume) / pastVolume) * 100.0;
    }

    /**
     * MACD over typical prices nudged by relative volume against the trailing 5-bar average.
     */
    public static MacdSeries volumeWeightedMacd(List<PriceBar> bars, int fastPeriod, int slowPeriod, int signalPeriod) {
        int n = bars.size();
        if (n < slowPeriod) {
            return new MacdSeries(
                    TechnicalIndicators.fillNaN(n),
                    TechnicalIndicators.fillNaN(n),
                    TechnicalIndicators.fillNaN(n)
            );
        }
        double[] weightedPrices = new double[n];
        for (int i = 0; i < n; i++) {
            int window = Math.min(VWMACD_VOLUME_WINDOW, i + 1);
            double volumeSum = 0.0;
            for (int j = i - window + 1; j <= i; j++) {
                volumeSum += bars.get(j).volume();
            }
            double avgVolume = volumeSum / window;
            double volumeRatio = avgVolume > 0.0 ? bars.get(i).volume() / avgVolume : 1.0;
            weightedPrices[i] = bars.get(i).typicalPrice() * (1.0 + ((volumeRatio - 1.0) * VWMACD_VOLUME_SCALE));
        }
        return TechnicalIndicators.macd(weightedPrices, fastPeriod, slowPeriod, signalPeriod);
    }

    public static double[] volumeMovingAverage(List<PriceBar> bars, int period) {
        double[] volumes = bars.stream().mapToDouble(PriceBar::volume).toArray();
        return TechnicalIndicators.simpleMovingAverage(volumes, period);
    }

    /**
     * Volume-price trend, seeded with the first bar's volume.
     */
    public static double[] volumePriceTrend(List<PriceBar> bars) {
        int n = bars.size();
        double[] vpt = new double[n];
        if (n == 0) {
            return vpt;
        }
        vpt[0] = bars.get(0).volume();
        for (int i = 1; i < n; i++) {
            double previousClose = bars.get(i - 1).close();
            double change = previousClose > 0.0
                    ? (bars.get(i).close() - previousClose) / previousClose
                    : 0.0;
            vpt[i] = vpt[i - 1] + (bars.get(i).volume() * change);
        }
        return vpt;
    }
}
