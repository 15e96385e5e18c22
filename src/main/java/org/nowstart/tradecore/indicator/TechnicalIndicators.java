package org.nowstart.tradecore.indicator;

import java.util.Arrays;

/**
 * Price indicators over plain arrays.
 *
 * <p>Every result is aligned to the input index: entry {@code i} holds the value computed from inputs
 * {@code [0, i]}, and entries before the warm-up period are {@code NaN}.
 */
public final class TechnicalIndicators {

    private TechnicalIndicators() {
    }

    public static double[] simpleMovingAverage(double[] values, int period) {
        int n = values.length;
        double[] sma = fillNaN(n);
        if (period <= 0 || n < period) {
            return sma;
        }

        double window = 0.0;
        for (int i = 0; i < n; i++) {
            window += values[i];
            if (i >= period) {
                window -= values[i - period];
            }
            if (i >= period - 1) {
                sma[i] = window / period;
            }
        }
        return sma;
    }

    /**
     * EMA seeded with the SMA of the first {@code period} values.
     */
    public static double[] exponentialMovingAverage(double[] values, int period) {
        return exponentialMovingAverage(values, 0, period);
    }

    /**
     * EMA over {@code values[start..]}, for inputs that are themselves {@code NaN} before {@code start}.
     */
    public static double[] exponentialMovingAverage(double[] values, int start, int period) {
        int n = values.length;
        double[] ema = fillNaN(n);
        if (period <= 0 || start < 0 || n - start < period) {
            return ema;
        }

        double seed = 0.0;
        for (int i = start; i < start + period; i++) {
            seed += values[i];
        }
        int first = start + period - 1;
        ema[first] = seed / period;

        double alpha = 2.0 / (period + 1.0);
        for (int i = first + 1; i < n; i++) {
            ema[i] = (alpha * values[i]) + ((1.0 - alpha) * ema[i - 1]);
        }
        return ema;
    }

    public static MacdSeries macd(double[] values, int fastPeriod, int slowPeriod, int signalPeriod) {
        int n = values.length;
        double[] fast = exponentialMovingAverage(values, fastPeriod);
        double[] slow = exponentialMovingAverage(values, slowPeriod);
        double[] macdLine = fillNaN(n);
        int macdStart = -1;
        for (int i = 0; i < n; i++) {
            if (Double.isFinite(fast[i]) && Double.isFinite(slow[i])) {
                macdLine[i] = fast[i] - slow[i];
                if (macdStart < 0) {
                    macdStart = i;
                }
            }
        }

        double[] signalLine = macdStart < 0
                ? fillNaN(n)
                : exponentialMovingAverage(macdLine, macdStart, signalPeriod);
        double[] histogram = fillNaN(n);
        for (int i = 0; i < n; i++) {
            if (Double.isFinite(macdLine[i]) && Double.isFinite(signalLine[i])) {
                histogram[i] = macdLine[i] - signalLine[i];
            }
        }
        return new MacdSeries(macdLine, signalLine, histogram);
    }

    /**
     * Wilder-smoothed RSI. The first value sits at index {@code period}; a window without losses yields 100.
     */
    public static double[] relativeStrengthIndex(double[] values, int period) {
        int n = values.length;
        double[] rsi = fillNaN(n);
        if (period <= 0 || n < period + 1) {
            return rsi;
        }

        double avgGain = 0.0;
        double avgLoss = 0.0;
        for (int i = 1; i <= period; i++) {
            double change = values[i] - values[i - 1];
            avgGain += Math.max(change, 0.0);
            avgLoss += Math.max(-change, 0.0);
        }
        avgGain /= period;
        avgLoss /= period;
        rsi[period] = toRsi(avgGain, avgLoss);

        for (int i = period + 1; i < n; i++) {
            double change = values[i] - values[i - 1];
            avgGain = ((avgGain * (period - 1)) + Math.max(change, 0.0)) / period;
            avgLoss = ((avgLoss * (period - 1)) + Math.max(-change, 0.0)) / period;
            rsi[i] = toRsi(avgGain, avgLoss);
        }
        return rsi;
    }

    /**
     * Bollinger bands around the SMA with population standard deviation.
     */
    public static BollingerBands bollingerBands(double[] values, int period, double stdDevMultiplier) {
        int n = values.length;
        double[] middle = simpleMovingAverage(values, period);
        double[] upper = fillNaN(n);
        double[] lower = fillNaN(n);
        for (int i = period - 1; i < n; i++) {
            if (i < 0 || !Double.isFinite(middle[i])) {
                continue;
            }
            double variance = 0.0;
            for (int j = i - period + 1; j <= i; j++) {
                double diff = values[j] - middle[i];
                variance += diff * diff;
            }
            double deviation = Math.sqrt(variance / period);
            upper[i] = middle[i] + (stdDevMultiplier * deviation);
            lower[i] = middle[i] - (stdDevMultiplier * deviation);
        }
        return new BollingerBands(upper, middle, lower);
    }

    public static double[] trueRange(double[] high, double[] low, double[] close) {
        int n = close.length;
        double[] tr = new double[n];
        if (n == 0) {
            return tr;
        }
        tr[0] = high[0] - low[0];
        for (int i = 1; i < n; i++) {
            double highLow = high[i] - low[i];
            double highPrevClose = Math.abs(high[i] - close[i - 1]);
            double lowPrevClose = Math.abs(low[i] - close[i - 1]);
            tr[i] = Math.max(highLow, Math.max(highPrevClose, lowPrevClose));
        }
        return tr;
    }

    public static double[] wilderAtr(double[] high, double[] low, double[] close, int period) {
        int n = close.length;
        double[] atr = fillNaN(n);
        if (period <= 0 || n < period) {
            return atr;
        }

        double[] tr = trueRange(high, low, close);
        double total = 0.0;
        for (int i = 0; i < period; i++) {
            total += tr[i];
        }

        int first = period - 1;
        atr[first] = total / period;
        for (int i = period; i < n; i++) {
            atr[i] = ((atr[i - 1] * (period - 1)) + tr[i]) / period;
        }
        return atr;
    }

    public static double[] emaAtr(double[] high, double[] low, double[] close, int period) {
        return exponentialMovingAverage(trueRange(high, low, close), period);
    }

    public static double[] averageTrueRange(double[] high, double[] low, double[] close, int period, boolean useEma) {
        return useEma ? emaAtr(high, low, close, period) : wilderAtr(high, low, close, period);
    }

    /**
     * Population standard deviation of close-to-close returns over the {@code period} bars ending at
     * {@code index}. Returns 0 before {@code period} bars of history exist.
     */
    public static double returnStdDev(double[] close, int index, int period) {
        if (index < period || index >= close.length) {
            return 0.0;
        }
        double sum = 0.0;
        int count = 0;
        double[] returns = new double[period];
        for (int i = index - period + 1; i <= index; i++) {
            if (i > 0 && close[i - 1] > 0.0) {
                returns[count] = (close[i] - close[i - 1]) / close[i - 1];
                sum += returns[count];
                count++;
            }
        }
        if (count == 0) {
            return 0.0;
        }
        double mean = sum / count;
        double variance = 0.0;
        for (int i = 0; i < count; i++) {
            double diff = returns[i] - mean;
            variance += diff * diff;
        }
        return Math.sqrt(variance / count);
    }

    /**
     * Max minus min of {@code values} over the {@code period} entries ending at {@code index}.
     */
    public static double range(double[] values, int index, int period) {
        int start = Math.max(0, index - period + 1);
        double max = Double.NEGATIVE_INFINITY;
        double min = Double.POSITIVE_INFINITY;
        for (int i = start; i <= index; i++) {
            max = Math.max(max, values[i]);
            min = Math.min(min, values[i]);
        }
        return max - min;
    }

    public static double valueAt(double[] values, int index) {
        if (index < 0 || index >= values.length) {
            return Double.NaN;
        }
        return values[index];
    }

    public static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    static double[] fillNaN(int size) {
        double[] values = new double[size];
        Arrays.fill(values, Double.NaN);
        return values;
    }

    private static double toRsi(double avgGain, double avgLoss) {
        if (avgLoss == 0.0) {
            return 100.0;
        }
        double rs = avgGain / avgLoss;
        return 100.0 - (100.0 / (1.0 + rs));
    }
}
