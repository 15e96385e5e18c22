package org.nowstart.tradecore.indicator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;

class TechnicalIndicatorsTest {

    @Test
    void simpleMovingAverage_isNaNBeforeWarmupAndAlignedAfter() {
        double[] sma = TechnicalIndicators.simpleMovingAverage(new double[] {1, 2, 3, 4, 5}, 3);

        assertThat(sma[0]).isNaN();
        assertThat(sma[1]).isNaN();
        assertThat(sma[2]).isEqualTo(2.0);
        assertThat(sma[4]).isEqualTo(4.0);
    }

    @Test
    void exponentialMovingAverage_seedsWithSimpleAverage() {
        double[] ema = TechnicalIndicators.exponentialMovingAverage(new double[] {2, 4, 6, 8}, 3);

        assertThat(ema[1]).isNaN();
        assertThat(ema[2]).isEqualTo(4.0);
        assertThat(ema[3]).isCloseTo(0.5 * 8 + 0.5 * 4.0, within(1e-12));
    }

    @Test
    void relativeStrengthIndex_returns100WithoutLosses() {
        double[] closes = new double[20];
        for (int i = 0; i < closes.length; i++) {
            closes[i] = 100 + i;
        }

        double[] rsi = TechnicalIndicators.relativeStrengthIndex(closes, 14);

        assertThat(rsi[13]).isNaN();
        assertThat(rsi[14]).isEqualTo(100.0);
        assertThat(rsi[19]).isEqualTo(100.0);
    }

    @Test
    void relativeStrengthIndex_staysWithinBounds() {
        double[] closes = {100, 102, 99, 104, 101, 98, 103, 107, 102, 100, 97, 101, 105, 103, 99, 96, 100, 104};

        double[] rsi = TechnicalIndicators.relativeStrengthIndex(closes, 5);

        for (int i = 5; i < rsi.length; i++) {
            assertThat(rsi[i]).isBetween(0.0, 100.0);
        }
    }

    @Test
    void macd_histogramIsMacdMinusSignal() {
        double[] closes = new double[60];
        for (int i = 0; i < closes.length; i++) {
            closes[i] = 100 + Math.sin(i / 4.0) * 5 + i * 0.2;
        }

        MacdSeries macd = TechnicalIndicators.macd(closes, 12, 26, 9);

        assertThat(macd.macd()[24]).isNaN();
        assertThat(macd.macd()[25]).isFinite();
        assertThat(macd.signal()[32]).isNaN();
        assertThat(macd.signal()[33]).isFinite();
        assertThat(macd.histogram()[59]).isCloseTo(macd.macd()[59] - macd.signal()[59], within(1e-12));
    }

    @Test
    void bollingerBands_collapseOnConstantInput() {
        BollingerBands bands = TechnicalIndicators.bollingerBands(new double[] {5, 5, 5, 5}, 3, 2.0);

        assertThat(bands.upper()[3]).isEqualTo(5.0);
        assertThat(bands.middle()[3]).isEqualTo(5.0);
        assertThat(bands.lower()[3]).isEqualTo(5.0);
    }

    @Test
    void trueRange_usesPreviousCloseGaps() {
        double[] tr = TechnicalIndicators.trueRange(
                new double[] {11, 15},
                new double[] {9, 13},
                new double[] {10, 14}
        );

        assertThat(tr[0]).isEqualTo(2.0);
        assertThat(tr[1]).isEqualTo(5.0);
    }

    @Test
    void wilderAtr_smoothsTrueRange() {
        double[] high = {11, 11, 11, 21};
        double[] low = {9, 9, 9, 9};
        double[] close = {10, 10, 10, 10};

        double[] atr = TechnicalIndicators.wilderAtr(high, low, close, 3);

        assertThat(atr[1]).isNaN();
        assertThat(atr[2]).isEqualTo(2.0);
        assertThat(atr[3]).isCloseTo((2.0 * 2 + 12.0) / 3, within(1e-12));
    }

    @Test
    void returnStdDev_isZeroBeforePeriodAndForConstantReturns() {
        double[] closes = new double[30];
        for (int i = 0; i < closes.length; i++) {
            closes[i] = 100 * Math.pow(1.01, i);
        }

        assertThat(TechnicalIndicators.returnStdDev(closes, 10, 20)).isZero();
        assertThat(TechnicalIndicators.returnStdDev(closes, 29, 20)).isCloseTo(0.0, within(1e-12));
    }

    @Test
    void range_coversTrailingWindowOnly() {
        double[] values = {50, 1, 2, 3, 4};

        assertThat(TechnicalIndicators.range(values, 4, 3)).isEqualTo(2.0);
        assertThat(TechnicalIndicators.range(values, 4, 10)).isEqualTo(49.0);
    }
}
