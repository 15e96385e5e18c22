package org.nowstart.tradecore.indicator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.nowstart.tradecore.strategy.core.PriceBar;

class VolumeIndicatorsTest {

    private static final Instant T0 = Instant.parse("2025-01-01T00:00:00Z");

    private final List<PriceBar> bars = List.of(
            new PriceBar(T0, 10, 12, 8, 10, 100),
            new PriceBar(T0.plusSeconds(60), 10, 13, 9, 11, 200),
            new PriceBar(T0.plusSeconds(120), 11, 12, 9, 9, 300),
            new PriceBar(T0.plusSeconds(180), 9, 9, 9, 9, 0)
    );

    @Test
    void vwap_weightsTypicalPriceByVolume() {
        double expected = ((10.0 * 100) + (11.0 * 200)) / 300.0;

        assertThat(VolumeIndicators.vwap(bars, 2, 1)).isCloseTo(expected, within(1e-12));
        assertThat(VolumeIndicators.vwap(bars, 1, 3)).isNaN();
    }

    @Test
    void onBalanceVolume_addsOnUpClosesAndSubtractsOnDownCloses() {
        double[] obv = VolumeIndicators.onBalanceVolume(bars);

        assertThat(obv).containsExactly(100.0, 300.0, 0.0, 0.0);
    }

    @Test
    void volumeRateOfChange_isNaNWhenPastVolumeIsZero() {
        assertThat(VolumeIndicators.volumeRateOfChange(bars, 1, 1)).isEqualTo(100.0);
        assertThat(VolumeIndicators.volumeRateOfChange(List.of(bars.get(3), bars.get(0)), 1, 1)).isNaN();
    }

    @Test
    void volumePriceTrend_accumulatesVolumeTimesReturn() {
        double[] vpt = VolumeIndicators.volumePriceTrend(bars);

        assertThat(vpt[0]).isEqualTo(100.0);
        assertThat(vpt[1]).isCloseTo(100.0 + 200 * 0.1, within(1e-12));
    }
}
