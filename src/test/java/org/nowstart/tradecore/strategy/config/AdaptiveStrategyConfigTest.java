package org.nowstart.tradecore.strategy.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Map;
import org.junit.jupiter.api.Test;
import org.nowstart.tradecore.Fixtures;
import org.nowstart.tradecore.data.type.IndicatorKind;
import org.nowstart.tradecore.data.type.VolatilitySource;

class AdaptiveStrategyConfigTest {

    @Test
    void defaults_matchBoundPropertyDefaults() {
        AdaptiveStrategyConfig config = Fixtures.adaptive();

        assertThat(config.regimeConfidenceThreshold()).isEqualTo(0.2);
        assertThat(config.regimePersistencePeriods()).isEqualTo(2);
        assertThat(config.whipsawDetectionPeriods()).isEqualTo(5);
        assertThat(config.whipsawMaxChanges()).isEqualTo(3);
        assertThat(config.volatilitySource()).isEqualTo(VolatilitySource.RETURN_STD_DEV);
        assertThat(config.kellyEnabled()).isFalse();
        assertThat(config.stopLossEnabled()).isFalse();
    }

    @Test
    void fallbackStrategy_prefersNeutralWhenPresent() {
        AdaptiveStrategyConfig config = Fixtures.adaptive();
        StrategyConfig neutral = Fixtures.strategy("Neutral", 0.1);

        assertThat(config.fallbackStrategy()).isSameAs(config.bearishStrategy());
        assertThat(config.toBuilder().neutralStrategy(neutral).build().fallbackStrategy()).isSameAs(neutral);
    }

    @Test
    void constructor_rejectsOutOfRangeValues() {
        assertThatThrownBy(() -> Fixtures.adaptive().toBuilder().maxDrawdownThreshold(1.5).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxDrawdownThreshold");
        assertThatThrownBy(() -> Fixtures.adaptive().toBuilder().whipsawMaxChanges(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("whipsawMaxChanges");
        assertThatThrownBy(() -> Fixtures.adaptive().toBuilder().bullishStrategy(null).build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void strategyConfig_rejectsPositionFractionAboveOne() {
        assertThatThrownBy(() -> Fixtures.strategy("Greedy", 1.2))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxPositionFraction");
    }

    @Test
    void indicatorConfig_readsRelaxedParameterKeys() {
        IndicatorConfig macd = IndicatorConfig.of(IndicatorKind.MACD, 1.0, Map.of("fast-period", 9.0, "slowperiod", 19.0));

        assertThat(macd.intParam("fastPeriod", 12)).isEqualTo(9);
        assertThat(macd.intParam("slowPeriod", 26)).isEqualTo(19);
        assertThat(macd.intParam("signalPeriod", 9)).isEqualTo(9);
    }
}
