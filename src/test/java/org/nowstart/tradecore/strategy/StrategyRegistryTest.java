package org.nowstart.tradecore.strategy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;
import org.nowstart.tradecore.Fixtures;
import org.nowstart.tradecore.data.dto.TradingSignal;
import org.nowstart.tradecore.data.type.TradeAction;
import org.nowstart.tradecore.indicator.IndicatorSignalScorer;
import org.nowstart.tradecore.strategy.core.StrategyParams;
import org.nowstart.tradecore.strategy.simple.SimpleStrategyEngine;

class StrategyRegistryTest {

    @Test
    void requiredWarmupBars_throwsWhenVersionMissing() {
        StrategyRegistry registry = new StrategyRegistry(List.of(new SimpleStrategyEngine(new IndicatorSignalScorer())));
        registry.init();

        assertThatThrownBy(() -> registry.requiredWarmupBars("v9", Fixtures.bullish()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("v9");
    }

    @Test
    void requiredWarmupBars_throwsForWrongParamType() {
        StrategyRegistry registry = new StrategyRegistry(List.of(new SimpleStrategyEngine(new IndicatorSignalScorer())));
        registry.init();

        StrategyParams wrong = new StrategyParams() {
        };

        assertThatThrownBy(() -> registry.requiredWarmupBars("simple", wrong))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Invalid params type");
    }

    @Test
    void evaluate_dispatchesByNormalizedVersion() {
        StrategyRegistry registry = new StrategyRegistry(List.of(new SimpleStrategyEngine(new IndicatorSignalScorer())));
        registry.init();

        TradingSignal signal = registry.evaluate(
                " Simple ",
                Fixtures.geometric("up", 60, 100, 0.01),
                59,
                null,
                Double.NaN,
                Fixtures.bullish()
        );

        assertThat(signal.action()).isEqualTo(TradeAction.BUY);
        assertThat(registry.versions()).containsExactly("simple");
    }

    @Test
    void init_throwsWhenDuplicateEngineVersionRegistered() {
        StrategyRegistry registry = new StrategyRegistry(List.of(
                new SimpleStrategyEngine(new IndicatorSignalScorer()),
                new SimpleStrategyEngine(new IndicatorSignalScorer())
        ));

        assertThatThrownBy(registry::init)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Duplicate strategy engine");
    }

    @Test
    void getRequired_rejectsBlankVersion() {
        StrategyRegistry registry = new StrategyRegistry(List.of(new SimpleStrategyEngine(new IndicatorSignalScorer())));
        registry.init();

        assertThatThrownBy(() -> registry.getRequired(" "))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("strategyVersion");
    }
}
