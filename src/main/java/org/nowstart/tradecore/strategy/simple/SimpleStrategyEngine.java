package org.nowstart.tradecore.strategy.simple;

import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.nowstart.tradecore.data.dto.TradingSignal;
import org.nowstart.tradecore.data.type.TradeAction;
import org.nowstart.tradecore.indicator.IndicatorSignalScorer;
import org.nowstart.tradecore.indicator.IndicatorSignalScorer.BlendedSignal;
import org.nowstart.tradecore.strategy.config.IndicatorConfig;
import org.nowstart.tradecore.strategy.config.StrategyConfig;
import org.nowstart.tradecore.strategy.core.PriceSeries;
import org.nowstart.tradecore.strategy.core.StrategyDiagnostic;
import org.nowstart.tradecore.strategy.core.StrategyInput;
import org.nowstart.tradecore.strategy.core.TradingStrategyEngine;
import org.springframework.stereotype.Component;

/**
 * Blends one strategy's indicators at a bar. Stateless; confidence is the absolute blended signal.
 */
@Component
@RequiredArgsConstructor
public class SimpleStrategyEngine implements TradingStrategyEngine<StrategyConfig> {

    public static final String VERSION = "simple";

    private final IndicatorSignalScorer scorer;

    @Override
    public String version() {
        return VERSION;
    }

    @Override
    public Class<StrategyConfig> parameterType() {
        return StrategyConfig.class;
    }

    @Override
    public int requiredWarmupBars(StrategyConfig params) {
        return params.indicators().stream()
                .mapToInt(IndicatorSignalScorer::warmupBars)
                .max()
                .orElse(0);
    }

    @Override
    public TradingSignal evaluate(StrategyInput<StrategyConfig> input) {
        if (input == null || input.series() == null || input.params() == null) {
            throw new IllegalArgumentException("input, series, and params are required");
        }
        PriceSeries series = input.series();
        int index = input.signalIndex();
        if (index < 0 || index >= series.size()) {
            throw new IllegalArgumentException("signalIndex must be in [0, series.size()-1]");
        }

        StrategyConfig strategy = input.params();
        BlendedSignal blended = scorer.blend(strategy.indicators(), series, index);
        double signal = blended.signal();
        TradeAction action = IndicatorSignalScorer.resolveAction(signal, strategy);

        return TradingSignal.builder()
                .timestamp(series.bar(index).timestamp())
                .signal(signal)
                .confidence(Math.min(1.0, Math.abs(signal)))
                .action(action)
                .activeStrategy(strategy)
                .positionSizeMultiplier(1.0)
                .indicatorScores(blended.scores())
                .diagnostics(diagnostics(strategy, blended))
                .build();
    }

    private List<StrategyDiagnostic> diagnostics(StrategyConfig strategy, BlendedSignal blended) {
        List<StrategyDiagnostic> diagnostics = new ArrayList<>();
        diagnostics.add(StrategyDiagnostic.text(
                "strategy.name",
                "Strategy",
                "Strategy whose indicators were blended",
                strategy.name()
        ));
        diagnostics.add(StrategyDiagnostic.number(
                "signal.blended",
                "Blended Signal",
                "",
                "Weighted indicator score",
                blended.signal()
        ));
        List<String> keys = IndicatorSignalScorer.scoreKeys(strategy.indicators());
        for (int i = 0; i < keys.size(); i++) {
            IndicatorConfig indicator = strategy.indicators().get(i);
            String key = keys.get(i);
            diagnostics.add(StrategyDiagnostic.number(
                    "indicator." + key,
                    indicator.kind().name(),
                    "",
                    "Indicator score at signal index",
                    blended.scores().getOrDefault(key, 0.0)
            ));
        }
        return diagnostics;
    }
}
