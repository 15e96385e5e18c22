package org.nowstart.tradecore.data.dto;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import org.nowstart.tradecore.data.type.HoldReason;
import org.nowstart.tradecore.data.type.TradeAction;
import org.nowstart.tradecore.strategy.config.StrategyConfig;
import org.nowstart.tradecore.strategy.core.StrategyDiagnostic;

/**
 * Per-bar decision produced by a strategy engine.
 *
 * @param timestamp              bar timestamp
 * @param signal                 blended indicator opinion in [-1, 1], positive = bullish
 * @param confidence             certainty in [0, 1]
 * @param action                 buy, sell or hold
 * @param activeStrategy         strategy whose indicators and thresholds produced the action
 * @param positionSizeMultiplier sizing multiplier in [0, 2]
 * @param momentumConfirmed      whether a bullish regime passed momentum confirmation
 * @param regime                 regime classification, {@code null} for the simple engine
 * @param indicatorScores        per-indicator scores keyed by indicator kind
 * @param holdReason             risk gate that forced hold, {@link HoldReason#NONE} otherwise
 * @param diagnostics            audit values
 */
@Builder(toBuilder = true)
public record TradingSignal(
        Instant timestamp,
        double signal,
        double confidence,
        TradeAction action,
        StrategyConfig activeStrategy,
        double positionSizeMultiplier,
        boolean momentumConfirmed,
        RegimeSignal regime,
        Map<String, Double> indicatorScores,
        HoldReason holdReason,
        List<StrategyDiagnostic> diagnostics
) {

    public TradingSignal {
        action = action == null ? TradeAction.HOLD : action;
        indicatorScores = indicatorScores == null ? Map.of() : Map.copyOf(indicatorScores);
        holdReason = holdReason == null ? HoldReason.NONE : holdReason;
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }

    public boolean isHold() {
        return action == TradeAction.HOLD;
    }

    public boolean isGated() {
        return holdReason != HoldReason.NONE;
    }
}
