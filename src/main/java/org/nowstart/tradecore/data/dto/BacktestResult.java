package org.nowstart.tradecore.data.dto;

import java.util.List;
import java.util.Map;
import org.nowstart.tradecore.data.model.Trade;

public record BacktestResult(
        String seriesId,
        List<Trade> trades,
        List<EquitySnapshot> equityCurve,
        Map<String, Integer> strategyUsage,
        StrategyResults results,
        RiskMetrics riskMetrics
) {

    public BacktestResult {
        trades = trades == null ? List.of() : List.copyOf(trades);
        equityCurve = equityCurve == null ? List.of() : List.copyOf(equityCurve);
        strategyUsage = strategyUsage == null ? Map.of() : Map.copyOf(strategyUsage);
    }
}
