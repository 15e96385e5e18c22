package org.nowstart.tradecore.service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.tradecore.data.dto.BacktestResult;
import org.nowstart.tradecore.data.dto.EquitySnapshot;
import org.nowstart.tradecore.data.dto.RiskMetrics;
import org.nowstart.tradecore.data.dto.StrategyResults;
import org.nowstart.tradecore.data.dto.TradingSignal;
import org.nowstart.tradecore.data.model.ExecutionContext;
import org.nowstart.tradecore.data.model.Portfolio;
import org.nowstart.tradecore.data.model.Trade;
import org.nowstart.tradecore.data.property.TradingProperties;
import org.nowstart.tradecore.indicator.ConfidenceCalculator;
import org.nowstart.tradecore.regime.CachedRegimeClassifier;
import org.nowstart.tradecore.risk.RiskMetricsCalculator;
import org.nowstart.tradecore.session.SessionStore;
import org.nowstart.tradecore.strategy.adaptive.AdaptiveStrategyEngine;
import org.nowstart.tradecore.strategy.config.AdaptiveStrategyConfig;
import org.nowstart.tradecore.strategy.core.PriceSeries;
import org.nowstart.tradecore.strategy.core.StrategyInput;
import org.springframework.stereotype.Service;

/**
 * Replays one series bar by bar through the adaptive engine and the executor.
 *
 * <p>Session history and the series' regime cache are cleared first, so repeated runs over the same inputs
 * produce the same trades.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BacktestService {

    private final AdaptiveStrategyEngine adaptiveStrategyEngine;
    private final ConfidenceCalculator confidenceCalculator;
    private final TradeExecutionService tradeExecutionService;
    private final RiskMetricsCalculator riskMetricsCalculator;
    private final CachedRegimeClassifier regimeClassifier;
    private final SessionStore sessionStore;
    private final TradingProperties tradingProperties;

    public BacktestResult run(PriceSeries series, AdaptiveStrategyConfig config, String sessionKey) {
        if (series == null || config == null) {
            throw new IllegalArgumentException("series and config are required");
        }
        String resolvedKey = sessionKey == null || sessionKey.isBlank() ? "backtest:" + series.seriesId() : sessionKey;
        sessionStore.clear(resolvedKey);
        regimeClassifier.invalidate(series.seriesId());

        double initialCapital = config.bullishStrategy().initialCapital();
        Portfolio portfolio = Portfolio.withCapital(initialCapital);
        ExecutionContext context = ExecutionContext.of(series, resolvedKey, config);
        List<EquitySnapshot> equityCurve = new ArrayList<>();
        Map<String, Integer> strategyUsage = new LinkedHashMap<>();

        int start = Math.max(tradingProperties.backtestWarmupBars(), adaptiveStrategyEngine.requiredWarmupBars(config));
        for (int index = start; index < series.size(); index++) {
            double price = series.close(index);
            context.moveTo(index);
            portfolio.markToMarket(price);

            TradingSignal signal = adaptiveStrategyEngine.evaluate(
                    new StrategyInput<>(series, index, resolvedKey, portfolio.getTotalValue(), config)
            );
            strategyUsage.merge(signal.activeStrategy().name(), 1, Integer::sum);
            double confidence = confidenceCalculator.calculate(signal, series, index);

            equityCurve.add(new EquitySnapshot(
                    series.bar(index).timestamp(),
                    portfolio.getQuoteBalance(),
                    portfolio.getBaseBalance(),
                    portfolio.getTotalValue(),
                    price
            ));
            tradeExecutionService.executeTrade(signal, confidence, price, portfolio, context);
        }

        if (series.size() > 0) {
            portfolio.markToMarket(series.close(series.size() - 1));
        }
        List<Trade> trades = context.getTrades();
        StrategyResults results = riskMetricsCalculator.calculateStrategyResults(trades, initialCapital, portfolio.getTotalValue());
        RiskMetrics riskMetrics = riskMetricsCalculator.calculateRiskMetrics(trades, equityCurve, initialCapital);

        log.info(
                "Backtest completed. session={}, series={}, bars={}, trades={}, finalValue={}, totalReturnPct={}, maxDrawdown={}, sharpe={}",
                resolvedKey,
                series.seriesId(),
                equityCurve.size(),
                trades.size(),
                portfolio.getTotalValue(),
                results.totalReturnPct(),
                riskMetrics.maxDrawdown(),
                riskMetrics.sharpeRatio()
        );
        return new BacktestResult(series.seriesId(), trades, equityCurve, strategyUsage, results, riskMetrics);
    }
}
