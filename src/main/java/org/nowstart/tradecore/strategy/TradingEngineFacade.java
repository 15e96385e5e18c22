package org.nowstart.tradecore.strategy;

import java.util.List;
import lombok.RequiredArgsConstructor;
import org.nowstart.tradecore.data.dto.EquitySnapshot;
import org.nowstart.tradecore.data.dto.RiskMetrics;
import org.nowstart.tradecore.data.dto.StrategyResults;
import org.nowstart.tradecore.data.dto.TradingSignal;
import org.nowstart.tradecore.data.model.ExecutionContext;
import org.nowstart.tradecore.data.model.Portfolio;
import org.nowstart.tradecore.data.model.Trade;
import org.nowstart.tradecore.indicator.IndicatorSignalScorer;
import org.nowstart.tradecore.regime.CachedRegimeClassifier;
import org.nowstart.tradecore.risk.RiskMetricsCalculator;
import org.nowstart.tradecore.service.TradeExecutionService;
import org.nowstart.tradecore.session.SessionStore;
import org.nowstart.tradecore.strategy.adaptive.AdaptiveStrategyEngine;
import org.nowstart.tradecore.strategy.config.AdaptiveStrategyConfig;
import org.nowstart.tradecore.strategy.config.StrategyConfig;
import org.nowstart.tradecore.strategy.core.PriceSeries;
import org.nowstart.tradecore.strategy.simple.SimpleStrategyEngine;
import org.springframework.stereotype.Service;

/**
 * Entry point for backtest drivers and paper-trading schedulers.
 *
 * <p>Callers running independent backtests in one process must call {@link #clearRegimeHistory()} and
 * {@link #clearIndicatorCache()} between runs.
 */
@Service
@RequiredArgsConstructor
public class TradingEngineFacade {

    private final StrategyRegistry strategyRegistry;
    private final StrategyParamResolver strategyParamResolver;
    private final TradeExecutionService tradeExecutionService;
    private final RiskMetricsCalculator riskMetricsCalculator;
    private final CachedRegimeClassifier regimeClassifier;
    private final IndicatorSignalScorer indicatorSignalScorer;
    private final SessionStore sessionStore;

    public TradingSignal generateSignal(PriceSeries series, StrategyConfig config, int index) {
        return strategyRegistry.evaluate(SimpleStrategyEngine.VERSION, series, index, null, Double.NaN, config);
    }

    public TradingSignal generateAdaptiveSignal(PriceSeries series, AdaptiveStrategyConfig config, int index, String sessionKey) {
        return generateAdaptiveSignal(series, config, index, sessionKey, Double.NaN);
    }

    /**
     * @param portfolioValue current portfolio value feeding the drawdown breaker, {@code NaN} to skip it
     */
    public TradingSignal generateAdaptiveSignal(
            PriceSeries series,
            AdaptiveStrategyConfig config,
            int index,
            String sessionKey,
            double portfolioValue
    ) {
        return strategyRegistry.evaluate(AdaptiveStrategyEngine.VERSION, series, index, sessionKey, portfolioValue, config);
    }

    /**
     * Evaluates the configured active engine with its bound parameters.
     */
    public TradingSignal generateActiveSignal(PriceSeries series, int index, String sessionKey) {
        String version = strategyParamResolver.resolveActiveStrategyVersion();
        return strategyRegistry.evaluate(
                version,
                series,
                index,
                sessionKey,
                Double.NaN,
                strategyParamResolver.resolve(version)
        );
    }

    public Trade executeTrade(
            TradingSignal signal,
            double confidence,
            double price,
            Portfolio portfolio,
            ExecutionContext context
    ) {
        return tradeExecutionService.executeTrade(signal, confidence, price, portfolio, context);
    }

    public RiskMetrics calculateRiskMetrics(List<Trade> trades, List<EquitySnapshot> equityCurve, double initialCapital) {
        return riskMetricsCalculator.calculateRiskMetrics(trades, equityCurve, initialCapital);
    }

    public StrategyResults calculateStrategyResults(List<Trade> trades, double initialCapital, double finalValue) {
        return riskMetricsCalculator.calculateStrategyResults(trades, initialCapital, finalValue);
    }

    /**
     * Drops regime history, trade outcomes and drawdown peaks of every session.
     */
    public void clearRegimeHistory() {
        sessionStore.clearAll();
    }

    public void clearRegimeHistory(String sessionKey) {
        sessionStore.clear(sessionKey);
    }

    public void clearIndicatorCache() {
        regimeClassifier.invalidate();
        indicatorSignalScorer.invalidate();
    }

    public void clearIndicatorCache(String seriesId) {
        regimeClassifier.invalidate(seriesId);
        indicatorSignalScorer.invalidate(seriesId);
    }

    /**
     * Records an outcome for callers that settle trades outside {@link #executeTrade}. Trades executed through
     * this facade with a session key are recorded automatically.
     */
    public void recordTradeResult(String sessionKey, boolean profitable) {
        if (sessionKey == null || sessionKey.isBlank()) {
            return;
        }
        sessionStore.getOrCreate(sessionKey).recordOutcome(profitable);
    }
}
