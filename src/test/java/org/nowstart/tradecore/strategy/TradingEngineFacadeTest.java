package org.nowstart.tradecore.strategy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.nowstart.tradecore.Fixtures;
import org.nowstart.tradecore.data.dto.TradingSignal;
import org.nowstart.tradecore.data.model.ExecutionContext;
import org.nowstart.tradecore.data.model.Portfolio;
import org.nowstart.tradecore.data.type.TradeAction;
import org.nowstart.tradecore.indicator.IndicatorSignalScorer;
import org.nowstart.tradecore.regime.CachedRegimeClassifier;
import org.nowstart.tradecore.risk.RiskMetricsCalculator;
import org.nowstart.tradecore.service.TradeExecutionService;
import org.nowstart.tradecore.session.SessionState;
import org.nowstart.tradecore.session.SessionStore;
import org.nowstart.tradecore.strategy.config.AdaptiveStrategyConfig;
import org.nowstart.tradecore.strategy.config.StrategyConfig;
import org.nowstart.tradecore.strategy.core.PriceSeries;

@ExtendWith(MockitoExtension.class)
class TradingEngineFacadeTest {

    @Mock
    private StrategyRegistry strategyRegistry;
    @Mock
    private StrategyParamResolver strategyParamResolver;
    @Mock
    private TradeExecutionService tradeExecutionService;
    @Mock
    private RiskMetricsCalculator riskMetricsCalculator;
    @Mock
    private CachedRegimeClassifier regimeClassifier;
    @Mock
    private IndicatorSignalScorer indicatorSignalScorer;
    @Mock
    private SessionStore sessionStore;

    private final PriceSeries series = Fixtures.flat("eth", 10, 100);

    @Test
    void generateSignal_routesToSimpleEngine() {
        StrategyConfig config = Fixtures.bullish();
        TradingSignal expected = TradingSignal.builder().action(TradeAction.HOLD).build();
        when(strategyRegistry.evaluate(eq("simple"), eq(series), eq(5), isNull(), eq(Double.NaN), eq(config)))
                .thenReturn(expected);

        assertThat(facade().generateSignal(series, config, 5)).isSameAs(expected);
    }

    @Test
    void generateAdaptiveSignal_passesSessionAndPortfolioValue() {
        AdaptiveStrategyConfig config = Fixtures.adaptive();
        TradingSignal expected = TradingSignal.builder().action(TradeAction.BUY).build();
        when(strategyRegistry.evaluate("adaptive", series, 7, "s1", 1000.0, config)).thenReturn(expected);

        assertThat(facade().generateAdaptiveSignal(series, config, 7, "s1", 1000.0)).isSameAs(expected);
    }

    @Test
    void generateActiveSignal_usesResolvedVersionAndParams() {
        AdaptiveStrategyConfig config = Fixtures.adaptive();
        TradingSignal expected = TradingSignal.builder().build();
        when(strategyParamResolver.resolveActiveStrategyVersion()).thenReturn("adaptive");
        when(strategyParamResolver.resolve("adaptive")).thenReturn(config);
        when(strategyRegistry.evaluate(eq("adaptive"), eq(series), eq(3), eq("s1"), eq(Double.NaN), eq(config)))
                .thenReturn(expected);

        assertThat(facade().generateActiveSignal(series, 3, "s1")).isSameAs(expected);
    }

    @Test
    void executeTrade_delegatesToExecutor() {
        TradingSignal signal = TradingSignal.builder().action(TradeAction.HOLD).build();
        Portfolio portfolio = Portfolio.withCapital(1000);
        ExecutionContext context = ExecutionContext.of(series);

        facade().executeTrade(signal, 0.5, 100, portfolio, context);

        verify(tradeExecutionService).executeTrade(signal, 0.5, 100, portfolio, context);
    }

    @Test
    void clearRegimeHistory_clearsAllOrOneSession() {
        TradingEngineFacade facade = facade();

        facade.clearRegimeHistory();
        facade.clearRegimeHistory("s1");

        verify(sessionStore).clearAll();
        verify(sessionStore).clear("s1");
    }

    @Test
    void clearIndicatorCache_invalidatesClassifierAndScorer() {
        TradingEngineFacade facade = facade();

        facade.clearIndicatorCache();
        facade.clearIndicatorCache("eth");

        verify(regimeClassifier).invalidate();
        verify(regimeClassifier).invalidate("eth");
        verify(indicatorSignalScorer).invalidate();
        verify(indicatorSignalScorer).invalidate("eth");
    }

    @Test
    void recordTradeResult_appendsOutcomeToSession() {
        SessionState state = new SessionState(10, 20);
        when(sessionStore.getOrCreate("s1")).thenReturn(state);

        facade().recordTradeResult("s1", true);

        assertThat(state.recentOutcomes(1)).containsExactly(true);
    }

    @Test
    void recordTradeResult_ignoresBlankKey() {
        facade().recordTradeResult(" ", false);

        verifyNoInteractions(sessionStore);
    }

    private TradingEngineFacade facade() {
        return new TradingEngineFacade(
                strategyRegistry,
                strategyParamResolver,
                tradeExecutionService,
                riskMetricsCalculator,
                regimeClassifier,
                indicatorSignalScorer,
                sessionStore
        );
    }
}
