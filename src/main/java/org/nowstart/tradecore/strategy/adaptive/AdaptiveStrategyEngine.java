package org.nowstart.tradecore.strategy.adaptive;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.tradecore.data.dto.RegimeSignal;
import org.nowstart.tradecore.data.dto.TradingSignal;
import org.nowstart.tradecore.data.type.MarketRegime;
import org.nowstart.tradecore.data.type.TradeAction;
import org.nowstart.tradecore.indicator.IndicatorSignalScorer;
import org.nowstart.tradecore.indicator.IndicatorSignalScorer.BlendedSignal;
import org.nowstart.tradecore.indicator.TechnicalIndicators;
import org.nowstart.tradecore.regime.CachedRegimeClassifier;
import org.nowstart.tradecore.regime.MarketRegimeDetector;
import org.nowstart.tradecore.risk.RiskOverlay;
import org.nowstart.tradecore.risk.RiskOverlay.GateReadings;
import org.nowstart.tradecore.session.SessionState;
import org.nowstart.tradecore.session.SessionStore;
import org.nowstart.tradecore.strategy.config.AdaptiveStrategyConfig;
import org.nowstart.tradecore.strategy.config.StrategyConfig;
import org.nowstart.tradecore.strategy.core.PriceSeries;
import org.nowstart.tradecore.strategy.core.StrategyDiagnostic;
import org.nowstart.tradecore.strategy.core.StrategyInput;
import org.nowstart.tradecore.strategy.core.TradingStrategyEngine;
import org.springframework.stereotype.Component;

/**
 * Regime-aware strategy selection.
 *
 * <p>Per bar: classify the regime and append it to the session history, run the risk gates, then pick the
 * bullish strategy only when the bullish label has persisted, is confident and momentum confirms it. A confident,
 * persisted bearish label picks the bearish strategy; anything else falls back to the neutral strategy, or the
 * bearish one when no neutral strategy is configured.
 *
 * <p>Calls sharing a session key must be made in increasing bar order.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AdaptiveStrategyEngine implements TradingStrategyEngine<AdaptiveStrategyConfig> {

    public static final String VERSION = "adaptive";

    private static final double BULLISH_FLOOR_RATIO = 0.7;
    private static final double MAX_SIZE_MULTIPLIER = 2.0;

    private final CachedRegimeClassifier regimeClassifier;
    private final SessionStore sessionStore;
    private final RiskOverlay riskOverlay;
    private final IndicatorSignalScorer scorer;

    @Override
    public String version() {
        return VERSION;
    }

    @Override
    public Class<AdaptiveStrategyConfig> parameterType() {
        return AdaptiveStrategyConfig.class;
    }

    @Override
    public int requiredWarmupBars(AdaptiveStrategyConfig params) {
        int indicatorWarmup = Stream.of(params.bullishStrategy(), params.bearishStrategy(), params.neutralStrategy())
                .filter(strategy -> strategy != null)
                .flatMap(strategy -> strategy.indicators().stream())
                .mapToInt(IndicatorSignalScorer::warmupBars)
                .max()
                .orElse(0);
        return Math.max(MarketRegimeDetector.MIN_INDEX, indicatorWarmup);
    }

    @Override
    public TradingSignal evaluate(StrategyInput<AdaptiveStrategyConfig> input) {
        if (input == null || input.series() == null || input.params() == null) {
            throw new IllegalArgumentException("input, series, and params are required");
        }
        PriceSeries series = input.series();
        int index = input.signalIndex();
        if (index < 0 || index >= series.size()) {
            throw new IllegalArgumentException("signalIndex must be in [0, series.size()-1]");
        }

        AdaptiveStrategyConfig config = input.params();
        String sessionKey = resolveSessionKey(input.sessionKey(), series);
        SessionState session = sessionStore.getOrCreate(sessionKey);
        session.ensureRegimeCapacity(Math.max(config.regimePersistencePeriods(), config.whipsawDetectionPeriods() + 1));
        session.ensureOutcomeCapacity(config.circuitBreakerLookback());

        RegimeSignal regime = regimeClassifier.classify(series, index);
        session.appendRegime(regime.regime());

        GateReadings gates = riskOverlay.evaluate(config, session, series, index, regime, input.portfolioValue());
        if (gates.tripped()) {
            log.debug(
                    "Adaptive signal gated. session={}, series={}, index={}, holdReason={}, volatility={}, winRate={}, regimeChanges={}, drawdown={}",
                    sessionKey,
                    series.seriesId(),
                    index,
                    gates.holdReason(),
                    gates.volatility(),
                    gates.winRate(),
                    gates.regimeChanges(),
                    gates.drawdown()
            );
            return TradingSignal.builder()
                    .timestamp(series.bar(index).timestamp())
                    .signal(0.0)
                    .confidence(0.0)
                    .action(TradeAction.HOLD)
                    .activeStrategy(config.bearishStrategy())
                    .positionSizeMultiplier(1.0)
                    .momentumConfirmed(false)
                    .regime(regime)
                    .holdReason(gates.holdReason())
                    .diagnostics(diagnostics(regime, gates, false, false))
                    .build();
        }

        boolean persisted = isPersisted(session, regime.regime(), config.regimePersistencePeriods());
        boolean confident = regime.confidence() >= config.regimeConfidenceThreshold();
        boolean momentumConfirmed = regime.regime() == MarketRegime.BULLISH
                && regime.indicators().momentum() >= config.momentumConfirmationThreshold();

        StrategyConfig active;
        if (regime.regime() == MarketRegime.BULLISH && confident && persisted && momentumConfirmed) {
            active = config.bullishStrategy();
        } else if (regime.regime() == MarketRegime.BEARISH && confident && persisted) {
            active = config.bearishStrategy();
        } else {
            active = config.fallbackStrategy();
        }

        BlendedSignal blended = scorer.blend(active.indicators(), series, index);
        double signal = blended.signal();
        TradeAction action = IndicatorSignalScorer.resolveAction(signal, active);
        boolean bullishActive = active == config.bullishStrategy();
        double multiplier = bullishActive && config.dynamicPositionSizing()
                ? dynamicMultiplier(config, regime.confidence())
                : 1.0;

        log.debug(
                "Adaptive signal generated. session={}, series={}, index={}, regime={}, confidence={}, strategy={}, signal={}, action={}, multiplier={}",
                sessionKey,
                series.seriesId(),
                index,
                regime.regime(),
                regime.confidence(),
                active.name(),
                signal,
                action,
                multiplier
        );

        List<StrategyDiagnostic> diagnostics = diagnostics(regime, gates, persisted, momentumConfirmed);
        diagnostics.add(StrategyDiagnostic.text(
                "strategy.active",
                "Active Strategy",
                "Strategy selected for this bar",
                active.name()
        ));
        diagnostics.add(StrategyDiagnostic.number(
                "sizing.multiplier",
                "Position Size Multiplier",
                "",
                "Dynamic sizing multiplier applied to buys",
                multiplier
        ));

        return TradingSignal.builder()
                .timestamp(series.bar(index).timestamp())
                .signal(signal)
                .confidence(Math.min(1.0, Math.abs(signal)))
                .action(action)
                .activeStrategy(active)
                .positionSizeMultiplier(multiplier)
                .momentumConfirmed(momentumConfirmed)
                .regime(regime)
                .indicatorScores(blended.scores())
                .diagnostics(diagnostics)
                .build();
    }

    /**
     * Bullish position scaled between 70% of the base fraction and {@code maxBullishPosition} by regime
     * confidence, expressed relative to the base fraction.
     */
    static double dynamicMultiplier(AdaptiveStrategyConfig config, double regimeConfidence) {
        double base = config.bullishStrategy().maxPositionFraction();
        if (base <= 0.0) {
            return 1.0;
        }
        double max = config.maxBullishPosition();
        double floor = base * BULLISH_FLOOR_RATIO;
        double position = Math.min(max, floor + (regimeConfidence * (max - floor)));
        return TechnicalIndicators.clamp(position / base, 0.0, MAX_SIZE_MULTIPLIER);
    }

    static String resolveSessionKey(String sessionKey, PriceSeries series) {
        if (sessionKey == null || sessionKey.isBlank()) {
            return "series:" + series.seriesId();
        }
        return sessionKey;
    }

    private boolean isPersisted(SessionState session, MarketRegime current, int periods) {
        if (session.regimeCount() < periods) {
            return false;
        }
        return session.recentRegimes(periods).stream().allMatch(regime -> regime == current);
    }

    private List<StrategyDiagnostic> diagnostics(
            RegimeSignal regime,
            GateReadings gates,
            boolean persisted,
            boolean momentumConfirmed
    ) {
        List<StrategyDiagnostic> diagnostics = new ArrayList<>();
        diagnostics.add(StrategyDiagnostic.text("regime.label", "Regime", "Classified market regime", regime.regime().name()));
        diagnostics.add(StrategyDiagnostic.number("regime.confidence", "Regime Confidence", "", "Classifier confidence", regime.confidence()));
        diagnostics.add(StrategyDiagnostic.number("regime.trend", "Trend", "", "Trend sub-score", regime.indicators().trend()));
        diagnostics.add(StrategyDiagnostic.number("regime.momentum", "Momentum", "", "Momentum sub-score", regime.indicators().momentum()));
        diagnostics.add(StrategyDiagnostic.number("regime.volatility", "Volatility", "", "Volatility sub-score", regime.indicators().volatility()));
        diagnostics.add(StrategyDiagnostic.bool("regime.persisted", "Regime Persisted", "Label unchanged across the persistence window", persisted));
        diagnostics.add(StrategyDiagnostic.bool("momentum.confirmed", "Momentum Confirmed", "Bullish momentum above threshold", momentumConfirmed));
        diagnostics.add(StrategyDiagnostic.text("gate.hold_reason", "Hold Reason", "Risk gate that forced hold", gates.holdReason().name()));
        diagnostics.add(StrategyDiagnostic.number("gate.volatility", "Gate Volatility", "", "Reading compared against maxVolatility", gates.volatility()));
        diagnostics.add(StrategyDiagnostic.number("gate.regime_changes", "Regime Changes", "", "Label changes inside the whipsaw window", gates.regimeChanges()));
        diagnostics.add(StrategyDiagnostic.number("gate.drawdown", "Drawdown", "", "Fraction below session peak", gates.drawdown()));
        return diagnostics;
    }
}
