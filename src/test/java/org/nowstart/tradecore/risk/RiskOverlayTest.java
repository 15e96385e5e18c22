package org.nowstart.tradecore.risk;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;
import org.nowstart.tradecore.Fixtures;
import org.nowstart.tradecore.data.dto.RegimeIndicators;
import org.nowstart.tradecore.data.dto.RegimeSignal;
import org.nowstart.tradecore.data.type.HoldReason;
import org.nowstart.tradecore.data.type.MarketRegime;
import org.nowstart.tradecore.data.type.VolatilitySource;
import org.nowstart.tradecore.session.SessionState;
import org.nowstart.tradecore.strategy.config.AdaptiveStrategyConfig;
import org.nowstart.tradecore.strategy.core.PriceSeries;

class RiskOverlayTest {

    private final RiskOverlay overlay = new RiskOverlay();
    private final AdaptiveStrategyConfig config = Fixtures.adaptive();
    private final PriceSeries calm = Fixtures.flat("calm", 60, 100);

    @Test
    void evaluate_passesQuietSession() {
        RiskOverlay.GateReadings readings = overlay.evaluate(config, new SessionState(10, 20), calm, 59, RegimeSignal.NEUTRAL, 1000);

        assertThat(readings.tripped()).isFalse();
        assertThat(readings.holdReason()).isEqualTo(HoldReason.NONE);
        assertThat(readings.winRate()).isNaN();
    }

    @Test
    void evaluate_tripsVolatilityFilterFirst() {
        double[] closes = new double[60];
        for (int i = 0; i < closes.length; i++) {
            closes[i] = i % 2 == 0 ? 100 : 120;
        }
        SessionState session = losingSession();

        RiskOverlay.GateReadings readings = overlay.evaluate(
                config, session, Fixtures.series("choppy", closes), 59, RegimeSignal.NEUTRAL, 1000);

        assertThat(readings.holdReason()).isEqualTo(HoldReason.HIGH_VOLATILITY);
        assertThat(readings.volatility()).isGreaterThan(0.05);
    }

    @Test
    void evaluate_readsRegimeVolatilityWhenConfigured() {
        AdaptiveStrategyConfig regimeSourced = config.toBuilder()
                .volatilitySource(VolatilitySource.REGIME_INDEX)
                .maxVolatility(0.5)
                .build();
        RegimeSignal regime = new RegimeSignal(MarketRegime.BULLISH, 0.8, new RegimeIndicators(0.5, 0.5, 0.6));

        RiskOverlay.GateReadings readings = overlay.evaluate(regimeSourced, new SessionState(10, 20), calm, 59, regime, 1000);

        assertThat(readings.holdReason()).isEqualTo(HoldReason.HIGH_VOLATILITY);
        assertThat(readings.volatility()).isEqualTo(0.6);
    }

    @Test
    void evaluate_armsCircuitBreakerAfterFiveOutcomes() {
        SessionState session = new SessionState(10, 20);
        for (int i = 0; i < 4; i++) {
            session.recordOutcome(false);
        }

        assertThat(overlay.evaluate(config, session, calm, 59, RegimeSignal.NEUTRAL, 1000).holdReason())
                .isEqualTo(HoldReason.NONE);

        session.recordOutcome(false);

        RiskOverlay.GateReadings readings = overlay.evaluate(config, session, calm, 59, RegimeSignal.NEUTRAL, 1000);
        assertThat(readings.holdReason()).isEqualTo(HoldReason.CIRCUIT_BREAKER);
        assertThat(readings.winRate()).isZero();
    }

    @Test
    void evaluate_detectsWhipsawOverWindow() {
        SessionState session = new SessionState(10, 20);
        MarketRegime[] labels = {
                MarketRegime.BULLISH, MarketRegime.BEARISH, MarketRegime.BULLISH,
                MarketRegime.BEARISH, MarketRegime.BULLISH, MarketRegime.BEARISH
        };
        for (MarketRegime label : labels) {
            session.appendRegime(label);
        }

        RiskOverlay.GateReadings readings = overlay.evaluate(config, session, calm, 59, RegimeSignal.NEUTRAL, 1000);

        assertThat(readings.regimeChanges()).isEqualTo(5);
        assertThat(readings.holdReason()).isEqualTo(HoldReason.WHIPSAW);
    }

    @Test
    void regimeChanges_isZeroWhileHistoryIsShort() {
        SessionState session = new SessionState(10, 20);
        session.appendRegime(MarketRegime.BULLISH);
        session.appendRegime(MarketRegime.BEARISH);

        assertThat(overlay.regimeChanges(session, 5)).isZero();
    }

    @Test
    void evaluate_tripsDrawdownAgainstSessionPeak() {
        SessionState session = new SessionState(10, 20);
        overlay.evaluate(config, session, calm, 59, RegimeSignal.NEUTRAL, 1000);

        RiskOverlay.GateReadings readings = overlay.evaluate(config, session, calm, 59, RegimeSignal.NEUTRAL, 700);

        assertThat(readings.holdReason()).isEqualTo(HoldReason.DRAWDOWN);
        assertThat(readings.drawdown()).isCloseTo(0.3, within(1e-12));
    }

    @Test
    void evaluate_ignoresMissingPortfolioValue() {
        SessionState session = new SessionState(10, 20);
        session.updatePeak(1000);

        RiskOverlay.GateReadings readings = overlay.evaluate(config, session, calm, 59, RegimeSignal.NEUTRAL, Double.NaN);

        assertThat(readings.drawdown()).isZero();
        assertThat(session.peakPortfolioValue()).isEqualTo(1000);
    }

    private SessionState losingSession() {
        SessionState session = new SessionState(10, 20);
        for (int i = 0; i < 5; i++) {
            session.recordOutcome(false);
        }
        return session;
    }
}
