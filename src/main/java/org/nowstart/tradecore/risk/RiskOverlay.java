package org.nowstart.tradecore.risk;

import java.util.List;
import org.nowstart.tradecore.data.dto.RegimeSignal;
import org.nowstart.tradecore.data.type.HoldReason;
import org.nowstart.tradecore.data.type.MarketRegime;
import org.nowstart.tradecore.data.type.VolatilitySource;
import org.nowstart.tradecore.indicator.TechnicalIndicators;
import org.nowstart.tradecore.session.SessionState;
import org.nowstart.tradecore.strategy.config.AdaptiveStrategyConfig;
import org.nowstart.tradecore.strategy.core.PriceSeries;
import org.springframework.stereotype.Component;

/**
 * Risk gates evaluated before strategy selection, in order: volatility filter, circuit breaker, whipsaw
 * detector, drawdown breaker. The first gate that trips forces a hold.
 */
@Component
public class RiskOverlay {

    static final int CIRCUIT_BREAKER_MIN_OUTCOMES = 5;
    static final int RETURN_STD_DEV_PERIOD = 20;

    public GateReadings evaluate(
            AdaptiveStrategyConfig config,
            SessionState session,
            PriceSeries series,
            int index,
            RegimeSignal regime,
            double portfolioValue
    ) {
        double volatility = config.volatilitySource() == VolatilitySource.REGIME_INDEX
                ? regime.indicators().volatility()
                : TechnicalIndicators.returnStdDev(series.closes(), index, RETURN_STD_DEV_PERIOD);
        double winRate = recentWinRate(session, config.circuitBreakerLookback());
        int regimeChanges = regimeChanges(session, config.whipsawDetectionPeriods());
        double drawdown = drawdown(session, portfolioValue);

        HoldReason reason = HoldReason.NONE;
        if (volatility > config.maxVolatility()) {
            reason = HoldReason.HIGH_VOLATILITY;
        } else if (Double.isFinite(winRate) && winRate < config.circuitBreakerWinRate()) {
            reason = HoldReason.CIRCUIT_BREAKER;
        } else if (regimeChanges >= config.whipsawMaxChanges()) {
            reason = HoldReason.WHIPSAW;
        } else if (drawdown >= config.maxDrawdownThreshold()) {
            reason = HoldReason.DRAWDOWN;
        }
        return new GateReadings(reason, volatility, winRate, regimeChanges, drawdown);
    }

    /**
     * Win rate over the last {@code lookback} outcomes, {@code NaN} until enough outcomes are recorded.
     */
    double recentWinRate(SessionState session, int lookback) {
        if (session.outcomeCount() < CIRCUIT_BREAKER_MIN_OUTCOMES) {
            return Double.NaN;
        }
        List<Boolean> recent = session.recentOutcomes(lookback);
        long wins = recent.stream().filter(Boolean::booleanValue).count();
        return wins / (double) recent.size();
    }

    /**
     * Label changes across the last {@code periods} transitions of the regime history; 0 while the history is
     * shorter than that window.
     */
    int regimeChanges(SessionState session, int periods) {
        if (session.regimeCount() < periods + 1) {
            return 0;
        }
        List<MarketRegime> recent = session.recentRegimes(periods + 1);
        int changes = 0;
        for (int i = 1; i < recent.size(); i++) {
            if (recent.get(i) != recent.get(i - 1)) {
                changes++;
            }
        }
        return changes;
    }

    private double drawdown(SessionState session, double portfolioValue) {
        if (!Double.isFinite(portfolioValue)) {
            return 0.0;
        }
        double peak = session.updatePeak(portfolioValue);
        if (peak <= 0.0 || portfolioValue >= peak) {
            return 0.0;
        }
        return (peak - portfolioValue) / peak;
    }

    /**
     * @param holdReason    first gate that tripped, {@link HoldReason#NONE} otherwise
     * @param volatility    reading compared against {@code maxVolatility}
     * @param winRate       recent win rate, {@code NaN} before the circuit breaker is armed
     * @param regimeChanges label changes inside the whipsaw window
     * @param drawdown      fraction below the session peak, 0 when no portfolio value was reported
     */
    public record GateReadings(
            HoldReason holdReason,
            double volatility,
            double winRate,
            int regimeChanges,
            double drawdown
    ) {

        public boolean tripped() {
            return holdReason != HoldReason.NONE;
        }
    }
}
