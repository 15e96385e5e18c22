package org.nowstart.tradecore.risk;

import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.tradecore.data.dto.KellyCriterionResult;
import org.nowstart.tradecore.data.model.Trade;
import org.nowstart.tradecore.strategy.config.KellyConfig;
import org.springframework.stereotype.Component;

/**
 * Kelly-criterion sizing from realized sell P&amp;L.
 *
 * <p>{@code f* = (p * R - (1 - p)) / R} where {@code p} is the win rate and {@code R} the average win over the
 * average loss. Breakeven trades are ignored. With wins and no losses the win rate itself is used when it is
 * above one half.
 */
@Slf4j
@Component
public class KellyCriterionCalculator {

    private static final double MIN_MULTIPLIER = 0.1;

    /**
     * Returns {@code null} when fewer than {@code minTrades} sells with P&amp;L are available in the lookback
     * window, or when every analyzed trade broke even.
     */
    public KellyCriterionResult calculate(List<Trade> trades, KellyConfig config) {
        if (trades == null || config == null) {
            return null;
        }
        List<Trade> withPnl = trades.stream()
                .filter(Trade::isSell)
                .filter(Trade::hasPnl)
                .toList();
        List<Trade> recent = config.lookbackPeriod() > 0 && withPnl.size() > config.lookbackPeriod()
                ? withPnl.subList(withPnl.size() - config.lookbackPeriod(), withPnl.size())
                : withPnl;
        if (recent.size() < config.minTrades()) {
            return null;
        }

        int wins = 0;
        int losses = 0;
        double winSum = 0.0;
        double lossSum = 0.0;
        for (Trade trade : recent) {
            double pnl = trade.pnl();
            if (pnl > 0.0) {
                wins++;
                winSum += pnl;
            } else if (pnl < 0.0) {
                losses++;
                lossSum += Math.abs(pnl);
            }
        }
        int analyzed = wins + losses;
        if (analyzed == 0) {
            return null;
        }

        double winRate = wins / (double) analyzed;
        double averageWin = wins > 0 ? winSum / wins : 0.0;
        double averageLoss = losses > 0 ? lossSum / losses : 0.0;
        double winLossRatio = averageLoss > 0.0 ? averageWin / averageLoss : 0.0;

        double kelly = 0.0;
        if (winLossRatio > 0.0) {
            kelly = ((winRate * winLossRatio) - (1.0 - winRate)) / winLossRatio;
        } else if (winRate > 0.5 && averageLoss == 0.0) {
            kelly = winRate;
        }
        kelly = Math.max(0.0, Math.min(1.0, kelly));
        double fractional = kelly * config.fractionalMultiplier();

        log.debug(
                "Kelly computed. trades={}, winRate={}, winLossRatio={}, kelly={}, fractionalKelly={}",
                analyzed,
                winRate,
                winLossRatio,
                kelly,
                fractional
        );
        return new KellyCriterionResult(kelly, fractional, winRate, winLossRatio, averageWin, averageLoss, analyzed);
    }

    /**
     * Ratio of fractional Kelly to the strategy's base position fraction, clamped to
     * {@code [0.1, maxMultiplier]}. A missing result leaves sizing unchanged.
     */
    public double kellyMultiplier(KellyCriterionResult result, double basePositionFraction, KellyConfig config) {
        if (result == null || config == null || basePositionFraction <= 0.0) {
            return 1.0;
        }
        double multiplier = result.fractionalKelly() / basePositionFraction;
        return Math.max(MIN_MULTIPLIER, Math.min(config.maxMultiplier(), multiplier));
    }

    /**
     * Quote amount to commit: capital times fractional Kelly, capped at {@code maxPositionFraction}. Without a
     * result the cap alone applies.
     */
    public double optimalPositionSize(double capital, KellyCriterionResult result, double maxPositionFraction) {
        if (result == null) {
            return capital * maxPositionFraction;
        }
        return capital * Math.min(result.fractionalKelly(), maxPositionFraction);
    }
}
