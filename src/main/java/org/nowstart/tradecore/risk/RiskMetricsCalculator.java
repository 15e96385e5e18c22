package org.nowstart.tradecore.risk;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.nowstart.tradecore.data.dto.EquitySnapshot;
import org.nowstart.tradecore.data.dto.RiskMetrics;
import org.nowstart.tradecore.data.dto.StrategyResults;
import org.nowstart.tradecore.data.model.Trade;
import org.springframework.stereotype.Component;

/**
 * Performance and risk report over a trade ledger and an equity curve.
 *
 * <p>Returns are percentage changes between consecutive snapshots. Standard deviations are population
 * deviations with a zero risk-free rate. Ratios without a denominator resolve to {@link #UNBOUNDED} or 0 so
 * every value stays finite. Empty and single-point inputs produce zeros.
 */
@Component
public class RiskMetricsCalculator {

    public static final double UNBOUNDED = 999.0;

    private static final double DRAWDOWN_PROXIMITY = 0.99;
    private static final double DAYS_PER_YEAR = 365.0;
    private static final double MILLIS_PER_DAY = 24.0 * 60.0 * 60.0 * 1000.0;

    public RiskMetrics calculateRiskMetrics(List<Trade> trades, List<EquitySnapshot> equityCurve, double initialCapital) {
        List<Trade> ledger = trades == null ? List.of() : trades;
        List<EquitySnapshot> curve = equityCurve == null ? List.of() : equityCurve;

        double[] periodReturns = returnsBetweenSnapshots(curve);
        double[] capitalReturns = returnsFromCapital(curve, initialCapital);

        double maxDrawdown = maxDrawdown(curve);
        PnlSplit split = PnlSplit.of(ledger, initialCapital);

        return new RiskMetrics(
                sharpe(periodReturns),
                sortino(periodReturns),
                maxDrawdown,
                maxDrawdownDuration(curve, maxDrawdown),
                populationStdDev(periodReturns),
                calmar(capitalReturns, maxDrawdown),
                omega(periodReturns),
                ulcerIndex(curve),
                split.winLossRatio(),
                split.expectancy(ledger.size())
        );
    }

    /**
     * Summary over trade-to-trade portfolio value deltas, starting from {@code initialCapital}.
     */
    public StrategyResults calculateStrategyResults(List<Trade> trades, double initialCapital, double finalValue) {
        List<Trade> ledger = trades == null ? List.of() : trades;
        PnlSplit split = PnlSplit.of(ledger, initialCapital);
        double totalWins = split.sum(split.wins());
        double totalLosses = split.sum(split.losses());

        double profitFactor;
        if (totalLosses > 0.0) {
            profitFactor = totalWins / totalLosses;
        } else {
            profitFactor = totalWins > 0.0 ? UNBOUNDED : 0.0;
        }

        return new StrategyResults(
                initialCapital,
                finalValue,
                initialCapital > 0.0 ? ((finalValue - initialCapital) / initialCapital) * 100.0 : 0.0,
                finalValue - initialCapital,
                ledger.size(),
                split.wins().size(),
                split.losses().size(),
                ledger.isEmpty() ? 0.0 : (split.wins().size() / (double) ledger.size()) * 100.0,
                split.averageWin(),
                split.averageLoss(),
                profitFactor,
                split.wins().stream().mapToDouble(Double::doubleValue).max().orElse(0.0),
                split.losses().stream().mapToDouble(Double::doubleValue).max().orElse(0.0)
        );
    }

    private double[] returnsBetweenSnapshots(List<EquitySnapshot> curve) {
        if (curve.size() < 2) {
            return new double[0];
        }
        List<Double> returns = new ArrayList<>(curve.size() - 1);
        for (int i = 1; i < curve.size(); i++) {
            double previous = curve.get(i - 1).totalValue();
            if (previous > 0.0) {
                returns.add(((curve.get(i).totalValue() - previous) / previous) * 100.0);
            }
        }
        return returns.stream().mapToDouble(Double::doubleValue).toArray();
    }

    private double[] returnsFromCapital(List<EquitySnapshot> curve, double initialCapital) {
        List<Double> returns = new ArrayList<>(curve.size());
        double previous = initialCapital;
        for (EquitySnapshot snapshot : curve) {
            if (previous > 0.0) {
                returns.add(((snapshot.totalValue() - previous) / previous) * 100.0);
            }
            previous = snapshot.totalValue();
        }
        return returns.stream().mapToDouble(Double::doubleValue).toArray();
    }

    private double sharpe(double[] returns) {
        if (returns.length == 0) {
            return 0.0;
        }
        double stdDev = populationStdDev(returns);
        return stdDev == 0.0 ? 0.0 : mean(returns) / stdDev;
    }

    private double sortino(double[] returns) {
        if (returns.length == 0) {
            return 0.0;
        }
        double mean = mean(returns);
        double squares = 0.0;
        int downside = 0;
        for (double value : returns) {
            if (value < 0.0) {
                squares += value * value;
                downside++;
            }
        }
        double downsideDeviation = downside == 0 ? 0.0 : Math.sqrt(squares / downside);
        if (downsideDeviation == 0.0) {
            return mean > 0.0 ? UNBOUNDED : 0.0;
        }
        return mean / downsideDeviation;
    }

    private double maxDrawdown(List<EquitySnapshot> curve) {
        if (curve.isEmpty()) {
            return 0.0;
        }
        double peak = curve.get(0).totalValue();
        double maxDrawdown = 0.0;
        for (EquitySnapshot snapshot : curve) {
            peak = Math.max(peak, snapshot.totalValue());
            maxDrawdown = Math.max(maxDrawdown, drawdownPct(peak, snapshot.totalValue()));
        }
        return maxDrawdown;
    }

    /**
     * Longest stretch, in whole days, during which drawdown stays within 1% of the maximum. A stretch is measured
     * from the timestamp of the peak it falls from.
     */
    private double maxDrawdownDuration(List<EquitySnapshot> curve, double maxDrawdown) {
        if (curve.isEmpty() || maxDrawdown == 0.0) {
            return 0.0;
        }
        double peak = curve.get(0).totalValue();
        Instant peakAt = curve.get(0).timestamp();
        Instant stretchStart = null;
        double longestDays = 0.0;
        for (EquitySnapshot snapshot : curve) {
            if (snapshot.totalValue() > peak) {
                peak = snapshot.totalValue();
                peakAt = snapshot.timestamp();
                stretchStart = null;
            }
            if (drawdownPct(peak, snapshot.totalValue()) >= maxDrawdown * DRAWDOWN_PROXIMITY) {
                if (stretchStart == null) {
                    stretchStart = peakAt;
                }
                double days = Duration.between(stretchStart, snapshot.timestamp()).toMillis() / MILLIS_PER_DAY;
                longestDays = Math.max(longestDays, days);
            } else {
                stretchStart = null;
            }
        }
        return Math.round(longestDays);
    }

    private double calmar(double[] returns, double maxDrawdown) {
        if (returns.length == 0 || maxDrawdown == 0.0) {
            return 0.0;
        }
        return (mean(returns) * DAYS_PER_YEAR) / maxDrawdown;
    }

    private double omega(double[] returns) {
        if (returns.length == 0) {
            return 0.0;
        }
        double gains = 0.0;
        double losses = 0.0;
        for (double value : returns) {
            if (value > 0.0) {
                gains += value;
            } else {
                losses += Math.abs(value);
            }
        }
        if (losses == 0.0) {
            return gains > 0.0 ? UNBOUNDED : 1.0;
        }
        return gains / losses;
    }

    private double ulcerIndex(List<EquitySnapshot> curve) {
        if (curve.isEmpty()) {
            return 0.0;
        }
        double peak = curve.get(0).totalValue();
        double squares = 0.0;
        for (EquitySnapshot snapshot : curve) {
            peak = Math.max(peak, snapshot.totalValue());
            double drawdown = drawdownPct(peak, snapshot.totalValue());
            squares += drawdown * drawdown;
        }
        return Math.sqrt(squares / curve.size());
    }

    private static double drawdownPct(double peak, double value) {
        return peak > 0.0 ? ((peak - value) / peak) * 100.0 : 0.0;
    }

    private static double mean(double[] values) {
        double sum = 0.0;
        for (double value : values) {
            sum += value;
        }
        return values.length == 0 ? 0.0 : sum / values.length;
    }

    private static double populationStdDev(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        double mean = mean(values);
        double variance = 0.0;
        for (double value : values) {
            variance += (value - mean) * (value - mean);
        }
        return Math.sqrt(variance / values.length);
    }

    private record PnlSplit(List<Double> wins, List<Double> losses) {

        private static PnlSplit of(List<Trade> trades, double initialCapital) {
            List<Double> wins = new ArrayList<>();
            List<Double> losses = new ArrayList<>();
            double previous = initialCapital;
            for (Trade trade : trades) {
                double delta = trade.portfolioValueAfter() - previous;
                if (delta > 0.0) {
                    wins.add(delta);
                } else if (delta < 0.0) {
                    losses.add(Math.abs(delta));
                }
                previous = trade.portfolioValueAfter();
            }
            return new PnlSplit(wins, losses);
        }

        private double sum(List<Double> values) {
            return values.stream().mapToDouble(Double::doubleValue).sum();
        }

        private double averageWin() {
            return wins.isEmpty() ? 0.0 : sum(wins) / wins.size();
        }

        private double averageLoss() {
            return losses.isEmpty() ? 0.0 : sum(losses) / losses.size();
        }

        private double winLossRatio() {
            double averageLoss = averageLoss();
            if (averageLoss == 0.0) {
                return averageWin() > 0.0 ? UNBOUNDED : 0.0;
            }
            return averageWin() / averageLoss;
        }

        private double expectancy(int tradeCount) {
            if (tradeCount == 0) {
                return 0.0;
            }
            double winRate = wins.size() / (double) tradeCount;
            double lossRate = losses.size() / (double) tradeCount;
            return (winRate * averageWin()) - (lossRate * averageLoss());
        }
    }
}
