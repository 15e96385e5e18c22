package org.nowstart.tradecore.data.dto;

/**
 * Run summary over trade-to-trade portfolio value deltas.
 *
 * @param totalReturnPct return in percent of initial capital
 * @param totalReturn    absolute return in quote currency
 * @param winRatePct     winning trades over all trades, in percent
 * @param profitFactor   gross wins / gross losses, 999 with wins and no losses
 */
public record StrategyResults(
        double initialCapital,
        double finalValue,
        double totalReturnPct,
        double totalReturn,
        int tradeCount,
        int winCount,
        int lossCount,
        double winRatePct,
        double avgWin,
        double avgLoss,
        double profitFactor,
        double largestWin,
        double largestLoss
) {
}
