package org.nowstart.tradecore.data.dto;

/**
 * @param kellyPercentage full Kelly fraction in [0, 1]
 * @param fractionalKelly full Kelly scaled by the configured fractional multiplier
 * @param winRate         wins / (wins + losses), breakeven trades excluded
 * @param winLossRatio    average win / average loss, 0 without losses
 * @param averageWin      mean winning P&amp;L
 * @param averageLoss     mean absolute losing P&amp;L
 * @param tradeCount      wins + losses analyzed
 */
public record KellyCriterionResult(
        double kellyPercentage,
        double fractionalKelly,
        double winRate,
        double winLossRatio,
        double averageWin,
        double averageLoss,
        int tradeCount
) {
}
