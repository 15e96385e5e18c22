package org.nowstart.tradecore.data.dto;

/**
 * Scalar performance report. Returns are percentages; drawdowns are percentages of the running peak.
 * Unbounded ratios are capped at {@code 999} so every field stays finite and serializable.
 */
public record RiskMetrics(
        double sharpeRatio,
        double sortinoRatio,
        double maxDrawdown,
        double maxDrawdownDuration,
        double volatility,
        double calmarRatio,
        double omegaRatio,
        double ulcerIndex,
        double winLossRatio,
        double expectancy
) {
}
