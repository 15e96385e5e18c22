package org.nowstart.tradecore.data.dto;

/**
 * Regime sub-scores.
 *
 * @param trend      directional slope measure in [-1, 1]
 * @param momentum   short-term rate-of-change measure in [-1, 1]
 * @param volatility normalized recent dispersion in [0, 1]
 */
public record RegimeIndicators(
        double trend,
        double momentum,
        double volatility
) {

    public static final RegimeIndicators ZERO = new RegimeIndicators(0.0, 0.0, 0.0);
}
