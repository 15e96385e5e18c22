package org.nowstart.tradecore.data.type;

/**
 * Measure compared against {@code maxVolatility} by the volatility gate.
 */
public enum VolatilitySource {
    // standard deviation of 20-bar close-to-close returns, e.g. 0.05 = 5% per bar
    RETURN_STD_DEV,
    // normalized volatility indicator of the regime classifier, in [0, 1]
    REGIME_INDEX
}
