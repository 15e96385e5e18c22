package org.nowstart.tradecore.strategy.core;

/**
 * One evaluation request.
 *
 * @param series         price series
 * @param signalIndex    bar index being evaluated
 * @param sessionKey     session isolation key, may be null for stateless engines
 * @param portfolioValue current portfolio value, {@code NaN} when the caller does not track one
 * @param params         engine parameters
 */
public record StrategyInput<P extends StrategyParams>(
        PriceSeries series,
        int signalIndex,
        String sessionKey,
        double portfolioValue,
        P params
) {

    public StrategyInput(PriceSeries series, int signalIndex, P params) {
        this(series, signalIndex, null, Double.NaN, params);
    }

    public StrategyInput(PriceSeries series, int signalIndex, String sessionKey, P params) {
        this(series, signalIndex, sessionKey, Double.NaN, params);
    }
}
