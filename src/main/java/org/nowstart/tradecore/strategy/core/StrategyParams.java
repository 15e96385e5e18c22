package org.nowstart.tradecore.strategy.core;

/**
 * Marker for parameter objects consumed by a {@link TradingStrategyEngine}.
 */
public interface StrategyParams {
}
