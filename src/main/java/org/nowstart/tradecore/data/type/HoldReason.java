package org.nowstart.tradecore.data.type;

/**
 * Risk gate that forced a hold, in evaluation order. {@link #NONE} means no gate fired.
 */
public enum HoldReason {
    NONE,
    HIGH_VOLATILITY,
    CIRCUIT_BREAKER,
    WHIPSAW,
    DRAWDOWN
}
