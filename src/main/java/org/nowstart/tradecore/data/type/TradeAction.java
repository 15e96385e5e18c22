package org.nowstart.tradecore.data.type;

public enum TradeAction {
    BUY,
    SELL,
    HOLD
}
