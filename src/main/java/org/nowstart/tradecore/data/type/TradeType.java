package org.nowstart.tradecore.data.type;

public enum TradeType {
    BUY,
    SELL
}
