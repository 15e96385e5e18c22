package org.nowstart.tradecore.data.type;

public enum MarketRegime {
    BULLISH,
    BEARISH,
    NEUTRAL
}
