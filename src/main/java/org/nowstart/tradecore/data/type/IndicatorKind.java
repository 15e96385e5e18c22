package org.nowstart.tradecore.data.type;

import java.util.Locale;

public enum IndicatorKind {
    SMA,
    EMA,
    MACD,
    RSI,
    BOLLINGER,
    VWAP,
    OBV,
    VWMACD;

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
