package org.nowstart.tradecore.strategy.core;

import java.time.Instant;

public record PriceBar(
        Instant timestamp,
        double open,
        double high,
        double low,
        double close,
        double volume
) {

    public PriceBar {
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp is required");
        }
    }

    public double typicalPrice() {
        return (high + low + close) / 3.0;
    }
}
