package org.nowstart.tradecore.data.dto;

import java.time.Instant;

/**
 * One point of the equity curve.
 */
public record EquitySnapshot(
        Instant timestamp,
        double quoteBalance,
        double baseBalance,
        double totalValue,
        double price
) {

    public EquitySnapshot {
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp is required");
        }
    }
}
