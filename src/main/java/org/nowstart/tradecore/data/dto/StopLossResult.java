package org.nowstart.tradecore.data.dto;

import org.nowstart.tradecore.data.type.ExitReason;

/**
 * @param shouldExit     whether the current price is at or below the stop
 * @param exitReason     set only when {@code shouldExit}
 * @param stopLossPrice  stop after this update, 0 when inactive
 * @param currentPrice   evaluated price
 * @param distanceToStop (price - stop) / price in percent, 0 when inactive
 */
public record StopLossResult(
        boolean shouldExit,
        ExitReason exitReason,
        double stopLossPrice,
        double currentPrice,
        double distanceToStop
) {

    public static StopLossResult inactive(double currentPrice) {
        return new StopLossResult(false, null, 0.0, currentPrice, 0.0);
    }
}
