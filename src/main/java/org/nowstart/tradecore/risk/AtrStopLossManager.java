package org.nowstart.tradecore.risk;

import java.util.ArrayList;
import java.util.List;
import org.nowstart.tradecore.data.dto.StopLossCheck;
import org.nowstart.tradecore.data.dto.StopLossResult;
import org.nowstart.tradecore.data.model.OpenPosition;
import org.nowstart.tradecore.data.model.Trade;
import org.nowstart.tradecore.data.type.ExitReason;
import org.nowstart.tradecore.strategy.config.StopLossConfig;
import org.springframework.stereotype.Component;

/**
 * ATR-based stop-loss. The stop sits {@code atrMultiplier} ATRs below entry and, when trailing, follows the
 * highest observed price upward without ever moving down.
 */
@Component
public class AtrStopLossManager {

    public double calculateStopLossPrice(double entryPrice, double atr, StopLossConfig config) {
        if (config == null || !config.enabled() || !(atr > 0.0)) {
            return 0.0;
        }
        return entryPrice - (atr * config.atrMultiplier());
    }

    /**
     * Starts tracking a buy. Returns {@code null} when stops are disabled or ATR is unavailable.
     */
    public OpenPosition createOpenPosition(Trade buyTrade, double atr, StopLossConfig config) {
        if (config == null || !config.enabled() || !(atr > 0.0)) {
            return null;
        }
        double stop = calculateStopLossPrice(buyTrade.price(), atr, config);
        return new OpenPosition(buyTrade, buyTrade.price(), stop, atr);
    }

    /**
     * Observes {@code currentPrice}, trails the stop when configured, and reports whether the stop was hit.
     */
    public StopLossResult updateStopLoss(OpenPosition position, double currentPrice, double currentAtr, StopLossConfig config) {
        if (position == null || config == null || !config.enabled()) {
            return StopLossResult.inactive(currentPrice);
        }
        position.observePrice(currentPrice);
        if (config.trailing() && currentAtr > 0.0) {
            position.raiseStop(position.getHighestPrice() - (currentAtr * config.atrMultiplier()));
        }

        double stop = position.getStopLossPrice();
        boolean shouldExit = stop > 0.0 && currentPrice <= stop;
        ExitReason reason = null;
        if (shouldExit) {
            reason = position.isTrailed() ? ExitReason.TRAILING_STOP : ExitReason.STOP_LOSS;
        }
        double distance = stop > 0.0 && currentPrice > 0.0 ? ((currentPrice - stop) / currentPrice) * 100.0 : 0.0;
        return new StopLossResult(shouldExit, reason, stop, currentPrice, distance);
    }

    public List<StopLossCheck> checkStopLosses(
            List<OpenPosition> positions,
            double currentPrice,
            double currentAtr,
            StopLossConfig config
    ) {
        List<StopLossCheck> checks = new ArrayList<>(positions.size());
        for (OpenPosition position : positions) {
            checks.add(new StopLossCheck(position, updateStopLoss(position, currentPrice, currentAtr, config)));
        }
        return checks;
    }
}
