package org.nowstart.tradecore.data.model;

import lombok.Getter;

/**
 * Stop-loss tracking state for one buy lot. Mutated on every bar while the lot is open.
 */
@Getter
public class OpenPosition {

    private final Trade buyTrade;
    private final double entryPrice;
    private final double atrAtEntry;
    private double stopLossPrice;
    private double highestPrice;
    private boolean trailed;

    public OpenPosition(Trade buyTrade, double entryPrice, double stopLossPrice, double atrAtEntry) {
        if (buyTrade == null) {
            throw new IllegalArgumentException("buyTrade is required");
        }
        this.buyTrade = buyTrade;
        this.entryPrice = entryPrice;
        this.stopLossPrice = stopLossPrice;
        this.highestPrice = entryPrice;
        this.atrAtEntry = atrAtEntry;
    }

    public String tradeId() {
        return buyTrade.id();
    }

    public void observePrice(double price) {
        if (price > highestPrice) {
            highestPrice = price;
        }
    }

    /**
     * Raises the stop to {@code candidate} if it is higher. The stop never moves down.
     *
     * @return true when the stop moved
     */
    public boolean raiseStop(double candidate) {
        if (!(candidate > stopLossPrice)) {
            return false;
        }
        stopLossPrice = candidate;
        trailed = true;
        return true;
    }
}
