package org.nowstart.tradecore.data.model;

import lombok.Getter;
import lombok.ToString;

/**
 * Quote/base ledger for one session.
 *
 * <p>Not thread-safe. A portfolio is exclusively owned by the caller driving one session and is mutated only by
 * the trade executor for that session. Total value is always recomputed from balances and the current price.
 */
@Getter
@ToString
public class Portfolio {

    private final double initialCapital;
    private double quoteBalance;
    private double baseBalance;
    private double totalValue;
    private double totalReturn;
    private int tradeCount;
    private int winCount;

    public Portfolio(double initialCapital, double quoteBalance, double baseBalance, double price) {
        if (!Double.isFinite(initialCapital) || initialCapital <= 0.0) {
            throw new IllegalArgumentException("initialCapital must be > 0");
        }
        this.initialCapital = initialCapital;
        this.quoteBalance = quoteBalance;
        this.baseBalance = baseBalance;
        markToMarket(price);
    }

    public static Portfolio withCapital(double initialCapital) {
        return new Portfolio(initialCapital, initialCapital, 0.0, 0.0);
    }

    public void applyBuy(double totalCost, double amount, double price) {
        quoteBalance -= totalCost;
        baseBalance += amount;
        tradeCount++;
        markToMarket(price);
    }

    public void applySell(double amount, double netProceeds, double price, boolean profitable) {
        baseBalance -= amount;
        quoteBalance += netProceeds;
        tradeCount++;
        if (profitable) {
            winCount++;
        }
        markToMarket(price);
    }

    public void markToMarket(double price) {
        totalValue = quoteBalance + baseBalance * price;
        totalReturn = totalValue - initialCapital;
    }
}
