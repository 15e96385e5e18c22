package org.nowstart.tradecore.data.model;

import java.time.Instant;
import lombok.Builder;
import org.nowstart.tradecore.data.type.ExitReason;
import org.nowstart.tradecore.data.type.TradeType;

/**
 * Append-only ledger entry.
 *
 * @param quoteAmount         gross notional (amount x price), fees excluded
 * @param portfolioValueAfter portfolio total value right after the trade
 * @param costBasis           buys: notional plus fee; sells: FIFO cost basis of the consumed lots
 * @param pnl                 realized P&amp;L, sells only
 * @param exitReason          set when a stop-loss closed the position
 */
@Builder
public record Trade(
        String id,
        Instant timestamp,
        TradeType type,
        double price,
        double amount,
        double quoteAmount,
        double signal,
        double confidence,
        double portfolioValueAfter,
        Double costBasis,
        Double pnl,
        ExitReason exitReason
) {

    public Trade {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id is required");
        }
        if (type == null) {
            throw new IllegalArgumentException("type is required");
        }
    }

    public boolean isSell() {
        return type == TradeType.SELL;
    }

    public boolean hasPnl() {
        return pnl != null && Double.isFinite(pnl);
    }
}
