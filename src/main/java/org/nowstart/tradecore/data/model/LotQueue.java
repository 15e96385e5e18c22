package org.nowstart.tradecore.data.model;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * FIFO queue of open buy lots kept as an arena with a head index.
 *
 * <p>Lots are appended on buys and consumed oldest-first on sells, with partial consumption. A stop-loss exit
 * may close one specific lot out of order; its slot stays in the arena with nothing remaining and is skipped.
 * Fully consumed slots before the head are compacted away once they dominate the arena.
 */
public class LotQueue {

    private static final double EPSILON = 1e-12;
    private static final int COMPACT_THRESHOLD = 64;

    private final List<Lot> arena = new ArrayList<>();
    private final Map<String, Integer> indexByTradeId = new HashMap<>();
    private int head;

    public void add(Trade buyTrade) {
        if (buyTrade == null || buyTrade.isSell()) {
            throw new IllegalArgumentException("buy trade is required");
        }
        double costBasis = buyTrade.costBasis() == null ? buyTrade.quoteAmount() : buyTrade.costBasis();
        indexByTradeId.put(buyTrade.id(), arena.size());
        arena.add(new Lot(buyTrade.id(), buyTrade.amount(), costBasis));
    }

    /**
     * Consumes up to {@code amount} units oldest-first.
     */
    public LotConsumption consume(double amount) {
        double matched = 0.0;
        double costBasis = 0.0;
        List<String> closed = new ArrayList<>();
        int cursor = head;
        while (cursor < arena.size() && amount - matched > EPSILON) {
            Lot lot = arena.get(cursor);
            if (lot.remaining > EPSILON) {
                double used = Math.min(lot.remaining, amount - matched);
                costBasis += lot.costBasis * (used / lot.amount);
                matched += used;
                lot.remaining -= used;
                if (lot.remaining <= EPSILON) {
                    lot.remaining = 0.0;
                    closed.add(lot.tradeId);
                }
            }
            if (lot.remaining == 0.0 && cursor == head) {
                head++;
            }
            cursor++;
        }
        compactIfNeeded();
        return new LotConsumption(matched, costBasis, List.copyOf(closed));
    }

    /**
     * Consumes whatever remains of one lot, regardless of its queue position.
     */
    public LotConsumption consumeLot(String tradeId) {
        Integer index = indexByTradeId.get(tradeId);
        if (index == null) {
            return LotConsumption.EMPTY;
        }
        Lot lot = arena.get(index);
        if (lot.remaining <= EPSILON) {
            return LotConsumption.EMPTY;
        }
        double used = lot.remaining;
        double costBasis = lot.costBasis * (used / lot.amount);
        lot.remaining = 0.0;
        while (head < arena.size() && arena.get(head).remaining == 0.0) {
            head++;
        }
        compactIfNeeded();
        return new LotConsumption(used, costBasis, List.of(lot.tradeId));
    }

    public double openAmount() {
        double total = 0.0;
        for (int i = head; i < arena.size(); i++) {
            total += arena.get(i).remaining;
        }
        return total;
    }

    public double remaining(String tradeId) {
        Integer index = indexByTradeId.get(tradeId);
        return index == null ? 0.0 : arena.get(index).remaining;
    }

    public boolean isEmpty() {
        return openAmount() <= EPSILON;
    }

    private void compactIfNeeded() {
        if (head < COMPACT_THRESHOLD || head * 2 < arena.size()) {
            return;
        }
        List<Lot> live = new ArrayList<>(arena.subList(head, arena.size()));
        arena.clear();
        indexByTradeId.clear();
        head = 0;
        for (Lot lot : live) {
            if (lot.remaining > 0.0) {
                indexByTradeId.put(lot.tradeId, arena.size());
                arena.add(lot);
            }
        }
    }

    /**
     * Result of one consumption.
     *
     * @param amount         units matched against open lots
     * @param costBasis      cost basis attributed to the matched units
     * @param closedTradeIds buy trades whose lots are now fully consumed
     */
    public record LotConsumption(double amount, double costBasis, List<String> closedTradeIds) {

        public static final LotConsumption EMPTY = new LotConsumption(0.0, 0.0, List.of());

        public double averageCost(double fallbackPrice) {
            return amount > 0.0 ? costBasis / amount : fallbackPrice;
        }
    }

    private static final class Lot {

        private final String tradeId;
        private final double amount;
        private final double costBasis;
        private double remaining;

        private Lot(String tradeId, double amount, double costBasis) {
            this.tradeId = tradeId;
            this.amount = amount;
            this.costBasis = costBasis;
            this.remaining = amount;
        }
    }
}
