package org.nowstart.tradecore.session;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import org.nowstart.tradecore.data.type.MarketRegime;

/**
 * In-process memory for one session key: a bounded regime-label history, a bounded trade-outcome history and
 * the peak portfolio value seen so far.
 *
 * <p>Instances are confined to the session that owns the key; the store only isolates keys from each other.
 */
public class SessionState {

    private int regimeCapacity;
    private int outcomeCapacity;
    private final Deque<MarketRegime> regimeHistory = new ArrayDeque<>();
    private final Deque<Boolean> tradeOutcomes = new ArrayDeque<>();
    private double peakPortfolioValue;

    public SessionState(int regimeCapacity, int outcomeCapacity) {
        if (regimeCapacity < 1 || outcomeCapacity < 1) {
            throw new IllegalArgumentException("history capacities must be >= 1");
        }
        this.regimeCapacity = regimeCapacity;
        this.outcomeCapacity = outcomeCapacity;
    }

    public void appendRegime(MarketRegime regime) {
        regimeHistory.addLast(regime);
        while (regimeHistory.size() > regimeCapacity) {
            regimeHistory.removeFirst();
        }
    }

    public void recordOutcome(boolean profitable) {
        tradeOutcomes.addLast(profitable);
        while (tradeOutcomes.size() > outcomeCapacity) {
            tradeOutcomes.removeFirst();
        }
    }

    /**
     * Last {@code count} regime labels, oldest first. Fewer when history is shorter.
     */
    public List<MarketRegime> recentRegimes(int count) {
        List<MarketRegime> all = new ArrayList<>(regimeHistory);
        return List.copyOf(all.subList(Math.max(0, all.size() - count), all.size()));
    }

    /**
     * Last {@code count} trade outcomes, oldest first. Fewer when history is shorter.
     */
    public List<Boolean> recentOutcomes(int count) {
        List<Boolean> all = new ArrayList<>(tradeOutcomes);
        return List.copyOf(all.subList(Math.max(0, all.size() - count), all.size()));
    }

    public int regimeCount() {
        return regimeHistory.size();
    }

    public int outcomeCount() {
        return tradeOutcomes.size();
    }

    /**
     * Raises the peak to {@code value} when higher and returns the current peak.
     */
    public double updatePeak(double value) {
        if (value > peakPortfolioValue) {
            peakPortfolioValue = value;
        }
        return peakPortfolioValue;
    }

    public double peakPortfolioValue() {
        return peakPortfolioValue;
    }

    public void resetPeak(double value) {
        peakPortfolioValue = value;
    }

    /**
     * Widens the regime window when a config needs more history than the store default. Never shrinks it.
     */
    public void ensureRegimeCapacity(int capacity) {
        if (capacity > regimeCapacity) {
            regimeCapacity = capacity;
        }
    }

    public int regimeCapacity() {
        return regimeCapacity;
    }

    /**
     * Widens the outcome window so a circuit-breaker lookback longer than the store default sees every outcome.
     * Never shrinks it.
     */
    public void ensureOutcomeCapacity(int capacity) {
        if (capacity > outcomeCapacity) {
            outcomeCapacity = capacity;
        }
    }

    public int outcomeCapacity() {
        return outcomeCapacity;
    }
}
