package org.nowstart.tradecore.regime;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.tradecore.data.dto.RegimeSignal;
import org.nowstart.tradecore.strategy.core.PriceSeries;
import org.springframework.stereotype.Component;

/**
 * Memoizes regime results per (series id, bar index) together with the series' indicator arrays.
 *
 * <p>Keys are caller-supplied series identifiers, so callers must {@link #invalidate(String)} a series before
 * reusing its identifier for different data, and {@link #invalidate()} between independent runs.
 */
@Slf4j
@Component
public class RegimeCache {

    private final Map<String, SeriesEntry> entries = new ConcurrentHashMap<>();

    public RegimeSignal regime(String seriesId, int index, Supplier<RegimeSignal> loader) {
        return entry(seriesId).regimes().computeIfAbsent(index, ignored -> loader.get());
    }

    /**
     * Returns indicator arrays covering the whole series, recomputing when bars were appended.
     */
    public RegimeIndicatorSet indicators(PriceSeries series) {
        SeriesEntry entry = entry(series.seriesId());
        RegimeIndicatorSet current = entry.indicators;
        if (current == null || current.barCount() != series.size()) {
            current = RegimeIndicatorSet.compute(series);
            entry.indicators = current;
        }
        return current;
    }

    public void invalidate() {
        int cleared = entries.size();
        entries.clear();
        log.debug("Regime cache cleared. series={}", cleared);
    }

    public void invalidate(String seriesId) {
        if (seriesId != null) {
            entries.remove(seriesId);
        }
    }

    public int cachedRegimeCount(String seriesId) {
        SeriesEntry entry = entries.get(seriesId);
        return entry == null ? 0 : entry.regimes().size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    private SeriesEntry entry(String seriesId) {
        if (seriesId == null || seriesId.isBlank()) {
            throw new IllegalArgumentException("seriesId is required");
        }
        return entries.computeIfAbsent(seriesId, ignored -> new SeriesEntry());
    }

    private static final class SeriesEntry {

        private final Map<Integer, RegimeSignal> regimes = new ConcurrentHashMap<>();
        private volatile RegimeIndicatorSet indicators;

        private Map<Integer, RegimeSignal> regimes() {
            return regimes;
        }
    }
}
