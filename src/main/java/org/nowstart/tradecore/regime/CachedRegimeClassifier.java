package org.nowstart.tradecore.regime;

import java.util.EnumMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.nowstart.tradecore.data.dto.RegimeSignal;
import org.nowstart.tradecore.data.type.MarketRegime;
import org.nowstart.tradecore.strategy.core.PriceSeries;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class CachedRegimeClassifier {

    private final MarketRegimeDetector detector;
    private final RegimeCache cache;

    /**
     * Classifies bar {@code index}. Below index 50 the result is neutral with zero confidence and nothing is
     * computed or cached.
     */
    public RegimeSignal classify(PriceSeries series, int index) {
        if (series == null) {
            throw new IllegalArgumentException("series is required");
        }
        if (index < 0 || index >= series.size()) {
            throw new IllegalArgumentException("index must be in [0, series.size()-1]");
        }
        if (index < MarketRegimeDetector.MIN_INDEX || series.size() < MarketRegimeDetector.MIN_INDEX) {
            return RegimeSignal.NEUTRAL;
        }
        RegimeIndicatorSet indicators = cache.indicators(series);
        return cache.regime(series.seriesId(), index, () -> detector.detect(indicators, index));
    }

    /**
     * Dominant label over {@code [startIndex, endIndex]} and its share of bars. Ties resolve to neutral.
     */
    public DominantRegime dominantRegime(PriceSeries series, int startIndex, int endIndex) {
        if (startIndex > endIndex) {
            throw new IllegalArgumentException("startIndex must be <= endIndex");
        }
        Map<MarketRegime, Integer> counts = new EnumMap<>(MarketRegime.class);
        for (int i = startIndex; i <= endIndex; i++) {
            counts.merge(classify(series, i).regime(), 1, Integer::sum);
        }
        double total = endIndex - startIndex + 1.0;
        int bullish = counts.getOrDefault(MarketRegime.BULLISH, 0);
        int bearish = counts.getOrDefault(MarketRegime.BEARISH, 0);
        int neutral = counts.getOrDefault(MarketRegime.NEUTRAL, 0);
        if (bullish > bearish && bullish > neutral) {
            return new DominantRegime(MarketRegime.BULLISH, bullish / total);
        }
        if (bearish > bullish && bearish > neutral) {
            return new DominantRegime(MarketRegime.BEARISH, bearish / total);
        }
        return new DominantRegime(MarketRegime.NEUTRAL, neutral / total);
    }

    public void invalidate() {
        cache.invalidate();
    }

    public void invalidate(String seriesId) {
        cache.invalidate(seriesId);
    }

    public record DominantRegime(MarketRegime regime, double share) {
    }
}
