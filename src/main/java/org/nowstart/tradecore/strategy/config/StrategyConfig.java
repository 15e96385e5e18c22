package org.nowstart.tradecore.strategy.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import java.util.List;
import org.nowstart.tradecore.strategy.core.StrategyParams;

/**
 * Indicator blend plus thresholds for one market posture (bullish or bearish).
 */
public record StrategyConfig(
        @NotBlank String name,
        String timeframe,
        @Valid List<IndicatorConfig> indicators,
        double buyThreshold,
        double sellThreshold,
        @DecimalMin("0") @DecimalMax("1.0") double maxPositionFraction,
        @Positive double initialCapital
) implements StrategyParams {

    public StrategyConfig {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name is required");
        }
        timeframe = timeframe == null || timeframe.isBlank() ? "1d" : timeframe;
        indicators = indicators == null ? List.of() : List.copyOf(indicators);
        requireFinite("buyThreshold", buyThreshold);
        requireFinite("sellThreshold", sellThreshold);
        requireFinite("maxPositionFraction", maxPositionFraction);
        if (maxPositionFraction < 0.0 || maxPositionFraction > 1.0) {
            throw new IllegalArgumentException("maxPositionFraction must be in [0.0, 1.0]");
        }
        requireFinite("initialCapital", initialCapital);
    }

    private static void requireFinite(String field, double value) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException(field + " must be finite");
        }
    }
}
