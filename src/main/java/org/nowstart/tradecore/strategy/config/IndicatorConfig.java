package org.nowstart.tradecore.strategy.config;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import java.util.Locale;
import java.util.Map;
import org.nowstart.tradecore.data.type.IndicatorKind;

/**
 * One weighted indicator inside a {@link StrategyConfig}.
 *
 * <p>Parameter keys are kind-specific: {@code period} for SMA/EMA/RSI/Bollinger/VWAP/OBV,
 * {@code fastPeriod}/{@code slowPeriod}/{@code signalPeriod} for MACD and VWMACD, {@code stdDev} for Bollinger.
 * Absent or zero entries fall back to the kind's default.
 *
 * @param kind   indicator function
 * @param weight blending weight, need not sum to 1 across a strategy
 * @param params kind-specific numeric parameters
 */
public record IndicatorConfig(
        @NotNull IndicatorKind kind,
        @DecimalMin("0") double weight,
        Map<String, Double> params
) {

    public IndicatorConfig {
        if (kind == null) {
            throw new IllegalArgumentException("kind is required");
        }
        if (!Double.isFinite(weight) || weight < 0.0) {
            throw new IllegalArgumentException("weight must be finite and >= 0");
        }
        params = params == null ? Map.of() : Map.copyOf(params);
    }

    public static IndicatorConfig of(IndicatorKind kind, double weight) {
        return new IndicatorConfig(kind, weight, Map.of());
    }

    public static IndicatorConfig of(IndicatorKind kind, double weight, Map<String, Double> params) {
        return new IndicatorConfig(kind, weight, params);
    }

    public double param(String name, double defaultValue) {
        Double value = lookup(name);
        if (value == null || value == 0.0 || !Double.isFinite(value)) {
            return defaultValue;
        }
        return value;
    }

    public int intParam(String name, int defaultValue) {
        return (int) Math.round(param(name, defaultValue));
    }

    // relaxed property binding may deliver fast-period or fastperiod for fastPeriod
    private Double lookup(String name) {
        Double exact = params.get(name);
        if (exact != null) {
            return exact;
        }
        String wanted = relaxed(name);
        return params.entrySet().stream()
                .filter(entry -> relaxed(entry.getKey()).equals(wanted))
                .map(Map.Entry::getValue)
                .findFirst()
                .orElse(null);
    }

    private static String relaxed(String key) {
        return key.replace("-", "").replace("_", "").toLowerCase(Locale.ROOT);
    }
}
