package org.nowstart.tradecore.strategy.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.bind.DefaultValue;

public record VolatilitySizingConfig(
        @DefaultValue("true") boolean enabled,
        @Positive @DefaultValue("14") int atrPeriod,
        // current ATR% over average ATR% above which size is reduced
        @DecimalMin(value = "0", inclusive = false) @DefaultValue("2.0") double highVolatilityThreshold,
        @DecimalMin("0") @DecimalMax("1.0") @DefaultValue("0.5") double maxPositionReduction,
        @DefaultValue("true") boolean useEma
) {

    public VolatilitySizingConfig {
        if (atrPeriod < 1) {
            throw new IllegalArgumentException("atrPeriod must be >= 1");
        }
        if (!Double.isFinite(highVolatilityThreshold) || highVolatilityThreshold <= 0.0) {
            throw new IllegalArgumentException("highVolatilityThreshold must be > 0");
        }
        if (!Double.isFinite(maxPositionReduction) || maxPositionReduction < 0.0 || maxPositionReduction > 1.0) {
            throw new IllegalArgumentException("maxPositionReduction must be in [0.0, 1.0]");
        }
    }

    public static VolatilitySizingConfig defaults() {
        return new VolatilitySizingConfig(true, 14, 2.0, 0.5, true);
    }
}
