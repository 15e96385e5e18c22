package org.nowstart.tradecore.strategy.config;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.bind.DefaultValue;

public record StopLossConfig(
        @DefaultValue("true") boolean enabled,
        // stop distance in ATR units
        @DecimalMin(value = "0", inclusive = false) @DefaultValue("2.0") double atrMultiplier,
        @DefaultValue("true") boolean trailing,
        // EMA-smoothed ATR instead of Wilder smoothing
        @DefaultValue("true") boolean useEma,
        @Positive @DefaultValue("14") int atrPeriod
) {

    public StopLossConfig {
        if (!Double.isFinite(atrMultiplier) || atrMultiplier <= 0.0) {
            throw new IllegalArgumentException("atrMultiplier must be > 0");
        }
        if (atrPeriod < 1) {
            throw new IllegalArgumentException("atrPeriod must be >= 1");
        }
    }

    public static StopLossConfig defaults() {
        return new StopLossConfig(true, 2.0, true, true, 14);
    }
}
