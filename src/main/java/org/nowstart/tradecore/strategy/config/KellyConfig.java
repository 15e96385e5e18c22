package org.nowstart.tradecore.strategy.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.bind.DefaultValue;

public record KellyConfig(
        @DefaultValue("true") boolean enabled,
        // fraction of full Kelly actually used
        @DecimalMin("0") @DecimalMax("1.0") @DefaultValue("0.25") double fractionalMultiplier,
        @Positive @DefaultValue("10") int minTrades,
        // recent sell trades analyzed, 0 = all
        @PositiveOrZero @DefaultValue("50") int lookbackPeriod,
        @DecimalMin("0.1") @DefaultValue("1.5") double maxMultiplier
) {

    public KellyConfig {
        if (!Double.isFinite(fractionalMultiplier) || fractionalMultiplier < 0.0 || fractionalMultiplier > 1.0) {
            throw new IllegalArgumentException("fractionalMultiplier must be in [0.0, 1.0]");
        }
        if (minTrades < 1) {
            throw new IllegalArgumentException("minTrades must be >= 1");
        }
        if (lookbackPeriod < 0) {
            throw new IllegalArgumentException("lookbackPeriod must be >= 0");
        }
        if (!Double.isFinite(maxMultiplier) || maxMultiplier < 0.1) {
            throw new IllegalArgumentException("maxMultiplier must be >= 0.1");
        }
    }

    public static KellyConfig defaults() {
        return new KellyConfig(true, 0.25, 10, 50, 1.5);
    }
}
