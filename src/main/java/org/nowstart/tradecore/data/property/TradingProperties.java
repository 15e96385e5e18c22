package org.nowstart.tradecore.data.property;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "tradecore.trading")
public record TradingProperties(
        // proportional fee per fill, 0.001 = 0.1%
        @DecimalMin("0") @DecimalMax("0.1") @DefaultValue("0.001") double feeRate,
        // engine used by the facade when no version is given
        @NotBlank @DefaultValue("adaptive") String activeStrategyVersion,
        // first bar index evaluated by the backtest driver
        @Positive @DefaultValue("50") int backtestWarmupBars,
        // bounded regime history window per session
        @Positive @DefaultValue("10") int regimeHistorySize,
        // bounded trade-outcome window per session
        @Positive @DefaultValue("20") int tradeOutcomeHistorySize
) {

    public TradingProperties {
        if (!Double.isFinite(feeRate) || feeRate < 0.0) {
            throw new IllegalArgumentException("feeRate must be finite and >= 0");
        }
    }

    public static TradingProperties defaults() {
        return new TradingProperties(0.001, "adaptive", 50, 10, 20);
    }
}
