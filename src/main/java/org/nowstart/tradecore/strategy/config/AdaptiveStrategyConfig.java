package org.nowstart.tradecore.strategy.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Builder;
import org.nowstart.tradecore.data.type.VolatilitySource;
import org.nowstart.tradecore.strategy.core.StrategyParams;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@Builder(toBuilder = true)
@ConfigurationProperties(prefix = "tradecore.adaptive")
public record AdaptiveStrategyConfig(
        @NotNull @Valid StrategyConfig bullishStrategy,
        @NotNull @Valid StrategyConfig bearishStrategy,
        // used instead of the bearish strategy for unconfirmed or neutral regimes when present
        @Valid StrategyConfig neutralStrategy,
        @DecimalMin("0") @DecimalMax("1.0") @DefaultValue("0.2") double regimeConfidenceThreshold,
        @DecimalMin("-1.0") @DecimalMax("1.0") @DefaultValue("0.25") double momentumConfirmationThreshold,
        // 1 = no persistence filtering
        @Positive @DefaultValue("2") int regimePersistencePeriods,
        @DefaultValue("true") boolean dynamicPositionSizing,
        @DecimalMin("0") @DecimalMax("1.0") @DefaultValue("0.95") double maxBullishPosition,
        // 0.05 = 5% per-bar return dispersion for RETURN_STD_DEV
        @DecimalMin(value = "0", inclusive = false) @DefaultValue("0.05") double maxVolatility,
        @NotNull @DefaultValue("RETURN_STD_DEV") VolatilitySource volatilitySource,
        @DecimalMin("0") @DecimalMax("1.0") @DefaultValue("0.2") double circuitBreakerWinRate,
        @Positive @DefaultValue("10") int circuitBreakerLookback,
        @Positive @DefaultValue("5") int whipsawDetectionPeriods,
        @Positive @DefaultValue("3") int whipsawMaxChanges,
        // peak-to-current drop that pauses trading, 0.2 = 20%
        @DecimalMin(value = "0", inclusive = false) @DecimalMax("1.0") @DefaultValue("0.2") double maxDrawdownThreshold,
        @Valid KellyConfig kelly,
        @Valid StopLossConfig stopLoss,
        @Valid VolatilitySizingConfig volatilitySizing
) implements StrategyParams {

    public AdaptiveStrategyConfig {
        if (bullishStrategy == null) {
            throw new IllegalArgumentException("bullishStrategy is required");
        }
        if (bearishStrategy == null) {
            throw new IllegalArgumentException("bearishStrategy is required");
        }
        validateRange("regimeConfidenceThreshold", regimeConfidenceThreshold, 0.0, 1.0);
        validateRange("momentumConfirmationThreshold", momentumConfirmationThreshold, -1.0, 1.0);
        validateRange("maxBullishPosition", maxBullishPosition, 0.0, 1.0);
        validateRange("circuitBreakerWinRate", circuitBreakerWinRate, 0.0, 1.0);
        validateRange("maxDrawdownThreshold", maxDrawdownThreshold, 0.0, 1.0);
        if (!Double.isFinite(maxVolatility) || maxVolatility <= 0.0) {
            throw new IllegalArgumentException("maxVolatility must be > 0");
        }
        volatilitySource = volatilitySource == null ? VolatilitySource.RETURN_STD_DEV : volatilitySource;
        requirePositive("regimePersistencePeriods", regimePersistencePeriods);
        requirePositive("circuitBreakerLookback", circuitBreakerLookback);
        requirePositive("whipsawDetectionPeriods", whipsawDetectionPeriods);
        requirePositive("whipsawMaxChanges", whipsawMaxChanges);
    }

    /**
     * Builder pre-filled with the same defaults the property binding applies.
     */
    public static AdaptiveStrategyConfigBuilder defaults(StrategyConfig bullishStrategy, StrategyConfig bearishStrategy) {
        return AdaptiveStrategyConfig.builder()
                .bullishStrategy(bullishStrategy)
                .bearishStrategy(bearishStrategy)
                .regimeConfidenceThreshold(0.2)
                .momentumConfirmationThreshold(0.25)
                .regimePersistencePeriods(2)
                .dynamicPositionSizing(true)
                .maxBullishPosition(0.95)
                .maxVolatility(0.05)
                .volatilitySource(VolatilitySource.RETURN_STD_DEV)
                .circuitBreakerWinRate(0.2)
                .circuitBreakerLookback(10)
                .whipsawDetectionPeriods(5)
                .whipsawMaxChanges(3)
                .maxDrawdownThreshold(0.2);
    }

    public StrategyConfig fallbackStrategy() {
        return neutralStrategy != null ? neutralStrategy : bearishStrategy;
    }

    public boolean kellyEnabled() {
        return kelly != null && kelly.enabled();
    }

    public boolean stopLossEnabled() {
        return stopLoss != null && stopLoss.enabled();
    }

    private static void validateRange(String field, double value, double min, double max) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException(field + " must be finite");
        }
        if (value < min || value > max) {
            throw new IllegalArgumentException(field + " must be in [" + min + ", " + max + "]");
        }
    }

    private static void requirePositive(String field, int value) {
        if (value < 1) {
            throw new IllegalArgumentException(field + " must be >= 1");
        }
    }
}
