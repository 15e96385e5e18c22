package org.nowstart.tradecore.strategy;

import java.util.Locale;
import lombok.RequiredArgsConstructor;
import org.nowstart.tradecore.data.property.TradingProperties;
import org.nowstart.tradecore.strategy.adaptive.AdaptiveStrategyEngine;
import org.nowstart.tradecore.strategy.config.AdaptiveStrategyConfig;
import org.nowstart.tradecore.strategy.core.StrategyParams;
import org.nowstart.tradecore.strategy.simple.SimpleStrategyEngine;
import org.springframework.stereotype.Service;

/**
 * Maps an engine version to the bound configuration it runs with. The simple engine runs the configured
 * bullish strategy on its own.
 */
@Service
@RequiredArgsConstructor
public class StrategyParamResolver {

    private final TradingProperties tradingProperties;
    private final AdaptiveStrategyConfig adaptiveStrategyConfig;

    public String resolveActiveStrategyVersion() {
        String raw = tradingProperties.activeStrategyVersion();
        if (raw == null || raw.isBlank()) {
            return AdaptiveStrategyEngine.VERSION;
        }
        return raw.trim().toLowerCase(Locale.ROOT);
    }

    public StrategyParams resolve(String strategyVersion) {
        String normalized = normalize(strategyVersion);
        return switch (normalized) {
            case AdaptiveStrategyEngine.VERSION -> adaptiveStrategyConfig;
            case SimpleStrategyEngine.VERSION -> adaptiveStrategyConfig.bullishStrategy();
            default -> throw new IllegalArgumentException("Unsupported strategy version: " + strategyVersion);
        };
    }

    private String normalize(String strategyVersion) {
        if (strategyVersion == null || strategyVersion.isBlank()) {
            throw new IllegalArgumentException("strategyVersion is required");
        }
        return strategyVersion.trim().toLowerCase(Locale.ROOT);
    }
}
