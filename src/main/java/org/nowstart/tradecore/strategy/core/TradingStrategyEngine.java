package org.nowstart.tradecore.strategy.core;

import org.nowstart.tradecore.data.dto.TradingSignal;

/**
 * Versioned signal engine contract.
 *
 * @param <P> parameter type consumed by the engine
 */
public interface TradingStrategyEngine<P extends StrategyParams> {

    /**
     * Returns the engine version key (for example {@code simple}, {@code adaptive}).
     */
    String version();

    /**
     * Returns the runtime class for parameter binding/validation.
     */
    Class<P> parameterType();

    /**
     * Returns the minimum bar history length before the engine produces non-neutral output.
     */
    int requiredWarmupBars(P params);

    /**
     * Evaluates one bar and returns the trading signal with diagnostics.
     */
    TradingSignal evaluate(StrategyInput<P> input);
}
