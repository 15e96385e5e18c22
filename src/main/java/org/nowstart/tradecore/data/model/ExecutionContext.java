package org.nowstart.tradecore.data.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.Getter;
import org.nowstart.tradecore.strategy.config.AdaptiveStrategyConfig;
import org.nowstart.tradecore.strategy.config.KellyConfig;
import org.nowstart.tradecore.strategy.config.StopLossConfig;
import org.nowstart.tradecore.strategy.config.VolatilitySizingConfig;
import org.nowstart.tradecore.strategy.core.PriceSeries;

/**
 * Per-session execution state handed to the trade executor: the trade ledger, open lots, stop-loss positions,
 * the series being traded and the current bar cursor.
 *
 * <p>Owned by one caller. Sizing features are inert when their config is absent or disabled.
 */
@Getter
public class ExecutionContext {

    private final String sessionKey;
    private final PriceSeries series;
    private final KellyConfig kellyConfig;
    private final StopLossConfig stopLossConfig;
    private final VolatilitySizingConfig volatilitySizingConfig;
    private final List<Trade> trades = new ArrayList<>();
    private final List<OpenPosition> openPositions = new ArrayList<>();
    private final LotQueue lots = new LotQueue();
    private int barIndex;

    public ExecutionContext(
            String sessionKey,
            PriceSeries series,
            KellyConfig kellyConfig,
            StopLossConfig stopLossConfig,
            VolatilitySizingConfig volatilitySizingConfig
    ) {
        if (series == null) {
            throw new IllegalArgumentException("series is required");
        }
        this.sessionKey = sessionKey;
        this.series = series;
        this.kellyConfig = kellyConfig;
        this.stopLossConfig = stopLossConfig;
        this.volatilitySizingConfig = volatilitySizingConfig;
    }

    public static ExecutionContext of(PriceSeries series, String sessionKey, AdaptiveStrategyConfig config) {
        return new ExecutionContext(
                sessionKey,
                series,
                config == null ? null : config.kelly(),
                config == null ? null : config.stopLoss(),
                config == null ? null : config.volatilitySizing()
        );
    }

    public static ExecutionContext of(PriceSeries series) {
        return new ExecutionContext(null, series, null, null, null);
    }

    public void moveTo(int index) {
        if (index < 0 || index >= series.size()) {
            throw new IllegalArgumentException("index must be in [0, series.size()-1]");
        }
        this.barIndex = index;
    }

    public Instant currentTimestamp() {
        return series.bar(barIndex).timestamp();
    }

    public List<Trade> getTrades() {
        return Collections.unmodifiableList(trades);
    }

    public List<OpenPosition> getOpenPositions() {
        return Collections.unmodifiableList(openPositions);
    }

    public void record(Trade trade) {
        trades.add(trade);
    }

    public void track(OpenPosition position) {
        openPositions.add(position);
    }

    public void untrack(String tradeId) {
        openPositions.removeIf(position -> position.tradeId().equals(tradeId));
    }

    public boolean kellyEnabled() {
        return kellyConfig != null && kellyConfig.enabled();
    }

    public boolean stopLossEnabled() {
        return stopLossConfig != null && stopLossConfig.enabled();
    }

    public boolean volatilitySizingEnabled() {
        return volatilitySizingConfig != null && volatilitySizingConfig.enabled();
    }
}
