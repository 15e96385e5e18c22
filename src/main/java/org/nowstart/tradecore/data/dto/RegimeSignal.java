package org.nowstart.tradecore.data.dto;

import org.nowstart.tradecore.data.type.MarketRegime;

public record RegimeSignal(
        MarketRegime regime,
        double confidence,
        RegimeIndicators indicators
) {

    public static final RegimeSignal NEUTRAL = new RegimeSignal(MarketRegime.NEUTRAL, 0.0, RegimeIndicators.ZERO);

    public RegimeSignal {
        if (regime == null) {
            throw new IllegalArgumentException("regime is required");
        }
        indicators = indicators == null ? RegimeIndicators.ZERO : indicators;
    }
}
