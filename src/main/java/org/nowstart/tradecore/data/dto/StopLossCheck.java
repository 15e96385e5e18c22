package org.nowstart.tradecore.data.dto;

import org.nowstart.tradecore.data.model.OpenPosition;

public record StopLossCheck(
        OpenPosition position,
        StopLossResult result
) {
}
