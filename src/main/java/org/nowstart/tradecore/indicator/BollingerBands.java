package org.nowstart.tradecore.indicator;

public record BollingerBands(
        double[] upper,
        double[] middle,
        double[] lower
) {
}
