package org.nowstart.tradecore.risk;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.nowstart.tradecore.Fixtures;
import org.nowstart.tradecore.data.dto.EquitySnapshot;
import org.nowstart.tradecore.data.dto.RiskMetrics;
import org.nowstart.tradecore.data.dto.StrategyResults;
import org.nowstart.tradecore.data.model.Trade;
import org.nowstart.tradecore.data.type.TradeType;

class RiskMetricsCalculatorTest {

    private final RiskMetricsCalculator calculator = new RiskMetricsCalculator();

    @Test
    void calculateRiskMetrics_measuresDrawdownFromRunningPeak() {
        RiskMetrics metrics = calculator.calculateRiskMetrics(List.of(), curve(100, 120, 90, 130), 100);

        assertThat(metrics.maxDrawdown()).isCloseTo(25.0, within(1e-9));
        assertThat(metrics.maxDrawdownDuration()).isEqualTo(1.0);
        assertThat(metrics.ulcerIndex()).isCloseTo(12.5, within(1e-9));
        assertThat(metrics.volatility()).isGreaterThan(0.0);
    }

    @Test
    void calculateRiskMetrics_returnsZerosForFlatCurve() {
        RiskMetrics metrics = calculator.calculateRiskMetrics(List.of(), curve(100, 100, 100), 100);

        assertThat(metrics.sharpeRatio()).isZero();
        assertThat(metrics.sortinoRatio()).isZero();
        assertThat(metrics.maxDrawdown()).isZero();
        assertThat(metrics.calmarRatio()).isZero();
        assertThat(metrics.omegaRatio()).isEqualTo(1.0);
    }

    @Test
    void calculateRiskMetrics_handlesEmptyInput() {
        RiskMetrics metrics = calculator.calculateRiskMetrics(null, null, 1000);

        assertThat(metrics.sharpeRatio()).isZero();
        assertThat(metrics.omegaRatio()).isZero();
        assertThat(metrics.ulcerIndex()).isZero();
        assertThat(metrics.expectancy()).isZero();
    }

    @Test
    void calculateRiskMetrics_capsUnboundedRatios() {
        RiskMetrics metrics = calculator.calculateRiskMetrics(List.of(), curve(100, 110), 100);

        assertThat(metrics.sortinoRatio()).isEqualTo(RiskMetricsCalculator.UNBOUNDED);
        assertThat(metrics.omegaRatio()).isEqualTo(RiskMetricsCalculator.UNBOUNDED);
        assertThat(metrics.sharpeRatio()).isZero();
    }

    @Test
    void calculateRiskMetrics_derivesTradeStatisticsFromValueDeltas() {
        RiskMetrics metrics = calculator.calculateRiskMetrics(trades(1100, 1050, 1150), curve(1000, 1100), 1000);

        assertThat(metrics.winLossRatio()).isCloseTo(2.0, within(1e-9));
        assertThat(metrics.expectancy()).isCloseTo(50.0, within(1e-9));
    }

    @Test
    void calculateStrategyResults_summarizesLedger() {
        StrategyResults results = calculator.calculateStrategyResults(trades(1100, 1050, 1150), 1000, 1150);

        assertThat(results.totalReturn()).isEqualTo(150.0);
        assertThat(results.totalReturnPct()).isCloseTo(15.0, within(1e-9));
        assertThat(results.tradeCount()).isEqualTo(3);
        assertThat(results.winCount()).isEqualTo(2);
        assertThat(results.lossCount()).isEqualTo(1);
        assertThat(results.winRatePct()).isCloseTo(200.0 / 3.0, within(1e-9));
        assertThat(results.profitFactor()).isCloseTo(4.0, within(1e-9));
        assertThat(results.largestWin()).isCloseTo(100.0, within(1e-9));
        assertThat(results.largestLoss()).isCloseTo(50.0, within(1e-9));
    }

    @Test
    void calculateStrategyResults_capsProfitFactorWithoutLosses() {
        StrategyResults results = calculator.calculateStrategyResults(trades(1100), 1000, 1100);

        assertThat(results.profitFactor()).isEqualTo(RiskMetricsCalculator.UNBOUNDED);
        assertThat(calculator.calculateStrategyResults(List.of(), 1000, 1000).profitFactor()).isZero();
    }

    private List<EquitySnapshot> curve(double... values) {
        List<EquitySnapshot> curve = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            curve.add(new EquitySnapshot(Fixtures.START.plus(Duration.ofDays(i)), values[i], 0.0, values[i], 1.0));
        }
        return curve;
    }

    private List<Trade> trades(double... valuesAfter) {
        List<Trade> trades = new ArrayList<>();
        for (int i = 0; i < valuesAfter.length; i++) {
            trades.add(Trade.builder()
                    .id("trade-" + i)
                    .timestamp(Fixtures.START.plus(Duration.ofDays(i)))
                    .type(i % 2 == 0 ? TradeType.BUY : TradeType.SELL)
                    .price(100)
                    .amount(1)
                    .quoteAmount(100)
                    .portfolioValueAfter(valuesAfter[i])
                    .build());
        }
        return trades;
    }
}
