package org.nowstart.tradecore.risk;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.nowstart.tradecore.Fixtures;
import org.nowstart.tradecore.data.dto.KellyCriterionResult;
import org.nowstart.tradecore.data.model.Trade;
import org.nowstart.tradecore.data.type.TradeType;
import org.nowstart.tradecore.strategy.config.KellyConfig;

class KellyCriterionCalculatorTest {

    private final KellyCriterionCalculator calculator = new KellyCriterionCalculator();
    private final KellyConfig config = KellyConfig.defaults();

    @Test
    void calculate_returnsNullBelowMinimumTrades() {
        assertThat(calculator.calculate(sells(6, 3, 10.0), config)).isNull();
    }

    @Test
    void calculate_derivesKellyFromWinRateAndPayoff() {
        KellyCriterionResult result = calculator.calculate(sells(8, 4, 10.0), config);

        assertThat(result).isNotNull();
        assertThat(result.winRate()).isCloseTo(2.0 / 3.0, within(1e-12));
        assertThat(result.winLossRatio()).isCloseTo(1.0, within(1e-12));
        assertThat(result.kellyPercentage()).isCloseTo(1.0 / 3.0, within(1e-12));
        assertThat(result.fractionalKelly()).isCloseTo(1.0 / 12.0, within(1e-12));
        assertThat(result.tradeCount()).isEqualTo(12);
    }

    @Test
    void calculate_ignoresBuysAndBreakevenTrades() {
        List<Trade> trades = new ArrayList<>(sells(8, 4, 10.0));
        trades.add(trade(TradeType.BUY, null));
        trades.add(trade(TradeType.SELL, 0.0));

        assertThat(calculator.calculate(trades, config).tradeCount()).isEqualTo(12);
        assertThat(calculator.calculate(sells(0, 0, 0.0, 12), config)).isNull();
    }

    @Test
    void calculate_usesWinRateWhenNoLosses() {
        KellyCriterionResult result = calculator.calculate(sells(10, 0, 10.0), config);

        assertThat(result.kellyPercentage()).isEqualTo(1.0);
        assertThat(result.winLossRatio()).isZero();
    }

    @Test
    void calculate_onlyAnalyzesLookbackWindow() {
        List<Trade> trades = new ArrayList<>(sells(0, 20, 10.0));
        trades.addAll(sells(10, 0, 10.0));
        KellyConfig shortWindow = new KellyConfig(true, 0.25, 10, 10, 1.5);

        assertThat(calculator.calculate(trades, shortWindow).winRate()).isEqualTo(1.0);
    }

    @Test
    void kellyMultiplier_clampsToConfiguredRange() {
        KellyCriterionResult result = calculator.calculate(sells(8, 4, 10.0), config);

        assertThat(calculator.kellyMultiplier(result, 0.5, config)).isCloseTo(1.0 / 6.0, within(1e-12));
        assertThat(calculator.kellyMultiplier(result, 0.9, config)).isEqualTo(0.1);
        assertThat(calculator.kellyMultiplier(null, 0.5, config)).isEqualTo(1.0);
        assertThat(calculator.kellyMultiplier(result, 0.0, config)).isEqualTo(1.0);
    }

    @Test
    void optimalPositionSize_capsAtMaximumFraction() {
        KellyCriterionResult result = calculator.calculate(sells(8, 4, 10.0), config);

        assertThat(calculator.optimalPositionSize(1000, result, 0.5)).isCloseTo(83.333, within(1e-3));
        assertThat(calculator.optimalPositionSize(1000, result, 0.05)).isCloseTo(50.0, within(1e-9));
        assertThat(calculator.optimalPositionSize(1000, null, 0.5)).isEqualTo(500.0);
    }

    private List<Trade> sells(int wins, int losses, double size) {
        return sells(wins, losses, size, 0);
    }

    private List<Trade> sells(int wins, int losses, double size, int breakeven) {
        List<Trade> trades = new ArrayList<>();
        for (int i = 0; i < wins; i++) {
            trades.add(trade(TradeType.SELL, size));
        }
        for (int i = 0; i < losses; i++) {
            trades.add(trade(TradeType.SELL, -size));
        }
        for (int i = 0; i < breakeven; i++) {
            trades.add(trade(TradeType.SELL, 0.0));
        }
        return trades;
    }

    private Trade trade(TradeType type, Double pnl) {
        return Trade.builder()
                .id("trade-" + UUID.randomUUID())
                .timestamp(Fixtures.START)
                .type(type)
                .price(100)
                .amount(1)
                .quoteAmount(100)
                .pnl(pnl)
                .build();
    }
}
