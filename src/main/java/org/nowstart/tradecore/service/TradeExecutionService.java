package org.nowstart.tradecore.service;

import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.tradecore.data.dto.KellyCriterionResult;
import org.nowstart.tradecore.data.dto.StopLossCheck;
import org.nowstart.tradecore.data.dto.TradingSignal;
import org.nowstart.tradecore.data.exception.PortfolioInvariantException;
import org.nowstart.tradecore.data.model.ExecutionContext;
import org.nowstart.tradecore.data.model.LotQueue.LotConsumption;
import org.nowstart.tradecore.data.model.OpenPosition;
import org.nowstart.tradecore.data.model.Portfolio;
import org.nowstart.tradecore.data.model.Trade;
import org.nowstart.tradecore.data.property.TradingProperties;
import org.nowstart.tradecore.data.type.TradeAction;
import org.nowstart.tradecore.data.type.TradeType;
import org.nowstart.tradecore.indicator.TechnicalIndicators;
import org.nowstart.tradecore.risk.AtrStopLossManager;
import org.nowstart.tradecore.risk.KellyCriterionCalculator;
import org.nowstart.tradecore.risk.VolatilityPositionSizer;
import org.nowstart.tradecore.session.SessionStore;
import org.nowstart.tradecore.strategy.config.StopLossConfig;
import org.nowstart.tradecore.strategy.config.StrategyConfig;
import org.springframework.stereotype.Service;

/**
 * Turns a signal into at most one fill against a caller-owned {@link Portfolio}.
 *
 * <p>Open stop-loss positions are checked first and a triggered stop sells that lot instead of acting on the
 * signal. Buys spend {@code quote x maxPositionFraction x sizeMultiplier x confidence x kelly} plus fee. Sells
 * release {@code base x maxPositionFraction x kelly} and realize P&amp;L against FIFO lots. Each realized sell
 * records its outcome into the session store when the context carries a session key.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TradeExecutionService {

    private static final double EPSILON = 1e-9;

    private final TradingProperties tradingProperties;
    private final KellyCriterionCalculator kellyCriterionCalculator;
    private final AtrStopLossManager stopLossManager;
    private final VolatilityPositionSizer volatilityPositionSizer;
    private final SessionStore sessionStore;

    /**
     * @return the executed trade, or {@code null} for a hold or a trade that cannot be filled
     */
    public Trade executeTrade(
            TradingSignal signal,
            double confidence,
            double price,
            Portfolio portfolio,
            ExecutionContext context
    ) {
        if (signal == null || portfolio == null || context == null) {
            throw new IllegalArgumentException("signal, portfolio, and context are required");
        }
        if (!Double.isFinite(price) || price <= 0.0) {
            throw new IllegalArgumentException("price must be finite and > 0");
        }

        Trade stopExit = exitTriggeredStop(signal, confidence, price, portfolio, context);
        if (stopExit != null) {
            return stopExit;
        }
        if (signal.action() == TradeAction.HOLD || signal.activeStrategy() == null) {
            return null;
        }

        StrategyConfig strategy = signal.activeStrategy();
        double kellyMultiplier = kellyMultiplier(context, strategy);
        Trade trade = signal.action() == TradeAction.BUY
                ? buy(signal, confidence, price, portfolio, context, strategy, kellyMultiplier)
                : sell(signal, confidence, price, portfolio, context, strategy, kellyMultiplier);
        if (trade != null) {
            checkInvariants(portfolio);
        }
        return trade;
    }

    private Trade buy(
            TradingSignal signal,
            double confidence,
            double price,
            Portfolio portfolio,
            ExecutionContext context,
            StrategyConfig strategy,
            double kellyMultiplier
    ) {
        double quote = portfolio.getQuoteBalance();
        double volatilityMultiplier = context.volatilitySizingEnabled()
                ? volatilityPositionSizer.multiplier(context.getSeries(), context.getBarIndex(), context.getVolatilitySizingConfig())
                : 1.0;
        double positionSize = quote
                * strategy.maxPositionFraction()
                * signal.positionSizeMultiplier()
                * confidence
                * kellyMultiplier
                * volatilityMultiplier;
        if (!(positionSize > 0.0)) {
            return null;
        }
        double fee = positionSize * tradingProperties.feeRate();
        double totalCost = positionSize + fee;
        if (totalCost > quote) {
            log.warn(
                    "Buy rejected, insufficient quote balance. session={}, positionSize={}, totalCost={}, quoteBalance={}",
                    context.getSessionKey(),
                    positionSize,
                    totalCost,
                    quote
            );
            return null;
        }

        double amount = positionSize / price;
        portfolio.applyBuy(totalCost, amount, price);
        Trade trade = Trade.builder()
                .id(newTradeId())
                .timestamp(context.currentTimestamp())
                .type(TradeType.BUY)
                .price(price)
                .amount(amount)
                .quoteAmount(positionSize)
                .signal(signal.signal())
                .confidence(confidence)
                .portfolioValueAfter(portfolio.getTotalValue())
                .costBasis(totalCost)
                .build();
        context.record(trade);
        context.getLots().add(trade);

        if (context.stopLossEnabled()) {
            StopLossConfig stopLoss = context.getStopLossConfig();
            OpenPosition position = stopLossManager.createOpenPosition(trade, currentAtr(context, stopLoss), stopLoss);
            if (position != null) {
                context.track(position);
            }
        }

        log.info(
                "Trade executed. session={}, type={}, price={}, amount={}, quoteAmount={}, fee={}, portfolioValue={}, kellyMultiplier={}, volatilityMultiplier={}",
                context.getSessionKey(),
                TradeType.BUY,
                price,
                amount,
                positionSize,
                fee,
                portfolio.getTotalValue(),
                kellyMultiplier,
                volatilityMultiplier
        );
        return trade;
    }

    private Trade sell(
            TradingSignal signal,
            double confidence,
            double price,
            Portfolio portfolio,
            ExecutionContext context,
            StrategyConfig strategy,
            double kellyMultiplier
    ) {
        double base = portfolio.getBaseBalance();
        if (base <= 0.0) {
            return null;
        }
        double amount = Math.min(base, base * strategy.maxPositionFraction() * kellyMultiplier);
        if (!(amount > 0.0)) {
            return null;
        }

        LotConsumption consumption = context.getLots().consume(amount);
        double averageCost = consumption.averageCost(price);
        double saleValue = amount * price;
        double fee = saleValue * tradingProperties.feeRate();
        double netProceeds = saleValue - fee;
        double pnl = netProceeds - (amount * averageCost);
        boolean profitable = pnl > 0.0;

        portfolio.applySell(amount, netProceeds, price, profitable);
        consumption.closedTradeIds().forEach(context::untrack);

        Trade trade = Trade.builder()
                .id(newTradeId())
                .timestamp(context.currentTimestamp())
                .type(TradeType.SELL)
                .price(price)
                .amount(amount)
                .quoteAmount(saleValue)
                .signal(signal.signal())
                .confidence(confidence)
                .portfolioValueAfter(portfolio.getTotalValue())
                .costBasis(consumption.costBasis())
                .pnl(pnl)
                .build();
        context.record(trade);
        recordOutcome(context, profitable);

        log.info(
                "Trade executed. session={}, type={}, price={}, amount={}, quoteAmount={}, fee={}, pnl={}, portfolioValue={}, kellyMultiplier={}",
                context.getSessionKey(),
                TradeType.SELL,
                price,
                amount,
                saleValue,
                fee,
                pnl,
                portfolio.getTotalValue(),
                kellyMultiplier
        );
        return trade;
    }

    private Trade exitTriggeredStop(
            TradingSignal signal,
            double confidence,
            double price,
            Portfolio portfolio,
            ExecutionContext context
    ) {
        if (!context.stopLossEnabled() || context.getOpenPositions().isEmpty()) {
            return null;
        }
        StopLossConfig stopLoss = context.getStopLossConfig();
        double atr = currentAtr(context, stopLoss);
        if (!(atr > 0.0)) {
            return null;
        }

        for (StopLossCheck check : stopLossManager.checkStopLosses(context.getOpenPositions(), price, atr, stopLoss)) {
            if (!check.result().shouldExit()) {
                continue;
            }
            OpenPosition position = check.position();
            LotConsumption consumption = context.getLots().consumeLot(position.tradeId());
            double amount = Math.min(consumption.amount(), portfolio.getBaseBalance());
            context.untrack(position.tradeId());
            if (!(amount > 0.0)) {
                continue;
            }

            double saleValue = amount * price;
            double fee = saleValue * tradingProperties.feeRate();
            double netProceeds = saleValue - fee;
            double pnl = netProceeds - consumption.costBasis();
            boolean profitable = pnl > 0.0;
            portfolio.applySell(amount, netProceeds, price, profitable);

            Trade trade = Trade.builder()
                    .id(newTradeId())
                    .timestamp(context.currentTimestamp())
                    .type(TradeType.SELL)
                    .price(price)
                    .amount(amount)
                    .quoteAmount(saleValue)
                    .signal(signal.signal())
                    .confidence(confidence)
                    .portfolioValueAfter(portfolio.getTotalValue())
                    .costBasis(consumption.costBasis())
                    .pnl(pnl)
                    .exitReason(check.result().exitReason())
                    .build();
            context.record(trade);
            recordOutcome(context, profitable);
            checkInvariants(portfolio);

            log.info(
                    "Stop exit executed. session={}, reason={}, buyTradeId={}, stopPrice={}, price={}, amount={}, pnl={}, portfolioValue={}",
                    context.getSessionKey(),
                    check.result().exitReason().label(),
                    position.tradeId(),
                    check.result().stopLossPrice(),
                    price,
                    amount,
                    pnl,
                    portfolio.getTotalValue()
            );
            return trade;
        }
        return null;
    }

    private double kellyMultiplier(ExecutionContext context, StrategyConfig strategy) {
        if (!context.kellyEnabled()) {
            return 1.0;
        }
        KellyCriterionResult result = kellyCriterionCalculator.calculate(context.getTrades(), context.getKellyConfig());
        return kellyCriterionCalculator.kellyMultiplier(result, strategy.maxPositionFraction(), context.getKellyConfig());
    }

    private double currentAtr(ExecutionContext context, StopLossConfig stopLoss) {
        double[] atr = TechnicalIndicators.averageTrueRange(
                context.getSeries().highs(),
                context.getSeries().lows(),
                context.getSeries().closes(),
                stopLoss.atrPeriod(),
                stopLoss.useEma()
        );
        double value = TechnicalIndicators.valueAt(atr, context.getBarIndex());
        return Double.isFinite(value) ? value : 0.0;
    }

    private void recordOutcome(ExecutionContext context, boolean profitable) {
        if (context.getSessionKey() != null) {
            sessionStore.getOrCreate(context.getSessionKey()).recordOutcome(profitable);
        }
    }

    private void checkInvariants(Portfolio portfolio) {
        if (portfolio.getQuoteBalance() < -EPSILON) {
            throw new PortfolioInvariantException("quote balance went negative: " + portfolio.getQuoteBalance());
        }
        if (portfolio.getBaseBalance() < -EPSILON) {
            throw new PortfolioInvariantException("base balance went negative: " + portfolio.getBaseBalance());
        }
        if (!Double.isFinite(portfolio.getTotalValue())) {
            throw new PortfolioInvariantException("total value is not finite: " + portfolio.getTotalValue());
        }
    }

    private String newTradeId() {
        return "trade-" + UUID.randomUUID();
    }
}
