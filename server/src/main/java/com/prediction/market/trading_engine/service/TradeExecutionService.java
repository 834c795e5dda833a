package com.prediction.market.trading_engine.service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import org.springframework.stereotype.Service;

import com.prediction.market.trading_engine.cache.MarketStore;
import com.prediction.market.trading_engine.cache.PositionStore;
import com.prediction.market.trading_engine.engine.PerpRiskEngine;
import com.prediction.market.trading_engine.engine.PerpRiskEngine.Settlement;
import com.prediction.market.trading_engine.engine.PredictionPricingEngine;
import com.prediction.market.trading_engine.engine.PredictionPricingEngine.BuyQuote;
import com.prediction.market.trading_engine.engine.PredictionPricingEngine.SellQuote;
import com.prediction.market.trading_engine.entity.ExecutedTrade;
import com.prediction.market.trading_engine.entity.ExecutionResult;
import com.prediction.market.trading_engine.entity.Market;
import com.prediction.market.trading_engine.entity.MarketType;
import com.prediction.market.trading_engine.entity.Money;
import com.prediction.market.trading_engine.entity.Outcome;
import com.prediction.market.trading_engine.entity.PerpMarket;
import com.prediction.market.trading_engine.entity.PerpPosition;
import com.prediction.market.trading_engine.entity.PerpSide;
import com.prediction.market.trading_engine.entity.PerpStatus;
import com.prediction.market.trading_engine.entity.Position;
import com.prediction.market.trading_engine.entity.TradeAction;
import com.prediction.market.trading_engine.entity.TradeRecord;
import com.prediction.market.trading_engine.entity.TradingDecision;
import com.prediction.market.trading_engine.entity.TransactionType;
import com.prediction.market.trading_engine.exception.InsufficientFundsException;
import com.prediction.market.trading_engine.exception.InvalidTradeException;
import com.prediction.market.trading_engine.exception.PositionNotFoundException;
import com.prediction.market.trading_engine.exception.SlippageExceededException;
import com.prediction.market.trading_engine.exception.TradeException;
import com.prediction.market.trading_engine.exception.ValidationException;
import com.prediction.market.trading_engine.execution.MarketExecutor;
import com.prediction.market.trading_engine.execution.MarketLockRegistry;
import com.prediction.market.trading_engine.feed.PriceFeed;
import com.prediction.market.trading_engine.repositories.TradingStore;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Trade execution service - turns a TradingDecision into balance, reserve and position changes.
 *
 * Decision Flow:
 * 1. Validate without mutation (DecisionValidator)
 * 2. Lock pool, market/ticker and position keys (MarketLockRegistry, sorted, bounded wait)
 * 3. Re-read state inside the unit of work and quote with the pure engines
 * 4. Check funds, then slippage
 * 5. Apply reserves/position, ledger row, fee and PnL counters, trade record
 * 6. Commit, then refresh the hot-path caches
 *
 * CRITICAL PROPERTIES:
 * - Atomic: steps 3-5 commit together or not at all
 * - Validated: nothing is locked or written for a rejected decision
 * - No partial fills
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TradeExecutionService {

    private final TradingStore store;
    private final LedgerService ledgerService;
    private final DecisionValidator validator;
    private final PredictionPricingEngine pricingEngine;
    private final PerpRiskEngine riskEngine;
    private final PerpSettlement perpSettlement;
    private final MarketExecutor marketExecutor;
    private final MarketStore marketStore;
    private final PositionStore positionStore;
    private final PriceFeed priceFeed;
    private final Clock clock;

    private volatile boolean initialized;

    /**
     * Load the market cache and the open-position index. Must run once before any decision is executed.
     */
    public synchronized void initialize() {
        marketStore.hydrate();
        positionStore.hydrate();
        initialized = true;
        log.info("Trade execution initialized: {} markets cached, {} open perp positions",
            marketStore.size(), positionStore.openPerpCount());
    }

    public boolean isInitialized() {
        return initialized;
    }

    /**
     * Execute one decision.
     *
     * @throws TradeException describing why the decision was not executed; nothing was written
     */
    public ExecutedTrade executeSingleDecision(TradingDecision decision) {
        requireInitialized();

        try {
            MarketType marketType = validator.validate(decision);

            ExecutedTrade trade = switch (decision.getAction()) {
                case BUY_YES -> buy(decision, Outcome.YES);
                case BUY_NO -> buy(decision, Outcome.NO);
                case SELL -> sell(decision, false);
                case CLOSE_POSITION -> marketType == MarketType.PERPETUAL ? closePerp(decision) : sell(decision, true);
                case OPEN_LONG -> openPerp(decision, PerpSide.LONG);
                case OPEN_SHORT -> openPerp(decision, PerpSide.SHORT);
                case CLOSE_PERP -> closePerp(decision);
                case HOLD -> throw new ValidationException("HOLD decisions are not executable");
            };

            log.info("Trade executed: tradeId={}, actor={}, pool={}, action={}, target={}, amount={}, fee={}, price={}",
                trade.getTradeId(), trade.getActorId(), trade.getPoolId(), trade.getAction().getWireName(),
                trade.getMarketType() == MarketType.PERPETUAL ? trade.getTicker() : trade.getMarketId(),
                trade.getAmountCharged(), trade.getFee(), trade.getExecutionPrice());
            return trade;
        } catch (TradeException e) {
            log.warn("Decision rejected: actor={}, action={}, retryable={}, reason={}",
                decision == null ? null : decision.getActorId(),
                decision == null ? null : decision.getAction(), e.isRetryable(), e.getMessage());
            throw e;
        }
    }

    /**
     * Execute decisions one by one. A failed decision is recorded and the batch moves on.
     */
    public ExecutionResult executeDecisionBatch(List<TradingDecision> decisions) {
        requireInitialized();
        ExecutionResult result = new ExecutionResult(decisions.size());

        for (TradingDecision decision : decisions) {
            if (decision != null && decision.getAction() == TradeAction.HOLD) {
                result.recordHold();
                continue;
            }
            try {
                result.recordSuccess(executeSingleDecision(decision));
            } catch (TradeException e) {
                result.recordFailure(decision, e.getMessage(), e.isRetryable());
            } catch (RuntimeException e) {
                log.error("Decision failed unexpectedly: actor={}, error={}",
                    decision == null ? null : decision.getActorId(), e.getMessage(), e);
                result.recordFailure(decision, e.getMessage(), false);
            }
        }

        log.info("Batch complete: {} decisions, {} executed, {} failed, {} holds",
            result.getTotalDecisions(), result.getSuccessfulTrades(), result.getFailedTrades(),
            result.getHoldDecisions());
        return result;
    }

    private ExecutedTrade buy(TradingDecision decision, Outcome side) {
        String poolId = decision.getPoolId();
        String marketId = decision.getMarketId();
        Money amount = Money.of(decision.getAmount());

        ExecutedTrade trade = marketExecutor.execute(
            List.of(MarketLockRegistry.poolKey(poolId), MarketLockRegistry.marketKey(marketId)),
            () -> {
                Instant now = clock.instant();
                Market market = validator.requireMarket(marketId);
                validator.requireTradable(market);

                Money yes = Money.of(market.getYesReserve());
                Money no = Money.of(market.getNoReserve());
                Money marginal = pricingEngine.marginalPrice(yes, no, side);
                BuyQuote quote = pricingEngine.quoteBuy(market, side, amount);

                requireFunds(poolId, amount);
                checkSlippage(decision.getMaxSlippagePercent(), marginal, quote.averagePrice(), true);

                market.setYesReserve(quote.newYesReserve());
                market.setNoReserve(quote.newNoReserve());
                market.setUpdatedAt(now);
                store.saveMarket(market);

                Position position = store.findOpenPosition(poolId, marketId, side)
                    .orElseGet(() -> Position.builder()
                        .id(UUID.randomUUID().toString())
                        .poolId(poolId)
                        .marketId(marketId)
                        .side(side)
                        .openedAt(now)
                        .build());
                position.setShares(position.shareCount().add(quote.sharesOut()).toBigDecimal());
                position.setCostBasis(position.cost().add(quote.netAmount()).toBigDecimal());
                position.setUpdatedAt(now);
                store.savePosition(position);

                ledgerService.debit(poolId, amount, TransactionType.PREDICTION_BUY,
                    String.format("Bought %s %s shares of %s", quote.sharesOut(), side, marketId), position.getId());
                ledgerService.recordFee(poolId, quote.fee());

                return record(decision, MarketType.PREDICTION, now, ExecutedTrade.builder()
                    .marketId(marketId)
                    .positionId(position.getId())
                    .side(side.name())
                    .amountCharged(amount.toBigDecimal())
                    .sharesOrSize(quote.sharesOut().toBigDecimal())
                    .fee(quote.fee().toBigDecimal())
                    .executionPrice(quote.averagePrice().toBigDecimal()));
            });

        marketStore.reloadMarket(marketId);
        return trade;
    }

    /**
     * Sell part of a prediction position, or all of it when {@code closeAll}. The cost basis is released
     * pro rata to the shares sold.
     */
    private ExecutedTrade sell(TradingDecision decision, boolean closeAll) {
        String poolId = decision.getPoolId();
        String positionId = decision.getPositionId();
        // the market id is needed for the lock; the position is re-read and re-checked under it
        String marketId = validator.requireOpenPosition(positionId, poolId).getMarketId();

        ExecutedTrade trade = marketExecutor.execute(
            List.of(MarketLockRegistry.poolKey(poolId), MarketLockRegistry.marketKey(marketId),
                MarketLockRegistry.positionKey(positionId)),
            () -> {
                Instant now = clock.instant();
                Position position = store.findPosition(positionId)
                    .orElseThrow(() -> new PositionNotFoundException(positionId, "not found"));
                validator.checkOpenPosition(position, poolId);

                Money held = position.shareCount();
                Money shares = closeAll ? held : Money.of(decision.getAmount());
                validator.requireSellableShares(position, shares);

                Market market = validator.requireMarket(marketId);
                validator.requireTradable(market);

                Outcome side = position.getSide();
                Money marginal = pricingEngine.marginalPrice(
                    Money.of(market.getYesReserve()), Money.of(market.getNoReserve()), side);
                SellQuote quote = pricingEngine.quoteSell(market, side, shares);
                checkSlippage(decision.getMaxSlippagePercent(), marginal, quote.averagePrice(), false);

                boolean fullExit = shares.equals(held);
                Money releasedCost = fullExit
                    ? position.cost()
                    : Money.of(position.cost().toBigDecimal().multiply(shares.toBigDecimal())
                        .divide(held.toBigDecimal(), Money.SCALE, Money.ROUNDING_MODE));
                Money realized = quote.netProceeds().subtract(releasedCost);

                market.setYesReserve(quote.newYesReserve());
                market.setNoReserve(quote.newNoReserve());
                market.setUpdatedAt(now);
                store.saveMarket(market);

                position.setShares(held.subtract(shares).toBigDecimal());
                position.setCostBasis(position.cost().subtract(releasedCost).toBigDecimal());
                position.setRealizedPnL(Money.orZero(position.getRealizedPnL()).add(realized).toBigDecimal());
                position.setUpdatedAt(now);
                if (fullExit) {
                    position.setShares(Money.ZERO.toBigDecimal());
                    position.setCostBasis(Money.ZERO.toBigDecimal());
                    position.setClosedAt(now);
                }
                store.savePosition(position);

                if (quote.netProceeds().isPositive()) {
                    ledgerService.credit(poolId, quote.netProceeds(), TransactionType.PREDICTION_SELL,
                        String.format("Sold %s %s shares of %s", shares, side, marketId), positionId);
                }
                ledgerService.recordFee(poolId, quote.fee());
                ledgerService.recordRealizedPnL(poolId, realized);

                return record(decision, MarketType.PREDICTION, now, ExecutedTrade.builder()
                    .marketId(marketId)
                    .positionId(positionId)
                    .side(side.name())
                    .amountCharged(quote.netProceeds().toBigDecimal())
                    .sharesOrSize(shares.toBigDecimal())
                    .fee(quote.fee().toBigDecimal())
                    .executionPrice(quote.averagePrice().toBigDecimal())
                    .realizedPnL(realized.toBigDecimal()));
            });

        marketStore.reloadMarket(marketId);
        return trade;
    }

    private ExecutedTrade openPerp(TradingDecision decision, PerpSide side) {
        String poolId = decision.getPoolId();
        String ticker = decision.getTicker();
        Money margin = Money.of(decision.getAmount());
        int leverage = validator.leverageOf(decision);

        ExecutedTrade trade = marketExecutor.execute(
            List.of(MarketLockRegistry.poolKey(poolId), MarketLockRegistry.perpKey(ticker)),
            () -> {
                Instant now = clock.instant();
                PerpMarket market = validator.requirePerpMarket(ticker);
                validator.requireLeverage(leverage, market);

                Money indexPrice = indexPrice(ticker);
                Money markPrice = riskEngine.markPrice(
                    indexPrice, Money.orZero(market.getLastTradePrice()), market.getFundingRate());

                Money size = riskEngine.positionSize(margin, leverage);
                Money fee = riskEngine.tradingFee(size);
                Money required = margin.add(fee);

                requireFunds(poolId, required);
                checkSlippage(decision.getMaxSlippagePercent(), markPrice, indexPrice, side.isLong());

                PerpPosition position = PerpPosition.builder()
                    .id(UUID.randomUUID().toString())
                    .ownerId(poolId)
                    .ticker(ticker)
                    .side(side)
                    .status(PerpStatus.OPENING)
                    .entryPrice(indexPrice.toBigDecimal())
                    .currentPrice(indexPrice.toBigDecimal())
                    .size(size.toBigDecimal())
                    .margin(margin.toBigDecimal())
                    .leverage(leverage)
                    .liquidationPrice(riskEngine.liquidationPrice(indexPrice, side, leverage).toBigDecimal())
                    .openedAt(now)
                    .lastFundingAt(now)
                    .build();
                position.transitionTo(PerpStatus.OPEN, now);
                store.savePerpPosition(position);

                ledgerService.debit(poolId, required, TransactionType.PERP_OPEN,
                    String.format("Opened %dx %s %s, size %s @ %s", leverage, side, ticker, size, indexPrice),
                    position.getId());
                ledgerService.recordFee(poolId, fee);

                market.setLastTradePrice(indexPrice.toBigDecimal());
                market.setIndexPrice(indexPrice.toBigDecimal());
                market.setMarkPrice(riskEngine.markPrice(indexPrice, indexPrice, market.getFundingRate()).toBigDecimal());
                market.setOpenInterest(Money.orZero(market.getOpenInterest()).add(size).toBigDecimal());
                market.setUpdatedAt(now);
                store.savePerpMarket(market);

                return record(decision, MarketType.PERPETUAL, now, ExecutedTrade.builder()
                    .ticker(ticker)
                    .positionId(position.getId())
                    .side(side.name())
                    .amountCharged(required.toBigDecimal())
                    .sharesOrSize(size.toBigDecimal())
                    .fee(fee.toBigDecimal())
                    .executionPrice(indexPrice.toBigDecimal()));
            });

        positionStore.track(store.findPerpPosition(trade.getPositionId()).orElseThrow());
        marketStore.reloadPerpMarket(ticker);
        return trade;
    }

    /**
     * Close a perp at the index price, or liquidate it if the mark price has already crossed its
     * liquidation price.
     */
    private ExecutedTrade closePerp(TradingDecision decision) {
        String poolId = decision.getPoolId();
        String positionId = decision.getPositionId();
        String ticker = validator.requireOpenPerpPosition(positionId, poolId).getTicker();

        ExecutedTrade trade = marketExecutor.execute(
            List.of(MarketLockRegistry.poolKey(poolId), MarketLockRegistry.perpKey(ticker),
                MarketLockRegistry.positionKey(positionId)),
            () -> {
                Instant now = clock.instant();
                PerpPosition position = store.findPerpPosition(positionId)
                    .orElseThrow(() -> new PositionNotFoundException(positionId, "not found"));
                validator.checkOpenPerpPosition(position, poolId);

                PerpMarket market = validator.requirePerpMarket(ticker);
                Money indexPrice = indexPrice(ticker);
                Money markPrice = riskEngine.markPrice(
                    indexPrice, Money.orZero(market.getLastTradePrice()), market.getFundingRate());
                Money liquidationPrice = Money.of(position.getLiquidationPrice());
                PerpSide side = position.getSide();

                boolean liquidated = riskEngine.shouldLiquidate(markPrice, liquidationPrice, side);
                Settlement settlement;
                Money exitPrice;
                if (liquidated) {
                    log.warn("Close of {} executed as liquidation: mark={} crossed liquidationPrice={}",
                        positionId, markPrice, liquidationPrice);
                    settlement = perpSettlement.liquidate(position, now);
                    exitPrice = liquidationPrice;
                } else {
                    // closing a long sells, closing a short buys
                    checkSlippage(decision.getMaxSlippagePercent(), markPrice, indexPrice, !side.isLong());
                    settlement = perpSettlement.close(position, indexPrice, now);
                    exitPrice = indexPrice;

                    PerpMarket updated = validator.requirePerpMarket(ticker);
                    updated.setLastTradePrice(indexPrice.toBigDecimal());
                    updated.setIndexPrice(indexPrice.toBigDecimal());
                    updated.setUpdatedAt(now);
                    store.savePerpMarket(updated);
                }

                return record(decision, MarketType.PERPETUAL, now, ExecutedTrade.builder()
                    .ticker(ticker)
                    .positionId(positionId)
                    .side(side.name())
                    .amountCharged(settlement.payout().toBigDecimal())
                    .sharesOrSize(position.getSize())
                    .fee(settlement.fee().toBigDecimal())
                    .executionPrice(exitPrice.toBigDecimal())
                    .realizedPnL(settlement.realizedPnL().toBigDecimal())
                    .liquidated(liquidated));
            });

        positionStore.untrack(ticker, positionId);
        marketStore.reloadPerpMarket(ticker);
        return trade;
    }

    private ExecutedTrade record(TradingDecision decision, MarketType marketType, Instant now,
                                 ExecutedTrade.ExecutedTradeBuilder builder) {
        ExecutedTrade trade = builder
            .tradeId(UUID.randomUUID().toString())
            .actorId(decision.getActorId())
            .poolId(decision.getPoolId())
            .marketType(marketType)
            .action(decision.getAction())
            .executedAt(now)
            .build();

        store.appendTrade(TradeRecord.builder()
            .id(trade.getTradeId())
            .actorId(trade.getActorId())
            .poolId(trade.getPoolId())
            .marketType(marketType)
            .action(trade.getAction())
            .marketId(trade.getMarketId())
            .ticker(trade.getTicker())
            .positionId(trade.getPositionId())
            .side(trade.getSide())
            .amount(trade.getAmountCharged())
            .sharesOrSize(trade.getSharesOrSize())
            .price(trade.getExecutionPrice())
            .fee(trade.getFee())
            .realizedPnL(trade.getRealizedPnL())
            .liquidated(trade.isLiquidated())
            .confidence(decision.getConfidence())
            .reasoning(decision.getReasoning())
            .createdAt(now)
            .build());
        return trade;
    }

    private void requireFunds(String poolId, Money required) {
        Money balance = ledgerService.getBalance(poolId);
        if (balance.isLessThan(required)) {
            throw new InsufficientFundsException(poolId, required, balance);
        }
    }

    private Money indexPrice(String ticker) {
        return priceFeed.getIndexPrice(ticker)
            .filter(p -> p.signum() > 0)
            .map(Money::of)
            .orElseThrow(() -> new InvalidTradeException("No index price available for " + ticker));
    }

    /**
     * Reject a fill that is worse than {@code reference} by more than {@code maxPercent}. Favorable
     * movement never counts.
     */
    static void checkSlippage(BigDecimal maxPercent, Money reference, Money fill, boolean higherIsWorse) {
        if (maxPercent == null) {
            return;
        }
        Money adverse = higherIsWorse ? fill.subtract(reference) : reference.subtract(fill);
        if (!adverse.isPositive()) {
            return;
        }
        BigDecimal actual = adverse.percentOf(reference);
        if (actual.compareTo(maxPercent) > 0) {
            throw new SlippageExceededException(maxPercent, actual);
        }
    }

    private void requireInitialized() {
        if (!initialized) {
            throw new IllegalStateException("TradeExecutionService.initialize() has not been called");
        }
    }
}
