package com.prediction.market.trading_engine.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import com.prediction.market.trading_engine.cache.MarketStore;
import com.prediction.market.trading_engine.cache.PositionStore;
import com.prediction.market.trading_engine.config.TradingProperties;
import com.prediction.market.trading_engine.engine.PerpRiskEngine;
import com.prediction.market.trading_engine.engine.PerpRiskEngine.PnlSnapshot;
import com.prediction.market.trading_engine.engine.PerpRiskEngine.Settlement;
import com.prediction.market.trading_engine.entity.MarketType;
import com.prediction.market.trading_engine.entity.Money;
import com.prediction.market.trading_engine.entity.PerpMarket;
import com.prediction.market.trading_engine.entity.PerpPosition;
import com.prediction.market.trading_engine.entity.PerpStatus;
import com.prediction.market.trading_engine.entity.TradeAction;
import com.prediction.market.trading_engine.entity.TradeRecord;
import com.prediction.market.trading_engine.entity.TransactionType;
import com.prediction.market.trading_engine.exception.PositionNotFoundException;
import com.prediction.market.trading_engine.exception.ValidationException;
import com.prediction.market.trading_engine.execution.MarketExecutor;
import com.prediction.market.trading_engine.execution.MarketLockRegistry;
import com.prediction.market.trading_engine.feed.PriceFeed;
import com.prediction.market.trading_engine.repositories.TradingStore;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Periodic perp upkeep: funding settlement, mark price refresh and liquidation.
 *
 * Every operation is idempotent. A funding tick only charges whole periods that have not been charged yet,
 * and liquidation of a position that is no longer open is a no-op, so overlapping sweeps or retries never
 * double-charge. Each position is handled in its own unit of work; one failure does not stop a sweep.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PerpMaintenanceService {

    static final String LIQUIDATION_ACTOR = "liquidation-engine";

    /**
     * Outcome of one funding tick. payment is from the position's point of view: positive = paid.
     */
    public record FundingResult(String positionId, long periodsCharged, Money payment) {
        static FundingResult none(String positionId) {
            return new FundingResult(positionId, 0, Money.ZERO);
        }

        public boolean charged() {
            return periodsCharged > 0;
        }
    }

    public record RefreshResult(String ticker, Money markPrice, int positionsChecked, int liquidated) {
    }

    private final TradingStore store;
    private final LedgerService ledgerService;
    private final PerpRiskEngine riskEngine;
    private final PerpSettlement perpSettlement;
    private final MarketExecutor marketExecutor;
    private final MarketStore marketStore;
    private final PositionStore positionStore;
    private final PriceFeed priceFeed;
    private final TradingProperties properties;
    private final Clock clock;

    /**
     * Charge the funding accrued since the last tick, in whole funding periods only.
     *
     * If the owner cannot cover a funding debit the tick fails with InsufficientFundsException and
     * lastFundingAt stays put, so the next sweep retries the same periods.
     */
    public FundingResult applyFundingTick(String positionId, Instant now) {
        PerpPosition snapshot = store.findPerpPosition(positionId)
            .orElseThrow(() -> new PositionNotFoundException(positionId, "not found"));
        if (!snapshot.isOpen()) {
            return FundingResult.none(positionId);
        }

        return marketExecutor.execute(lockKeys(snapshot), () -> {
            PerpPosition position = store.findPerpPosition(positionId)
                .orElseThrow(() -> new PositionNotFoundException(positionId, "not found"));
            if (!position.isOpen()) {
                return FundingResult.none(positionId);
            }

            long intervalHours = properties.fundingIntervalHours();
            Instant since = position.getLastFundingAt() != null ? position.getLastFundingAt() : position.getOpenedAt();
            long elapsedHours = Math.max(0, Duration.between(since, now).toHours());
            long periods = elapsedHours / intervalHours;
            if (periods == 0) {
                return FundingResult.none(positionId);
            }

            PerpMarket market = store.findPerpMarket(position.getTicker())
                .orElseThrow(() -> new ValidationException("Perp market not found: " + position.getTicker()));
            Money payment = riskEngine.fundingPayment(
                Money.of(position.getSize()), market.getFundingRate(), periods * intervalHours);
            // positive rate: longs pay, shorts receive
            Money owed = position.getSide().isLong() ? payment : payment.negate();

            String owner = position.getOwnerId();
            String description = String.format("Funding %s %s, %d period(s)", position.getSide(), position.getTicker(), periods);
            if (owed.isPositive()) {
                ledgerService.debit(owner, owed, TransactionType.PERP_FUNDING, description, positionId);
            } else if (owed.isNegative()) {
                ledgerService.credit(owner, owed.abs(), TransactionType.PERP_FUNDING, description, positionId);
            }
            ledgerService.recordRealizedPnL(owner, owed.negate());

            position.setFundingPaid(Money.orZero(position.getFundingPaid()).add(owed).toBigDecimal());
            position.setLastFundingAt(since.plus(Duration.ofHours(periods * intervalHours)));
            position.transitionTo(PerpStatus.OPEN, now);
            store.savePerpPosition(position);

            log.debug("Funding for {}: {} period(s), owed {}", positionId, periods, owed);
            return new FundingResult(positionId, periods, owed);
        });
    }

    /**
     * Funding tick for every open position.
     *
     * @return number of positions charged
     */
    @Scheduled(fixedDelayString = "${trading.scheduling.funding-interval:PT1H}")
    public int runFundingSweep() {
        Instant now = clock.instant();
        int charged = 0;
        int failed = 0;

        for (String ticker : positionStore.tickers()) {
            for (String positionId : positionStore.openPerpPositionIds(ticker)) {
                try {
                    if (applyFundingTick(positionId, now).charged()) {
                        charged++;
                    }
                } catch (RuntimeException e) {
                    failed++;
                    log.error("Funding tick failed for {}: {}", positionId, e.getMessage());
                }
            }
        }

        log.info("Funding sweep complete: {} positions charged, {} failed", charged, failed);
        return charged;
    }

    /**
     * Pull the index price, update the market's mark price, then revalue every open position on the ticker
     * and liquidate the ones the mark price has crossed.
     */
    public RefreshResult refreshMarket(String ticker) {
        Optional<Money> index = priceFeed.getIndexPrice(ticker).filter(p -> p.signum() > 0).map(Money::of);
        if (index.isEmpty()) {
            log.warn("No index price for {}, skipping refresh", ticker);
            return new RefreshResult(ticker, null, 0, 0);
        }

        Money markPrice = marketExecutor.execute(List.of(MarketLockRegistry.perpKey(ticker)), () -> {
            PerpMarket market = store.findPerpMarket(ticker)
                .orElseThrow(() -> new ValidationException("Perp market not found: " + ticker));
            Money mark = riskEngine.markPrice(index.get(), Money.orZero(market.getLastTradePrice()), market.getFundingRate());
            market.setIndexPrice(index.get().toBigDecimal());
            market.setMarkPrice(mark.toBigDecimal());
            market.setUpdatedAt(clock.instant());
            store.savePerpMarket(market);
            return mark;
        });
        marketStore.reloadPerpMarket(ticker);

        int checked = 0;
        int liquidated = 0;
        for (String positionId : positionStore.openPerpPositionIds(ticker)) {
            try {
                checked++;
                if (checkLiquidation(positionId)) {
                    liquidated++;
                }
            } catch (RuntimeException e) {
                log.error("Liquidation check failed for {}: {}", positionId, e.getMessage());
            }
        }

        if (liquidated > 0) {
            log.info("Refreshed {}: mark={}, {} positions checked, {} liquidated", ticker, markPrice, checked, liquidated);
        }
        return new RefreshResult(ticker, markPrice, checked, liquidated);
    }

    /**
     * Revalue a position at its market's mark price and liquidate it if the mark has crossed the
     * liquidation price.
     *
     * @return true if this call liquidated the position; false if it is healthy or no longer open
     */
    public boolean checkLiquidation(String positionId) {
        Optional<PerpPosition> snapshot = store.findPerpPosition(positionId);
        if (snapshot.isEmpty() || !snapshot.get().isOpen()) {
            positionStore.untrack(snapshot.map(PerpPosition::getTicker).orElse(""), positionId);
            return false;
        }

        boolean liquidated = marketExecutor.execute(lockKeys(snapshot.get()), () -> {
            Instant now = clock.instant();
            PerpPosition position = store.findPerpPosition(positionId).orElseThrow();
            if (!position.isOpen()) {
                return false;
            }
            PerpMarket market = store.findPerpMarket(position.getTicker())
                .orElseThrow(() -> new ValidationException("Perp market not found: " + position.getTicker()));
            Money mark = currentMark(market);
            Money liquidationPrice = Money.of(position.getLiquidationPrice());

            if (riskEngine.shouldLiquidate(mark, liquidationPrice, position.getSide())) {
                Settlement settlement = perpSettlement.liquidate(position, now);
                store.appendTrade(TradeRecord.builder()
                    .id(UUID.randomUUID().toString())
                    .actorId(LIQUIDATION_ACTOR)
                    .poolId(position.getOwnerId())
                    .marketType(MarketType.PERPETUAL)
                    .action(TradeAction.CLOSE_PERP)
                    .ticker(position.getTicker())
                    .positionId(positionId)
                    .side(position.getSide().name())
                    .amount(settlement.payout().toBigDecimal())
                    .sharesOrSize(position.getSize())
                    .price(liquidationPrice.toBigDecimal())
                    .fee(settlement.fee().toBigDecimal())
                    .realizedPnL(settlement.realizedPnL().toBigDecimal())
                    .liquidated(true)
                    .reasoning(String.format("mark %s crossed liquidation price %s", mark, liquidationPrice))
                    .createdAt(now)
                    .build());
                log.info("Liquidated {} {} {}x {}: mark={}, liquidationPrice={}, payout={}",
                    positionId, position.getSide(), position.getLeverage(), position.getTicker(),
                    mark, liquidationPrice, settlement.payout());
                return true;
            }

            PnlSnapshot pnl = riskEngine.unrealizedPnl(
                Money.of(position.getEntryPrice()), mark, position.getSide(), Money.of(position.getSize()));
            position.setCurrentPrice(mark.toBigDecimal());
            position.setUnrealizedPnL(pnl.pnl().toBigDecimal());
            position.setUnrealizedPnLPercent(pnl.pnlPercent());
            position.transitionTo(PerpStatus.OPEN, now);
            store.savePerpPosition(position);
            return false;
        });

        if (liquidated) {
            positionStore.untrack(snapshot.get().getTicker(), positionId);
            marketStore.reloadPerpMarket(snapshot.get().getTicker());
        }
        return liquidated;
    }

    /**
     * Refresh every perp market.
     *
     * @return number of positions liquidated
     */
    @Scheduled(fixedDelayString = "${trading.scheduling.liquidation-interval:PT5S}")
    public int runLiquidationSweep() {
        int liquidated = 0;
        for (PerpMarket market : store.findAllPerpMarkets()) {
            try {
                liquidated += refreshMarket(market.getTicker()).liquidated();
            } catch (RuntimeException e) {
                log.error("Refresh failed for {}: {}", market.getTicker(), e.getMessage(), e);
            }
        }
        return liquidated;
    }

    private Money currentMark(PerpMarket market) {
        if (market.getMarkPrice() != null && market.getMarkPrice().signum() > 0) {
            return Money.of(market.getMarkPrice());
        }
        Money index = priceFeed.getIndexPrice(market.getTicker())
            .filter(p -> p.signum() > 0)
            .map(Money::of)
            .orElseThrow(() -> new ValidationException("No mark or index price for " + market.getTicker()));
        return riskEngine.markPrice(index, Money.orZero(market.getLastTradePrice()), market.getFundingRate());
    }

    private static List<String> lockKeys(PerpPosition position) {
        return List.of(
            MarketLockRegistry.poolKey(position.getOwnerId()),
            MarketLockRegistry.perpKey(position.getTicker()),
            MarketLockRegistry.positionKey(position.getId()));
    }
}
