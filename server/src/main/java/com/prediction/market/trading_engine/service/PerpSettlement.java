package com.prediction.market.trading_engine.service;

import java.time.Instant;

import org.springframework.stereotype.Service;

import com.prediction.market.trading_engine.engine.PerpRiskEngine;
import com.prediction.market.trading_engine.engine.PerpRiskEngine.Settlement;
import com.prediction.market.trading_engine.entity.Money;
import com.prediction.market.trading_engine.entity.PerpMarket;
import com.prediction.market.trading_engine.entity.PerpPosition;
import com.prediction.market.trading_engine.entity.PerpStatus;
import com.prediction.market.trading_engine.entity.TransactionType;
import com.prediction.market.trading_engine.repositories.TradingStore;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Closes a perp position and settles it through the ledger. Shared by explicit closes and liquidations.
 *
 * Must run inside a unit of work holding the owner pool, ticker and position locks.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PerpSettlement {

    private final TradingStore store;
    private final LedgerService ledgerService;
    private final PerpRiskEngine riskEngine;

    /**
     * Close at the index price.
     */
    public Settlement close(PerpPosition position, Money exitPrice, Instant now) {
        return settle(position, exitPrice, PerpStatus.CLOSED, TransactionType.PERP_CLOSE, now);
    }

    /**
     * Force-close at the liquidation price. The remaining margin, after the close fee, is credited.
     */
    public Settlement liquidate(PerpPosition position, Instant now) {
        Money liquidationPrice = Money.of(position.getLiquidationPrice());
        return settle(position, liquidationPrice, PerpStatus.LIQUIDATED, TransactionType.PERP_LIQUIDATION, now);
    }

    private Settlement settle(PerpPosition position, Money exitPrice, PerpStatus status,
                              TransactionType type, Instant now) {
        Money size = Money.of(position.getSize());
        Money margin = Money.of(position.getMargin());
        Settlement settlement = riskEngine.settle(
            Money.of(position.getEntryPrice()), exitPrice, position.getSide(), size, margin);

        position.transitionTo(status, now);
        position.setClosePrice(exitPrice.toBigDecimal());
        position.setCurrentPrice(exitPrice.toBigDecimal());
        position.setRealizedPnL(settlement.realizedPnL().toBigDecimal());
        position.setUnrealizedPnL(Money.ZERO.toBigDecimal());
        position.setUnrealizedPnLPercent(Money.ZERO.toBigDecimal());
        store.savePerpPosition(position);

        String owner = position.getOwnerId();
        if (settlement.payout().isPositive()) {
            ledgerService.credit(owner, settlement.payout(), type,
                String.format("%s %s %s @ %s", status == PerpStatus.LIQUIDATED ? "Liquidated" : "Closed",
                    position.getSide(), position.getTicker(), exitPrice),
                position.getId());
        }
        ledgerService.recordFee(owner, settlement.fee());
        ledgerService.recordRealizedPnL(owner, settlement.realizedPnL());

        store.findPerpMarket(position.getTicker()).ifPresent(market -> reduceOpenInterest(market, size, now));

        log.debug("Settled perp {} as {}: pnl={}, fee={}, payout={}",
            position.getId(), status, settlement.pnl(), settlement.fee(), settlement.payout());
        return settlement;
    }

    private void reduceOpenInterest(PerpMarket market, Money size, Instant now) {
        Money remaining = Money.orZero(market.getOpenInterest()).subtract(size).max(Money.ZERO);
        market.setOpenInterest(remaining.toBigDecimal());
        market.setUpdatedAt(now);
        store.savePerpMarket(market);
    }
}
