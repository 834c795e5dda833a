package com.prediction.market.trading_engine.service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import com.prediction.market.trading_engine.cache.MarketStore;
import com.prediction.market.trading_engine.entity.Market;
import com.prediction.market.trading_engine.entity.Money;
import com.prediction.market.trading_engine.entity.Outcome;
import com.prediction.market.trading_engine.entity.Position;
import com.prediction.market.trading_engine.entity.TransactionType;
import com.prediction.market.trading_engine.exception.ContentionException;
import com.prediction.market.trading_engine.exception.ValidationException;
import com.prediction.market.trading_engine.execution.MarketExecutor;
import com.prediction.market.trading_engine.execution.MarketLockRegistry;
import com.prediction.market.trading_engine.feed.PriceFeed;
import com.prediction.market.trading_engine.repositories.TradingStore;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Settles prediction markets once the outcome feed reports a result. Each winning share pays 1.00; losing
 * shares pay nothing. The market and all of its positions settle in one unit of work.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MarketResolutionService {

    private static final Money PAYOUT_PER_SHARE = Money.ONE;
    private static final int MAX_LOCK_ATTEMPTS = 3;
    private static final int ALREADY_RESOLVED = -1;
    private static final int POOLS_NOT_LOCKED = -2;

    private final TradingStore store;
    private final LedgerService ledgerService;
    private final MarketExecutor marketExecutor;
    private final MarketStore marketStore;
    private final PriceFeed priceFeed;
    private final Clock clock;

    /**
     * @return true if this call resolved the market; false if no outcome is known yet or it was already
     *     resolved
     */
    public boolean resolveMarket(String marketId) {
        Optional<Boolean> outcome = priceFeed.getResolutionOutcome(marketId);
        if (outcome.isEmpty()) {
            log.debug("No outcome yet for market {}", marketId);
            return false;
        }

        Market snapshot = store.findMarket(marketId)
            .orElseThrow(() -> new ValidationException("Market not found: " + marketId));
        if (snapshot.isResolved()) {
            return false;
        }

        Set<String> poolKeys = new TreeSet<>(poolKeys(store.findOpenPositionsByMarket(marketId)));
        Outcome winner = outcome.get() ? Outcome.YES : Outcome.NO;

        for (int attempt = 1; attempt <= MAX_LOCK_ATTEMPTS; attempt++) {
            List<String> lockKeys = new ArrayList<>(poolKeys);
            lockKeys.add(MarketLockRegistry.marketKey(marketId));

            int settled = marketExecutor.execute(lockKeys, () -> {
                Instant now = clock.instant();
                Market market = store.findMarket(marketId).orElseThrow();
                if (market.isResolved()) {
                    return ALREADY_RESOLVED;
                }

                // a pool may have opened a position after the unlocked read
                List<Position> open = store.findOpenPositionsByMarket(marketId);
                List<String> unlocked = poolKeys(open).stream()
                    .filter(key -> !lockKeys.contains(key))
                    .collect(Collectors.toList());
                if (!unlocked.isEmpty()) {
                    poolKeys.addAll(unlocked);
                    return POOLS_NOT_LOCKED;
                }

                market.setResolved(true);
                market.setOutcome(outcome.get());
                market.setUpdatedAt(now);
                store.saveMarket(market);

                for (Position position : open) {
                    settle(position, winner, now);
                }
                return open.size();
            });

            if (settled == POOLS_NOT_LOCKED) {
                log.debug("Market {} gained positions while locking, retrying with {} pools", marketId, poolKeys.size());
                continue;
            }
            if (settled == ALREADY_RESOLVED) {
                return false;
            }
            marketStore.reloadMarket(marketId);
            log.info("Market {} resolved {}: {} positions settled", marketId, winner, settled);
            return true;
        }
        throw new ContentionException(MarketLockRegistry.marketKey(marketId),
            "Open positions kept changing while resolving " + marketId);
    }

    /**
     * Try to resolve every unresolved market whose end date has passed.
     *
     * @return number of markets resolved
     */
    @Scheduled(fixedDelayString = "${trading.scheduling.resolution-interval:PT1M}")
    public int resolvePendingMarkets() {
        int resolved = 0;
        for (Market market : store.findUnresolvedMarketsEndedBy(clock.instant())) {
            try {
                if (resolveMarket(market.getId())) {
                    resolved++;
                }
            } catch (RuntimeException e) {
                log.error("Resolution failed for market {}: {}", market.getId(), e.getMessage(), e);
            }
        }
        return resolved;
    }

    private static List<String> poolKeys(List<Position> positions) {
        return positions.stream()
            .map(p -> MarketLockRegistry.poolKey(p.getPoolId()))
            .distinct()
            .collect(Collectors.toList());
    }

    private void settle(Position position, Outcome winner, Instant now) {
        Money shares = position.shareCount();
        Money payout = position.getSide() == winner ? shares.multiply(PAYOUT_PER_SHARE) : Money.ZERO;
        Money realized = payout.subtract(position.cost());

        if (payout.isPositive()) {
            ledgerService.credit(position.getPoolId(), payout, TransactionType.PREDICTION_PAYOUT,
                String.format("Payout for %s %s shares of %s", shares, position.getSide(), position.getMarketId()),
                position.getId());
        }
        ledgerService.recordRealizedPnL(position.getPoolId(), realized);

        position.setRealizedPnL(Money.orZero(position.getRealizedPnL()).add(realized).toBigDecimal());
        position.setShares(Money.ZERO.toBigDecimal());
        position.setCostBasis(Money.ZERO.toBigDecimal());
        position.setClosedAt(now);
        position.setUpdatedAt(now);
        store.savePosition(position);
    }
}
