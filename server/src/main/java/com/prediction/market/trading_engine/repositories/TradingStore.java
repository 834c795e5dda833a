package com.prediction.market.trading_engine.repositories;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

import com.prediction.market.trading_engine.entity.BalanceTransaction;
import com.prediction.market.trading_engine.entity.Market;
import com.prediction.market.trading_engine.entity.Outcome;
import com.prediction.market.trading_engine.entity.PerpMarket;
import com.prediction.market.trading_engine.entity.PerpPosition;
import com.prediction.market.trading_engine.entity.Pool;
import com.prediction.market.trading_engine.entity.Position;
import com.prediction.market.trading_engine.entity.TradeRecord;

/**
 * Persistence port of the engine.
 *
 * Writes made inside {@link #inTransaction(Supplier)} become visible all at once when the outermost unit
 * returns, or not at all if it throws. A nested call joins the enclosing unit. Writes outside a unit commit
 * immediately.
 *
 * Saving a row whose version no longer matches the stored one fails with
 * {@link org.springframework.dao.OptimisticLockingFailureException}.
 */
public interface TradingStore {

    <T> T inTransaction(Supplier<T> work);

    default void inTransaction(Runnable work) {
        inTransaction(() -> {
            work.run();
            return null;
        });
    }

    // markets

    Optional<Market> findMarket(String marketId);

    List<Market> findAllMarkets();

    List<Market> findUnresolvedMarketsEndedBy(Instant now);

    Market saveMarket(Market market);

    // pools

    Optional<Pool> findPool(String poolId);

    List<Pool> findAllPools();

    Pool savePool(Pool pool);

    // prediction positions

    Optional<Position> findPosition(String positionId);

    Optional<Position> findOpenPosition(String poolId, String marketId, Outcome side);

    List<Position> findOpenPositionsByMarket(String marketId);

    Position savePosition(Position position);

    // perps

    Optional<PerpMarket> findPerpMarket(String ticker);

    List<PerpMarket> findAllPerpMarkets();

    PerpMarket savePerpMarket(PerpMarket perpMarket);

    Optional<PerpPosition> findPerpPosition(String positionId);

    List<PerpPosition> findOpenPerpPositions();

    List<PerpPosition> findOpenPerpPositionsByTicker(String ticker);

    PerpPosition savePerpPosition(PerpPosition position);

    // append-only logs

    BalanceTransaction appendTransaction(BalanceTransaction transaction);

    /**
     * Every ledger row of an account, oldest first.
     */
    List<BalanceTransaction> findTransactions(String accountId);

    /**
     * Newest ledger rows of an account, newest first.
     */
    List<BalanceTransaction> findRecentTransactions(String accountId, int limit);

    TradeRecord appendTrade(TradeRecord trade);

    List<TradeRecord> findRecentTrades(String poolId, int limit);
}
