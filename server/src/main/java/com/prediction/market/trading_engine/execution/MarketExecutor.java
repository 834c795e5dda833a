package com.prediction.market.trading_engine.execution;

import java.util.Collection;
import java.util.function.Supplier;

import org.springframework.dao.TransientDataAccessException;

import com.prediction.market.trading_engine.exception.ContentionException;
import com.prediction.market.trading_engine.repositories.TradingStore;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs one unit of work: lock the keys it touches, open a store transaction, read-quote-write, commit.
 *
 * Write conflicts the store detects (stale versions, transient transaction aborts) surface as
 * {@link ContentionException}; every other failure propagates unchanged after the rollback.
 */
@Slf4j
@RequiredArgsConstructor
public class MarketExecutor {

    private final MarketLockRegistry lockRegistry;
    private final TradingStore store;

    public <T> T execute(Collection<String> lockKeys, Supplier<T> work) {
        try {
            return lockRegistry.withLocks(lockKeys, () -> store.inTransaction(work));
        } catch (TransientDataAccessException e) {
            // includes OptimisticLockingFailureException
            log.warn("Write conflict on {}: {}", lockKeys, e.getMessage());
            throw new ContentionException(String.join(",", lockKeys), "Concurrent update, retry later", e);
        }
    }
}
