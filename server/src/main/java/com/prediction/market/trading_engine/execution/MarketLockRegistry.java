package com.prediction.market.trading_engine.execution;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.Objects;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

import com.prediction.market.trading_engine.exception.ContentionException;

import lombok.extern.slf4j.Slf4j;

/**
 * One fair lock per market, perp ticker, position and pool.
 *
 * Keys are always taken in sorted order, so two units that need overlapping sets cannot deadlock; waiting
 * is bounded by the lock timeout either way.
 *
 * An entry lives only while some thread holds or waits for its key. The count is changed inside
 * {@code compute}, so a key never has two lock instances in use at once.
 */
@Slf4j
public class MarketLockRegistry {

    private static final class Entry {
        private final ReentrantLock lock = new ReentrantLock(true);
        private int users; // holders and waiters, guarded by the map bin
    }

    private final ConcurrentHashMap<String, Entry> locks = new ConcurrentHashMap<>();
    private final Duration lockTimeout;

    public MarketLockRegistry(Duration lockTimeout) {
        this.lockTimeout = lockTimeout;
    }

    public static String poolKey(String poolId) {
        return "pool:" + poolId;
    }

    public static String marketKey(String marketId) {
        return "market:" + marketId;
    }

    public static String positionKey(String positionId) {
        return "position:" + positionId;
    }

    public static String perpKey(String ticker) {
        return "perp:" + ticker;
    }

    /**
     * Run {@code work} while holding every lock in {@code keys}. Null keys are ignored.
     *
     * @throws ContentionException if any lock is not acquired within the timeout
     */
    public <T> T withLocks(Collection<String> keys, Supplier<T> work) {
        TreeSet<String> ordered = new TreeSet<>();
        keys.stream().filter(Objects::nonNull).forEach(ordered::add);

        Deque<String> held = new ArrayDeque<>();
        try {
            for (String key : ordered) {
                Entry entry = retain(key);
                boolean acquired = false;
                try {
                    acquired = tryAcquire(entry.lock);
                } finally {
                    if (!acquired) {
                        release(key);
                    }
                }
                if (!acquired) {
                    log.warn("Lock timeout on {} after {}ms", key, lockTimeout.toMillis());
                    throw new ContentionException(key,
                        String.format("Timed out after %dms waiting for %s", lockTimeout.toMillis(), key));
                }
                held.push(key);
            }
            return work.get();
        } finally {
            while (!held.isEmpty()) {
                String key = held.pop();
                locks.get(key).lock.unlock();
                release(key);
            }
        }
    }

    private Entry retain(String key) {
        return locks.compute(key, (k, entry) -> {
            Entry retained = entry != null ? entry : new Entry();
            retained.users++;
            return retained;
        });
    }

    private void release(String key) {
        locks.computeIfPresent(key, (k, entry) -> --entry.users == 0 ? null : entry);
    }

    private boolean tryAcquire(ReentrantLock lock) {
        try {
            return lock.tryLock(lockTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ContentionException(null, "Interrupted while waiting for a lock", e);
        }
    }

    int size() {
        return locks.size();
    }
}
