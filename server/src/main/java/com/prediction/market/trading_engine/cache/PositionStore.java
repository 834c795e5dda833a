package com.prediction.market.trading_engine.cache;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import com.prediction.market.trading_engine.entity.PerpPosition;
import com.prediction.market.trading_engine.repositories.TradingStore;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Index of open perp position ids per ticker, used by the funding and liquidation sweeps to find their
 * candidates without scanning the store. The sweeps re-read each position under its lock, so a stale
 * entry costs a lookup and nothing else.
 */
@Slf4j
@RequiredArgsConstructor
public class PositionStore {
    private final ConcurrentHashMap<String, Set<String>> openPerpsByTicker = new ConcurrentHashMap<>();
    private final TradingStore store;

    public void hydrate() {
        openPerpsByTicker.clear();
        store.findOpenPerpPositions().forEach(this::track);
        log.debug("Hydrated position index: {} open perp positions", openPerpCount());
    }

    public void track(PerpPosition position) {
        openPerpsByTicker
            .computeIfAbsent(position.getTicker(), t -> ConcurrentHashMap.newKeySet())
            .add(position.getId());
    }

    public void untrack(String ticker, String positionId) {
        Set<String> ids = openPerpsByTicker.get(ticker);
        if (ids != null) {
            ids.remove(positionId);
        }
    }

    public Set<String> openPerpPositionIds(String ticker) {
        return Set.copyOf(openPerpsByTicker.getOrDefault(ticker, Set.of()));
    }

    public Set<String> tickers() {
        return Set.copyOf(openPerpsByTicker.keySet());
    }

    public int openPerpCount() {
        return openPerpsByTicker.values().stream().mapToInt(Set::size).sum();
    }
}
