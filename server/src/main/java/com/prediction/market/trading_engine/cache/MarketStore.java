package com.prediction.market.trading_engine.cache;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import com.prediction.market.trading_engine.entity.Market;
import com.prediction.market.trading_engine.entity.PerpMarket;
import com.prediction.market.trading_engine.repositories.TradingStore;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Read-through cache of market snapshots for previews.
 *
 * Never used for execution: trades always re-read the market inside their unit of work. Snapshots are
 * replaced after every commit that touches a market.
 */
@Slf4j
@RequiredArgsConstructor
public class MarketStore {
    private final ConcurrentHashMap<String, Market> markets = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, PerpMarket> perpMarkets = new ConcurrentHashMap<>();
    private final TradingStore store;

    public void hydrate() {
        markets.clear();
        perpMarkets.clear();
        store.findAllMarkets().forEach(m -> markets.put(m.getId(), m));
        store.findAllPerpMarkets().forEach(m -> perpMarkets.put(m.getTicker(), m));
        log.debug("Hydrated market cache: {} prediction markets, {} perp markets", markets.size(), perpMarkets.size());
    }

    public Optional<Market> getMarket(String marketId) {
        // computeIfAbsent does not cache a null result, so unknown ids keep falling through to the store
        return Optional.ofNullable(markets.computeIfAbsent(marketId,
            id -> store.findMarket(id).orElse(null)));
    }

    public Optional<PerpMarket> getPerpMarket(String ticker) {
        return Optional.ofNullable(perpMarkets.computeIfAbsent(ticker,
            t -> store.findPerpMarket(t).orElse(null)));
    }

    public void refresh(Market market) {
        markets.put(market.getId(), market);
    }

    public void refresh(PerpMarket perpMarket) {
        perpMarkets.put(perpMarket.getTicker(), perpMarket);
    }

    /**
     * Reload a prediction market from the store after a commit.
     */
    public void reloadMarket(String marketId) {
        store.findMarket(marketId).ifPresentOrElse(this::refresh, () -> markets.remove(marketId));
    }

    public void reloadPerpMarket(String ticker) {
        store.findPerpMarket(ticker).ifPresentOrElse(this::refresh, () -> perpMarkets.remove(ticker));
    }

    public int size() {
        return markets.size() + perpMarkets.size();
    }
}
