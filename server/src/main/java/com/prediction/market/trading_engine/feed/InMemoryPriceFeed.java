package com.prediction.market.trading_engine.feed;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import lombok.extern.slf4j.Slf4j;

/**
 * Feed whose prices and outcomes are pushed in by hand (local runs, simulations, tests).
 */
@Slf4j
public class InMemoryPriceFeed implements PriceFeed {
    private final ConcurrentHashMap<String, BigDecimal> indexPrices = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Boolean> outcomes = new ConcurrentHashMap<>();

    @Override
    public Optional<BigDecimal> getIndexPrice(String ticker) {
        return Optional.ofNullable(indexPrices.get(ticker));
    }

    @Override
    public Optional<Boolean> getResolutionOutcome(String marketId) {
        return Optional.ofNullable(outcomes.get(marketId));
    }

    public void setIndexPrice(String ticker, BigDecimal price) {
        if (price == null || price.signum() <= 0) {
            throw new IllegalArgumentException("Index price must be positive: " + price);
        }
        indexPrices.put(ticker, price);
        log.debug("Index price for {} set to {}", ticker, price);
    }

    public void resolve(String marketId, boolean yesWon) {
        outcomes.put(marketId, yesWon);
        log.debug("Outcome for market {} set to {}", marketId, yesWon ? "YES" : "NO");
    }
}
