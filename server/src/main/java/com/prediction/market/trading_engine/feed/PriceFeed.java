package com.prediction.market.trading_engine.feed;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Source of perp index prices and prediction market outcomes.
 */
public interface PriceFeed {

    Optional<BigDecimal> getIndexPrice(String ticker);

    /**
     * Empty until the market's outcome is known; true means YES won.
     */
    Optional<Boolean> getResolutionOutcome(String marketId);
}
