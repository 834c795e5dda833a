package com.prediction.market.trading_engine.entity;

import java.math.BigDecimal;
import java.time.Instant;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ExecutedTrade {
    String tradeId;
    String actorId;
    String poolId;
    MarketType marketType;
    TradeAction action;
    String marketId;
    String ticker;
    String positionId;
    String side;

    /**
     * Debited for buys and opens, credited for sells, closes and liquidations.
     */
    BigDecimal amountCharged;

    /**
     * Shares for prediction trades, USD notional for perps.
     */
    BigDecimal sharesOrSize;

    BigDecimal fee;
    BigDecimal executionPrice;
    BigDecimal realizedPnL; // null on buys and opens
    boolean liquidated;
    Instant executedAt;
}
