package com.prediction.market.trading_engine.entity;

import java.math.BigDecimal;

import lombok.Builder;
import lombok.Value;

/**
 * A decision produced by an NPC brain or a user, ready for validation and execution.
 *
 * amount means: gross spend for BUY_YES/BUY_NO, margin for OPEN_LONG/OPEN_SHORT, shares for SELL.
 * Close actions ignore it.
 */
@Value
@Builder(toBuilder = true)
public class TradingDecision {
    String actorId;
    String actorName;
    String poolId;
    TradeAction action;
    MarketType marketType;

    String marketId;   // prediction markets
    String ticker;     // perpetual markets
    String positionId; // SELL, CLOSE_POSITION, CLOSE_PERP

    BigDecimal amount;
    Integer leverage;

    /**
     * Optional bound on adverse price movement, in percent (1.5 = 1.5%).
     */
    BigDecimal maxSlippagePercent;

    Double confidence;
    String reasoning;
}
