package com.prediction.market.trading_engine.entity;

import java.math.BigDecimal;
import java.time.Instant;

import org.springframework.data.annotation.Version;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.MongoId;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Shares a pool holds on one side of a prediction market.
 * At most one open position per (pool, market, side); closed rows are kept for history.
 */
@Document(collection = "positions")
@CompoundIndex(name = "pool_market_side_idx", def = "{'poolId':1,'marketId':1,'side':1,'closedAt':1}")
@Getter
@Setter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder(toBuilder = true)
public class Position {
    @MongoId
    private String id;

    private String poolId;
    private String marketId;
    private Outcome side;

    @Builder.Default
    private BigDecimal shares = BigDecimal.ZERO;

    /**
     * Amount paid for the current shares, net of the buy fee.
     */
    @Builder.Default
    private BigDecimal costBasis = BigDecimal.ZERO;

    @Builder.Default
    private BigDecimal realizedPnL = BigDecimal.ZERO;

    private Instant openedAt;
    private Instant closedAt;
    private Instant updatedAt;

    @Version
    private Long version;

    public boolean isOpen() {
        return closedAt == null;
    }

    public Money shareCount() {
        return Money.orZero(shares);
    }

    public Money cost() {
        return Money.orZero(costBasis);
    }
}
