package com.prediction.market.trading_engine.entity;

import java.math.BigDecimal;
import java.time.Instant;

import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.MongoId;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Audit row for an executed decision, written in the same unit of work as the trade itself.
 */
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
@Document(collection = "trades")
@CompoundIndex(name = "pool_created_idx", def = "{'poolId':1,'createdAt':-1}")
public class TradeRecord {
    @MongoId
    private String id;

    private String actorId;
    private String poolId;
    private MarketType marketType;
    private TradeAction action;
    private String marketId;
    private String ticker;
    private String positionId;
    private String side;
    private BigDecimal amount;
    private BigDecimal sharesOrSize;
    private BigDecimal price;
    private BigDecimal fee;
    private BigDecimal realizedPnL;
    private boolean liquidated;
    private Double confidence;
    private String reasoning;
    private Instant createdAt;
}
