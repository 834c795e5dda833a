package com.prediction.market.trading_engine.entity;

import java.math.BigDecimal;
import java.time.Instant;

import org.springframework.data.annotation.Version;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.MongoId;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Document(collection = "perp_markets")
@Getter
@Setter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder(toBuilder = true)
public class PerpMarket {
    @MongoId
    private String ticker;

    private String name;
    private BigDecimal indexPrice;
    private BigDecimal lastTradePrice;
    private BigDecimal markPrice;

    /**
     * Annual funding rate as a decimal (0.01 = 1% APR). Positive: longs pay shorts.
     */
    private BigDecimal fundingRate;

    @Builder.Default
    private int maxLeverage = 100;
    @Builder.Default
    private BigDecimal minOrderSize = BigDecimal.TEN;
    @Builder.Default
    private BigDecimal openInterest = BigDecimal.ZERO;

    private Instant updatedAt;

    @Version
    private Long version;
}
