package com.prediction.market.trading_engine.entity;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;

import org.springframework.data.annotation.Version;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.MongoId;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Binary prediction market priced by a constant-product market maker.
 * yesReserve * noReserve stays constant across trades until resolution.
 */
@Document(collection = "markets")
@Getter
@Setter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder(toBuilder = true)
public class Market {
    @MongoId
    private String id;

    private String question;
    // PredictionPricingEngine.RESERVE_SCALE decimals, not Money's
    private BigDecimal yesReserve;
    private BigDecimal noReserve;
    private BigDecimal liquidityParam; // initial yes + no liquidity

    /**
     * k = yesReserve * noReserve, fixed at creation and never rounded. Quotes solve against it so that
     * reserve rounding cannot accumulate from trade to trade.
     */
    private BigDecimal constantProduct;
    private boolean resolved;
    private Boolean outcome; // null until resolved
    private Instant endDate;
    private Instant createdAt;
    private Instant updatedAt;

    @Version
    private Long version;

    public BigDecimal invariant() {
        return constantProduct != null ? constantProduct : yesReserve.multiply(noReserve);
    }

    public boolean isExpired(Instant now) {
        return endDate != null && !now.isBefore(endDate);
    }

    public Optional<Outcome> winningOutcome() {
        if (!resolved || outcome == null) {
            return Optional.empty();
        }
        return Optional.of(outcome ? Outcome.YES : Outcome.NO);
    }
}
