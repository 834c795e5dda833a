package com.prediction.market.trading_engine.entity;

import java.math.BigDecimal;
import java.time.Instant;

import org.springframework.data.annotation.Version;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.MongoId;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Leveraged perpetual position. size is the USD notional (margin * leverage).
 *
 * liquidationPrice must be recomputed whenever entryPrice or leverage changes.
 */
@Document(collection = "perp_positions")
@CompoundIndex(name = "ticker_status_idx", def = "{'ticker':1,'status':1}")
@Getter
@Setter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder(toBuilder = true)
public class PerpPosition {
    @MongoId
    private String id;

    @Indexed
    private String ownerId; // pool id

    private String ticker;
    private PerpSide side;

    @Builder.Default
    private PerpStatus status = PerpStatus.OPENING;

    private BigDecimal entryPrice;
    private BigDecimal currentPrice;
    private BigDecimal size;
    private BigDecimal margin;
    private int leverage;
    private BigDecimal liquidationPrice;

    @Builder.Default
    private BigDecimal unrealizedPnL = BigDecimal.ZERO;
    @Builder.Default
    private BigDecimal unrealizedPnLPercent = BigDecimal.ZERO;

    /**
     * Cumulative funding settled through the ledger. Positive = paid by this position.
     */
    @Builder.Default
    private BigDecimal fundingPaid = BigDecimal.ZERO;

    private BigDecimal realizedPnL;
    private BigDecimal closePrice;

    private Instant openedAt;
    private Instant lastUpdated;
    private Instant lastFundingAt;
    private Instant closedAt;

    @Version
    private Long version;

    /**
     * Move to a new status, rejecting transitions the state machine does not allow.
     *
     * @throws IllegalStateException if the transition is invalid
     */
    public void transitionTo(PerpStatus newStatus, Instant at) {
        if (!this.status.canTransitionTo(newStatus)) {
            throw new IllegalStateException(
                String.format("Invalid perp position transition: %s → %s (positionId=%s)",
                    this.status, newStatus, this.id)
            );
        }

        this.status = newStatus;
        this.lastUpdated = at;

        if (newStatus.isTerminal()) {
            this.closedAt = at;
        }
    }

    public boolean isOpen() {
        return status == PerpStatus.OPEN;
    }
}
