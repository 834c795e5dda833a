package com.prediction.market.trading_engine.entity;

import java.math.BigDecimal;
import java.time.Instant;

import org.springframework.data.annotation.Version;
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
 * Collateral account an actor trades from. The pool id is the ledger account id.
 *
 * availableBalance is only ever written by LedgerService, together with the
 * BalanceTransaction row that explains the change.
 */
@Document(collection = "pools")
@Getter
@Setter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder(toBuilder = true)
public class Pool {
    @MongoId
    private String id;

    @Indexed
    private String ownerId;

    private String name;

    @Builder.Default
    private BigDecimal availableBalance = BigDecimal.ZERO;
    @Builder.Default
    private BigDecimal totalDeposits = BigDecimal.ZERO;
    @Builder.Default
    private BigDecimal totalWithdrawals = BigDecimal.ZERO;
    @Builder.Default
    private BigDecimal lifetimePnL = BigDecimal.ZERO;
    @Builder.Default
    private BigDecimal totalFeesCollected = BigDecimal.ZERO;

    /**
     * Sequence number of the last BalanceTransaction written for this pool.
     */
    private long ledgerSequence;

    @Builder.Default
    private boolean active = true;

    private Instant createdAt;
    private Instant updatedAt;

    @Version
    private Long version;

    public Money balance() {
        return Money.orZero(availableBalance);
    }
}
