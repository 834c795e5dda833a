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
 * Immutable ledger row. balanceAfter = balanceBefore + amount, always.
 */
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
@Document(collection = "balance_transactions")
@CompoundIndex(name = "account_sequence_idx", def = "{'accountId':1,'sequence':1}", unique = true)
public class BalanceTransaction {
    @MongoId
    private String id;

    private String accountId;

    /**
     * Per-account, gap-free ordering of ledger rows.
     */
    private long sequence;

    private TransactionType type;
    private BigDecimal amount; // positive for credit, negative for debit
    private BigDecimal balanceBefore;
    private BigDecimal balanceAfter;
    private String relatedId; // position or market the row belongs to
    private String description;
    private Instant createdAt;
}
