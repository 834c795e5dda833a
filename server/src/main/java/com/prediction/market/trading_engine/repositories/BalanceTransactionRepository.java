package com.prediction.market.trading_engine.repositories;

import java.util.List;

import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import com.prediction.market.trading_engine.entity.BalanceTransaction;

/**
 * Append-only ledger. Rows are inserted, never updated.
 */
@Repository
public interface BalanceTransactionRepository extends MongoRepository<BalanceTransaction, String> {

    /**
     * Full history of an account in ledger order. O(n), reconciliation only.
     */
    List<BalanceTransaction> findByAccountIdOrderBySequenceAsc(String accountId);

    List<BalanceTransaction> findByAccountIdOrderBySequenceDesc(String accountId, Pageable pageable);
}
