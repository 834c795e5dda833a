package com.prediction.market.trading_engine.service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;

import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import com.prediction.market.trading_engine.entity.BalanceTransaction;
import com.prediction.market.trading_engine.entity.Money;
import com.prediction.market.trading_engine.entity.Pool;
import com.prediction.market.trading_engine.entity.TransactionType;
import com.prediction.market.trading_engine.exception.InsufficientFundsException;
import com.prediction.market.trading_engine.exception.ValidationException;
import com.prediction.market.trading_engine.execution.MarketExecutor;
import com.prediction.market.trading_engine.execution.MarketLockRegistry;
import com.prediction.market.trading_engine.repositories.TradingStore;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Debit/credit primitive over pool balances.
 *
 * Every balance change writes the pool and one BalanceTransaction in the same unit of work, so the
 * ledger always explains the balance: balanceAfter - balanceBefore == amount on every row, and the rows of
 * an account chain by sequence. This is the only writer of pool balances and cumulative counters.
 *
 * Every mutation runs under the pool's lock and joins the caller's unit of work when there is one. Trades
 * already hold the pool lock and re-enter it; a deposit or withdrawal waits for in-flight trades on the pool.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LedgerService {

    public record ReconciliationReport(String accountId, int rowsChecked, List<String> discrepancies) {
        public boolean isClean() {
            return discrepancies.isEmpty();
        }
    }

    private final TradingStore store;
    private final MarketExecutor marketExecutor;
    private final Clock clock;

    /**
     * Take {@code amount} out of the account.
     *
     * @throws InsufficientFundsException if the balance is below {@code amount}; nothing is written
     */
    public BalanceTransaction debit(String accountId, Money amount, TransactionType type,
                                    String description, String relatedId) {
        requirePositive(amount);
        return inPoolUnit(accountId, () -> {
            Pool pool = requirePool(accountId);
            Money balance = pool.balance();
            if (balance.isLessThan(amount)) {
                throw new InsufficientFundsException(accountId, amount, balance);
            }
            return apply(pool, amount.negate(), type, description, relatedId);
        });
    }

    /**
     * Add {@code amount} to the account. Never fails a balance check.
     */
    public BalanceTransaction credit(String accountId, Money amount, TransactionType type,
                                     String description, String relatedId) {
        requirePositive(amount);
        return inPoolUnit(accountId, () -> apply(requirePool(accountId), amount, type, description, relatedId));
    }

    public BalanceTransaction deposit(String accountId, Money amount) {
        return inPoolUnit(accountId, () -> {
            BalanceTransaction tx = credit(accountId, amount, TransactionType.DEPOSIT, "Deposit", null);
            Pool pool = requirePool(accountId);
            pool.setTotalDeposits(Money.orZero(pool.getTotalDeposits()).add(amount).toBigDecimal());
            store.savePool(pool);
            log.info("Deposit: account={}, amount={}, balance={}", accountId, amount, tx.getBalanceAfter());
            return tx;
        });
    }

    public BalanceTransaction withdraw(String accountId, Money amount) {
        return inPoolUnit(accountId, () -> {
            BalanceTransaction tx = debit(accountId, amount, TransactionType.WITHDRAWAL, "Withdrawal", null);
            Pool pool = requirePool(accountId);
            pool.setTotalWithdrawals(Money.orZero(pool.getTotalWithdrawals()).add(amount).toBigDecimal());
            store.savePool(pool);
            log.info("Withdrawal: account={}, amount={}, balance={}", accountId, amount, tx.getBalanceAfter());
            return tx;
        });
    }

    public void recordFee(String accountId, Money fee) {
        if (fee.isZero()) {
            return;
        }
        inPoolUnit(accountId, () -> {
            Pool pool = requirePool(accountId);
            pool.setTotalFeesCollected(Money.orZero(pool.getTotalFeesCollected()).add(fee).toBigDecimal());
            pool.setUpdatedAt(clock.instant());
            return store.savePool(pool);
        });
    }

    public void recordRealizedPnL(String accountId, Money pnl) {
        if (pnl.isZero()) {
            return;
        }
        inPoolUnit(accountId, () -> {
            Pool pool = requirePool(accountId);
            pool.setLifetimePnL(Money.orZero(pool.getLifetimePnL()).add(pnl).toBigDecimal());
            pool.setUpdatedAt(clock.instant());
            return store.savePool(pool);
        });
    }

    public Money getBalance(String accountId) {
        return requirePool(accountId).balance();
    }

    public List<BalanceTransaction> getTransactionHistory(String accountId, int limit) {
        if (limit <= 0) {
            throw new ValidationException("limit must be positive");
        }
        return store.findRecentTransactions(accountId, limit);
    }

    /**
     * Audit an account's ledger against its stored balance. Full scan, O(n) in ledger rows.
     * Drift is reported and logged, never corrected.
     */
    public ReconciliationReport reconcile(String accountId) {
        Pool pool = requirePool(accountId);
        List<BalanceTransaction> rows = store.findTransactions(accountId);
        List<String> discrepancies = new ArrayList<>();

        Money previousAfter = Money.ZERO;
        long previousSequence = 0;
        for (BalanceTransaction row : rows) {
            Money before = Money.of(row.getBalanceBefore());
            Money after = Money.of(row.getBalanceAfter());
            Money amount = Money.of(row.getAmount());

            if (!after.subtract(before).equals(amount)) {
                discrepancies.add(String.format("row %d: %s - %s != %s", row.getSequence(), after, before, amount));
            }
            if (!before.equals(previousAfter)) {
                discrepancies.add(String.format("row %d: balanceBefore %s does not follow %s",
                    row.getSequence(), before, previousAfter));
            }
            if (row.getSequence() != previousSequence + 1) {
                discrepancies.add(String.format("row %d: expected sequence %d", row.getSequence(), previousSequence + 1));
            }
            previousAfter = after;
            previousSequence = row.getSequence();
        }

        if (!previousAfter.equals(pool.balance())) {
            discrepancies.add(String.format("ledger ends at %s but pool balance is %s", previousAfter, pool.balance()));
        }

        if (!discrepancies.isEmpty()) {
            log.warn("Ledger drift detected for account {}: {}", accountId, discrepancies);
        }
        return new ReconciliationReport(accountId, rows.size(), List.copyOf(discrepancies));
    }

    /**
     * Periodic reconciliation job over every pool.
     */
    @Scheduled(fixedDelayString = "${trading.scheduling.reconciliation-interval:PT5M}")
    public void reconcileAllPools() {
        log.info("Starting ledger reconciliation...");

        int checked = 0;
        int drifted = 0;
        for (Pool pool : store.findAllPools()) {
            try {
                if (!reconcile(pool.getId()).isClean()) {
                    drifted++;
                }
                checked++;
            } catch (RuntimeException e) {
                log.error("Reconciliation failed for account {}: {}", pool.getId(), e.getMessage(), e);
            }
        }

        log.info("Ledger reconciliation complete: {} accounts checked, {} with drift", checked, drifted);
    }

    private BalanceTransaction apply(Pool pool, Money signedAmount, TransactionType type,
                                     String description, String relatedId) {
        Instant now = clock.instant();
        Money before = pool.balance();
        Money after = before.add(signedAmount);
        long sequence = pool.getLedgerSequence() + 1;

        pool.setAvailableBalance(after.toBigDecimal());
        pool.setLedgerSequence(sequence);
        pool.setUpdatedAt(now);
        store.savePool(pool);

        BalanceTransaction tx = BalanceTransaction.builder()
            .id(UUID.randomUUID().toString())
            .accountId(pool.getId())
            .sequence(sequence)
            .type(type)
            .amount(signedAmount.toBigDecimal())
            .balanceBefore(before.toBigDecimal())
            .balanceAfter(after.toBigDecimal())
            .relatedId(relatedId)
            .description(description)
            .createdAt(now)
            .build();
        store.appendTransaction(tx);

        log.debug("Ledger {}: account={}, amount={}, balance {} -> {}", type, pool.getId(), signedAmount, before, after);
        return tx;
    }

    private <T> T inPoolUnit(String accountId, Supplier<T> work) {
        return marketExecutor.execute(List.of(MarketLockRegistry.poolKey(accountId)), work);
    }

    private Pool requirePool(String accountId) {
        return store.findPool(accountId)
            .orElseThrow(() -> new ValidationException("Pool not found: " + accountId));
    }

    private static void requirePositive(Money amount) {
        if (amount == null || !amount.isPositive()) {
            throw new ValidationException("Ledger amount must be positive: " + amount);
        }
    }
}
