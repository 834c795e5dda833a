package com.prediction.market.trading_engine.repositories;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;

import org.junit.jupiter.api.Test;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.OptimisticLockingFailureException;

import com.prediction.market.trading_engine.entity.BalanceTransaction;
import com.prediction.market.trading_engine.entity.Pool;
import com.prediction.market.trading_engine.entity.TransactionType;

class InMemoryTradingStoreTest {

    private final InMemoryTradingStore store = new InMemoryTradingStore();

    private Pool pool(String id, String balance) {
        return store.savePool(Pool.builder().id(id).availableBalance(new BigDecimal(balance)).build());
    }

    @Test
    void assignsVersionsOnSave() {
        pool("p1", "10");
        Pool stored = store.findPool("p1").orElseThrow();
        assertThat(stored.getVersion()).isEqualTo(0L);

        stored.setAvailableBalance(new BigDecimal("20"));
        store.savePool(stored);
        assertThat(store.findPool("p1").orElseThrow().getVersion()).isEqualTo(1L);
    }

    @Test
    void rejectsStaleWrite() {
        pool("p1", "10");
        Pool first = store.findPool("p1").orElseThrow();
        Pool second = store.findPool("p1").orElseThrow();

        first.setAvailableBalance(new BigDecimal("11"));
        store.savePool(first);
        second.setAvailableBalance(new BigDecimal("12"));

        assertThatThrownBy(() -> store.savePool(second)).isInstanceOf(OptimisticLockingFailureException.class);
        assertThat(store.findPool("p1").orElseThrow().getAvailableBalance()).isEqualByComparingTo("11");
    }

    @Test
    void rollsBackEveryWriteOfFailedUnit() {
        pool("p1", "10");

        assertThatThrownBy(() -> store.inTransaction(() -> {
            Pool pool = store.findPool("p1").orElseThrow();
            pool.setAvailableBalance(new BigDecimal("0"));
            store.savePool(pool);
            pool("p2", "5");
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(store.findPool("p1").orElseThrow().getAvailableBalance()).isEqualByComparingTo("10");
        assertThat(store.findPool("p2")).isEmpty();
    }

    @Test
    void stagedWritesAreInvisibleToOtherThreadsUntilCommit() throws Exception {
        pool("p1", "10");

        store.inTransaction(() -> {
            Pool pool = store.findPool("p1").orElseThrow();
            pool.setAvailableBalance(new BigDecimal("99"));
            store.savePool(pool);

            assertThat(store.findPool("p1").orElseThrow().getAvailableBalance()).isEqualByComparingTo("99");
            BigDecimal seenElsewhere = CompletableFuture
                .supplyAsync(() -> store.findPool("p1").orElseThrow().getAvailableBalance())
                .join();
            assertThat(seenElsewhere).isEqualByComparingTo("10");
        });

        assertThat(store.findPool("p1").orElseThrow().getAvailableBalance()).isEqualByComparingTo("99");
    }

    @Test
    void conflictingCommitFailsWholeUnit() {
        pool("p1", "10");
        pool("p2", "10");

        assertThatThrownBy(() -> store.inTransaction(() -> {
            Pool p2 = store.findPool("p2").orElseThrow();
            p2.setAvailableBalance(new BigDecimal("0"));
            store.savePool(p2);

            Pool p1 = store.findPool("p1").orElseThrow();
            // another writer commits p1 first
            CompletableFuture.runAsync(() -> {
                Pool concurrent = store.findPool("p1").orElseThrow();
                concurrent.setAvailableBalance(new BigDecimal("7"));
                store.savePool(concurrent);
            }).join();
            p1.setAvailableBalance(new BigDecimal("1"));
            store.savePool(p1);
        })).isInstanceOf(OptimisticLockingFailureException.class);

        assertThat(store.findPool("p1").orElseThrow().getAvailableBalance()).isEqualByComparingTo("7");
        assertThat(store.findPool("p2").orElseThrow().getAvailableBalance()).isEqualByComparingTo("10");
    }

    @Test
    void appendOnlyRowsRejectDuplicates() {
        BalanceTransaction tx = BalanceTransaction.builder()
            .id("tx1")
            .accountId("p1")
            .sequence(1)
            .type(TransactionType.DEPOSIT)
            .amount(BigDecimal.TEN)
            .balanceBefore(BigDecimal.ZERO)
            .balanceAfter(BigDecimal.TEN)
            .createdAt(Instant.now())
            .build();
        store.appendTransaction(tx);

        assertThatThrownBy(() -> store.appendTransaction(tx)).isInstanceOf(DuplicateKeyException.class);
        assertThat(store.findTransactions("p1")).hasSize(1);
    }

    @Test
    void requiresAssignedIds() {
        assertThatThrownBy(() -> store.savePool(Pool.builder().build()))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
