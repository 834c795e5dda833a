package com.prediction.market.trading_engine.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.prediction.market.trading_engine.TradingFixture;
import com.prediction.market.trading_engine.entity.BalanceTransaction;
import com.prediction.market.trading_engine.entity.ExecutedTrade;
import com.prediction.market.trading_engine.entity.Money;
import com.prediction.market.trading_engine.entity.Pool;
import com.prediction.market.trading_engine.entity.Position;
import com.prediction.market.trading_engine.entity.TradeAction;
import com.prediction.market.trading_engine.entity.TransactionType;
import com.prediction.market.trading_engine.exception.ContentionException;
import com.prediction.market.trading_engine.exception.InsufficientFundsException;
import com.prediction.market.trading_engine.exception.ValidationException;
import com.prediction.market.trading_engine.execution.MarketLockRegistry;
import com.prediction.market.trading_engine.repositories.InMemoryTradingStore;
import com.prediction.market.trading_engine.service.LedgerService.ReconciliationReport;

class LedgerServiceTest {

    private TradingFixture fixture;
    private LedgerService ledger;

    @BeforeEach
    void setUp() {
        fixture = new TradingFixture();
        ledger = fixture.ledger;
        fixture.pool("pool-1", "1000");
    }

    @Test
    void debitWritesBalanceAndRowTogether() {
        BalanceTransaction tx = ledger.debit("pool-1", Money.of("250"), TransactionType.PREDICTION_BUY,
            "buy", "pos-1");

        assertThat(tx.getAmount()).isEqualByComparingTo("-250");
        assertThat(tx.getBalanceBefore()).isEqualByComparingTo("1000");
        assertThat(tx.getBalanceAfter()).isEqualByComparingTo("750");
        assertThat(tx.getSequence()).isEqualTo(2);
        assertThat(tx.getRelatedId()).isEqualTo("pos-1");
        assertThat(ledger.getBalance("pool-1")).isEqualTo(Money.of("750"));
    }

    @Test
    void debitBeyondBalanceWritesNothing() {
        assertThatThrownBy(() -> ledger.debit("pool-1", Money.of("1000.00000001"), TransactionType.PERP_OPEN, "open", null))
            .isInstanceOfSatisfying(InsufficientFundsException.class, e -> {
                assertThat(e.getRequired()).isEqualTo(Money.of("1000.00000001"));
                assertThat(e.getAvailable()).isEqualTo(Money.of("1000"));
            });

        assertThat(ledger.getBalance("pool-1")).isEqualTo(Money.of("1000"));
        assertThat(fixture.store.findTransactions("pool-1")).hasSize(1);
    }

    @Test
    void debitOfWholeBalanceLeavesZero() {
        ledger.debit("pool-1", Money.of("1000"), TransactionType.WITHDRAWAL, "all", null);
        assertThat(ledger.getBalance("pool-1")).isEqualTo(Money.ZERO);
    }

    @Test
    void amountsMustBePositive() {
        assertThatThrownBy(() -> ledger.credit("pool-1", Money.ZERO, TransactionType.DEPOSIT, "zero", null))
            .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> ledger.debit("pool-1", Money.of("-5"), TransactionType.WITHDRAWAL, "neg", null))
            .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> ledger.credit("missing", Money.ONE, TransactionType.DEPOSIT, "x", null))
            .isInstanceOf(ValidationException.class);
    }

    @Test
    void depositAndWithdrawTrackTotals() {
        ledger.deposit("pool-1", Money.of("50"));
        ledger.withdraw("pool-1", Money.of("30"));

        Pool pool = fixture.store.findPool("pool-1").orElseThrow();
        assertThat(pool.getTotalDeposits()).isEqualByComparingTo("1050");
        assertThat(pool.getTotalWithdrawals()).isEqualByComparingTo("30");
        assertThat(pool.getAvailableBalance()).isEqualByComparingTo("1020");
        assertThat(pool.getLedgerSequence()).isEqualTo(3);
    }

    @Test
    void feeAndPnlCountersSkipZero() {
        ledger.recordFee("pool-1", Money.of("2.5"));
        ledger.recordFee("pool-1", Money.ZERO);
        ledger.recordRealizedPnL("pool-1", Money.of("-7.25"));

        Pool pool = fixture.store.findPool("pool-1").orElseThrow();
        assertThat(pool.getTotalFeesCollected()).isEqualByComparingTo("2.5");
        assertThat(pool.getLifetimePnL()).isEqualByComparingTo("-7.25");
        assertThat(pool.getAvailableBalance()).isEqualByComparingTo("1000");
    }

    @Test
    void historyIsNewestFirst() {
        ledger.debit("pool-1", Money.of("1"), TransactionType.PREDICTION_BUY, "a", null);
        ledger.credit("pool-1", Money.of("2"), TransactionType.PREDICTION_SELL, "b", null);
        ledger.debit("pool-1", Money.of("3"), TransactionType.PREDICTION_BUY, "c", null);

        List<BalanceTransaction> history = ledger.getTransactionHistory("pool-1", 2);

        assertThat(history).extracting(BalanceTransaction::getDescription).containsExactly("c", "b");
        assertThatThrownBy(() -> ledger.getTransactionHistory("pool-1", 0)).isInstanceOf(ValidationException.class);
    }

    @Test
    void reconciliationOfLedgerWrittenBalanceIsClean() {
        ledger.debit("pool-1", Money.of("100"), TransactionType.PREDICTION_BUY, "buy", null);
        ledger.credit("pool-1", Money.of("40.5"), TransactionType.PREDICTION_SELL, "sell", null);

        ReconciliationReport report = ledger.reconcile("pool-1");

        assertThat(report.isClean()).isTrue();
        assertThat(report.rowsChecked()).isEqualTo(3);
    }

    @Test
    void reconciliationReportsBalanceWrittenAroundLedger() {
        Pool pool = fixture.store.findPool("pool-1").orElseThrow();
        pool.setAvailableBalance(new BigDecimal("1500"));
        fixture.store.savePool(pool);

        ReconciliationReport report = ledger.reconcile("pool-1");

        assertThat(report.isClean()).isFalse();
        assertThat(report.discrepancies()).singleElement().asString().contains("1500");
    }

    @Test
    void reconcileAllPoolsCoversEveryPool() {
        fixture.pool("pool-2", "10");
        ledger.reconcileAllPools();

        assertThat(ledger.reconcile("pool-2").isClean()).isTrue();
    }

    @Test
    void depositWaitsForTradeHoldingSamePool() throws Exception {
        CountDownLatch tradeInside = new CountDownLatch(1);
        CountDownLatch resume = new CountDownLatch(1);
        InMemoryTradingStore pausingStore = new InMemoryTradingStore() {
            @Override
            public Position savePosition(Position position) {
                tradeInside.countDown();
                await(resume);
                return super.savePosition(position);
            }
        };
        TradingFixture paused = new TradingFixture(pausingStore,
            TradingFixture.propertiesWithLockTimeout(Duration.ofSeconds(10)));
        paused.pool("p", "1000");
        paused.market("m", "500", "500");
        paused.execution.initialize();

        CompletableFuture<ExecutedTrade> trade = CompletableFuture.supplyAsync(
            () -> paused.execution.executeSingleDecision(TradingFixture.buy("p", "m", TradeAction.BUY_YES, "250")));
        assertThat(tradeInside.await(5, TimeUnit.SECONDS)).isTrue();

        CompletableFuture<BalanceTransaction> deposit = CompletableFuture.supplyAsync(
            () -> paused.ledger.deposit("p", Money.of("100")));
        Thread.sleep(200);
        assertThat(deposit).isNotDone();

        resume.countDown();
        trade.get(5, TimeUnit.SECONDS);
        BalanceTransaction depositRow = deposit.get(5, TimeUnit.SECONDS);

        assertThat(depositRow.getBalanceBefore()).isEqualByComparingTo("750");
        assertThat(depositRow.getBalanceAfter()).isEqualByComparingTo("850");
        assertThat(paused.balance("p")).isEqualTo(Money.of("850"));
        assertThat(paused.ledger.reconcile("p").isClean()).isTrue();
    }

    @Test
    void withdrawBlockedByPoolLockIsRetryableContention() throws Exception {
        TradingFixture shortWait = new TradingFixture(new InMemoryTradingStore(),
            TradingFixture.propertiesWithLockTimeout(Duration.ofMillis(50)));
        shortWait.pool("p", "1000");
        CountDownLatch held = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);

        CompletableFuture<Object> holder = CompletableFuture.supplyAsync(() -> shortWait.lockRegistry.withLocks(
            List.of(MarketLockRegistry.poolKey("p")), () -> {
                held.countDown();
                await(release);
                return null;
            }));
        assertThat(held.await(5, TimeUnit.SECONDS)).isTrue();

        try {
            assertThatThrownBy(() -> shortWait.ledger.withdraw("p", Money.of("10")))
                .isInstanceOfSatisfying(ContentionException.class, e -> {
                    assertThat(e.isRetryable()).isTrue();
                    assertThat(e.getResourceKey()).isEqualTo("pool:p");
                });
        } finally {
            release.countDown();
            holder.get(5, TimeUnit.SECONDS);
        }
        assertThat(shortWait.balance("p")).isEqualTo(Money.of("1000"));
        assertThat(shortWait.store.findTransactions("p")).hasSize(1);
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
