package com.prediction.market.trading_engine.repositories;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Pageable;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

import com.prediction.market.trading_engine.entity.BalanceTransaction;
import com.prediction.market.trading_engine.entity.PerpStatus;
import com.prediction.market.trading_engine.entity.TradeRecord;
import com.prediction.market.trading_engine.entity.TransactionType;

@ExtendWith(MockitoExtension.class)
class MongoTradingStoreTest {

    @Mock TransactionTemplate transactionTemplate;
    @Mock MarketRepository marketRepository;
    @Mock PoolRepository poolRepository;
    @Mock PositionRepository positionRepository;
    @Mock PerpMarketRepository perpMarketRepository;
    @Mock PerpPositionRepository perpPositionRepository;
    @Mock BalanceTransactionRepository balanceTransactionRepository;
    @Mock TradeRecordRepository tradeRecordRepository;

    private MongoTradingStore store;

    @BeforeEach
    void setUp() {
        store = new MongoTradingStore(transactionTemplate, marketRepository, poolRepository, positionRepository,
            perpMarketRepository, perpPositionRepository, balanceTransactionRepository, tradeRecordRepository);
    }

    @Test
    void unitOfWorkRunsInsideTransactionTemplate() {
        when(transactionTemplate.execute(any()))
            .thenAnswer(invocation -> invocation.<TransactionCallback<?>>getArgument(0).doInTransaction(null));

        String result = store.inTransaction(() -> "committed");

        assertThat(result).isEqualTo("committed");
        verify(transactionTemplate).execute(any());
    }

    @Test
    void ledgerAndTradeRowsAreInsertedNeverSaved() {
        BalanceTransaction tx = BalanceTransaction.builder()
            .id("tx1")
            .accountId("pool-1")
            .sequence(1)
            .type(TransactionType.DEPOSIT)
            .amount(BigDecimal.TEN)
            .build();
        TradeRecord trade = TradeRecord.builder().id("t1").poolId("pool-1").build();

        store.appendTransaction(tx);
        store.appendTrade(trade);

        verify(balanceTransactionRepository).insert(tx);
        verify(balanceTransactionRepository, never()).save(any());
        verify(tradeRecordRepository).insert(trade);
    }

    @Test
    void recentHistoryIsPaged() {
        when(balanceTransactionRepository.findByAccountIdOrderBySequenceDesc(eq("pool-1"), any(Pageable.class)))
            .thenReturn(List.of());

        store.findRecentTransactions("pool-1", 5);

        ArgumentCaptor<Pageable> page = ArgumentCaptor.forClass(Pageable.class);
        verify(balanceTransactionRepository).findByAccountIdOrderBySequenceDesc(eq("pool-1"), page.capture());
        assertThat(page.getValue().getPageNumber()).isZero();
        assertThat(page.getValue().getPageSize()).isEqualTo(5);
    }

    @Test
    void openPerpQueriesFilterOnOpenStatus() {
        store.findOpenPerpPositions();
        store.findOpenPerpPositionsByTicker("BTC");

        verify(perpPositionRepository).findByStatus(PerpStatus.OPEN);
        verify(perpPositionRepository).findByTickerAndStatus("BTC", PerpStatus.OPEN);
    }
}
