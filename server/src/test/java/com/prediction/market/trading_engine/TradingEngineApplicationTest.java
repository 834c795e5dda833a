package com.prediction.market.trading_engine;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import com.prediction.market.trading_engine.config.TradingProperties;
import com.prediction.market.trading_engine.entity.ExecutedTrade;
import com.prediction.market.trading_engine.entity.Market;
import com.prediction.market.trading_engine.entity.Money;
import com.prediction.market.trading_engine.entity.Pool;
import com.prediction.market.trading_engine.entity.TradeAction;
import com.prediction.market.trading_engine.repositories.InMemoryTradingStore;
import com.prediction.market.trading_engine.repositories.TradingStore;
import com.prediction.market.trading_engine.service.LedgerService;
import com.prediction.market.trading_engine.service.TradeExecutionService;

/**
 * Boots the whole context on the in-memory store with scheduling off.
 */
@SpringBootTest
@ActiveProfiles("test")
class TradingEngineApplicationTest {

    @Autowired TradingStore store;
    @Autowired TradingProperties properties;
    @Autowired LedgerService ledgerService;
    @Autowired TradeExecutionService tradeExecutionService;

    @Test
    void startsOnMemoryStoreAndExecutesTrades() {
        assertThat(store).isInstanceOf(InMemoryTradingStore.class);
        assertThat(properties.store()).isEqualTo(TradingProperties.StoreType.MEMORY);
        assertThat(properties.scheduling().enabled()).isFalse();
        assertThat(tradeExecutionService.isInitialized()).isTrue();

        store.savePool(Pool.builder().id("ctx-pool").ownerId("ctx").name("ctx").build());
        ledgerService.deposit("ctx-pool", Money.of("100"));
        store.saveMarket(Market.builder()
            .id("ctx-market")
            .question("Does the context start?")
            .yesReserve(new BigDecimal("100"))
            .noReserve(new BigDecimal("100"))
            .constantProduct(new BigDecimal("10000"))
            .endDate(Instant.now().plus(1, ChronoUnit.DAYS))
            .build());

        ExecutedTrade trade = tradeExecutionService.executeSingleDecision(
            TradingFixture.buy("ctx-pool", "ctx-market", TradeAction.BUY_NO, "10"));

        assertThat(trade.getFee()).isEqualByComparingTo("0.1");
        assertThat(ledgerService.getBalance("ctx-pool")).isEqualTo(Money.of("90"));
    }
}
