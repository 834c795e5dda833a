package com.prediction.market.trading_engine;

import org.springframework.stereotype.Component;

import com.prediction.market.trading_engine.config.TradingProperties;
import com.prediction.market.trading_engine.repositories.TradingStore;
import com.prediction.market.trading_engine.service.TradeExecutionService;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Checks the store is reachable and warms the execution caches before any decision is accepted.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EngineStartup {

    private final TradingStore tradingStore;
    private final TradeExecutionService tradeExecutionService;
    private final TradingProperties properties;

    @PostConstruct
    public void start() {
        try {
            int pools = tradingStore.findAllPools().size();
            log.info("Trading store ({}) reachable: {} pools", properties.store(), pools);
            tradeExecutionService.initialize();
        } catch (RuntimeException e) {
            throw new IllegalStateException("Trading engine startup failed: store " + properties.store(), e);
        }
    }
}
