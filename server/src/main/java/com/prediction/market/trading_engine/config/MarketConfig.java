package com.prediction.market.trading_engine.config;

import java.time.Clock;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.prediction.market.trading_engine.cache.MarketStore;
import com.prediction.market.trading_engine.cache.PositionStore;
import com.prediction.market.trading_engine.engine.PerpRiskEngine;
import com.prediction.market.trading_engine.engine.PredictionPricingEngine;
import com.prediction.market.trading_engine.engine.QuoteEngine;
import com.prediction.market.trading_engine.execution.MarketExecutor;
import com.prediction.market.trading_engine.execution.MarketLockRegistry;
import com.prediction.market.trading_engine.feed.InMemoryPriceFeed;
import com.prediction.market.trading_engine.feed.PriceFeed;
import com.prediction.market.trading_engine.repositories.InMemoryTradingStore;
import com.prediction.market.trading_engine.repositories.TradingStore;

@Configuration
public class MarketConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnProperty(name = "trading.store", havingValue = "memory")
    public TradingStore inMemoryTradingStore() {
        return new InMemoryTradingStore();
    }

    @Bean
    @ConditionalOnMissingBean(PriceFeed.class)
    public InMemoryPriceFeed priceFeed() {
        return new InMemoryPriceFeed();
    }

    @Bean
    public MarketStore marketStore(TradingStore tradingStore) {
        return new MarketStore(tradingStore);
    }

    @Bean
    public PositionStore positionStore(TradingStore tradingStore) {
        return new PositionStore(tradingStore);
    }

    @Bean
    PredictionPricingEngine predictionPricingEngine(TradingProperties properties) {
        return new PredictionPricingEngine(properties.predictionFeeRate());
    }

    @Bean
    PerpRiskEngine perpRiskEngine(TradingProperties properties) {
        return new PerpRiskEngine(properties);
    }

    @Bean
    public MarketLockRegistry marketLockRegistry(TradingProperties properties) {
        return new MarketLockRegistry(properties.lockTimeout());
    }

    @Bean
    public MarketExecutor marketExecutor(MarketLockRegistry marketLockRegistry, TradingStore tradingStore) {
        return new MarketExecutor(marketLockRegistry, tradingStore);
    }

    @Bean
    public QuoteEngine quoteEngine(MarketStore marketStore, PredictionPricingEngine pricingEngine,
                                   PerpRiskEngine riskEngine, PriceFeed priceFeed) {
        return new QuoteEngine(marketStore, pricingEngine, riskEngine, priceFeed);
    }
}
