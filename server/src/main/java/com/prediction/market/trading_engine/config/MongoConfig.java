package com.prediction.market.trading_engine.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.MongoDatabaseFactory;
import org.springframework.data.mongodb.MongoTransactionManager;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;
import org.springframework.transaction.support.TransactionTemplate;

import com.prediction.market.trading_engine.repositories.BalanceTransactionRepository;
import com.prediction.market.trading_engine.repositories.MarketRepository;
import com.prediction.market.trading_engine.repositories.MongoTradingStore;
import com.prediction.market.trading_engine.repositories.PerpMarketRepository;
import com.prediction.market.trading_engine.repositories.PerpPositionRepository;
import com.prediction.market.trading_engine.repositories.PoolRepository;
import com.prediction.market.trading_engine.repositories.PositionRepository;
import com.prediction.market.trading_engine.repositories.TradeRecordRepository;
import com.prediction.market.trading_engine.repositories.TradingStore;

/**
 * Mongo wiring. The client itself comes from Spring Boot auto-configuration ({@code spring.data.mongodb.uri}).
 * Multi-document transactions need a replica set, even a single-node one.
 */
@Configuration
@ConditionalOnProperty(name = "trading.store", havingValue = "mongo", matchIfMissing = true)
@EnableMongoRepositories(basePackageClasses = MarketRepository.class)
public class MongoConfig {

    @Bean
    MongoTransactionManager mongoTransactionManager(MongoDatabaseFactory databaseFactory) {
        return new MongoTransactionManager(databaseFactory);
    }

    @Bean
    TransactionTemplate tradingTransactionTemplate(MongoTransactionManager transactionManager) {
        return new TransactionTemplate(transactionManager);
    }

    @Bean
    public TradingStore mongoTradingStore(
            TransactionTemplate tradingTransactionTemplate,
            MarketRepository marketRepository,
            PoolRepository poolRepository,
            PositionRepository positionRepository,
            PerpMarketRepository perpMarketRepository,
            PerpPositionRepository perpPositionRepository,
            BalanceTransactionRepository balanceTransactionRepository,
            TradeRecordRepository tradeRecordRepository) {
        return new MongoTradingStore(tradingTransactionTemplate, marketRepository, poolRepository,
            positionRepository, perpMarketRepository, perpPositionRepository,
            balanceTransactionRepository, tradeRecordRepository);
    }
}
