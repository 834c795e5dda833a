package com.prediction.market.trading_engine.repositories;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import com.prediction.market.trading_engine.entity.PerpMarket;

@Repository
public interface PerpMarketRepository extends MongoRepository<PerpMarket, String> {
}
