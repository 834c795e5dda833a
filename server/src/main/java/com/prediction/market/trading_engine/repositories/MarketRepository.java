package com.prediction.market.trading_engine.repositories;

import java.time.Instant;
import java.util.List;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import com.prediction.market.trading_engine.entity.Market;

@Repository
public interface MarketRepository extends MongoRepository<Market, String> {

    /**
     * Unresolved markets whose end date has passed (candidates for resolution).
     */
    List<Market> findByResolvedFalseAndEndDateLessThanEqual(Instant now);
}
