package com.prediction.market.trading_engine.repositories;

import java.util.List;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import com.prediction.market.trading_engine.entity.PerpPosition;
import com.prediction.market.trading_engine.entity.PerpStatus;

@Repository
public interface PerpPositionRepository extends MongoRepository<PerpPosition, String> {

    List<PerpPosition> findByStatus(PerpStatus status);

    List<PerpPosition> findByTickerAndStatus(String ticker, PerpStatus status);
}
