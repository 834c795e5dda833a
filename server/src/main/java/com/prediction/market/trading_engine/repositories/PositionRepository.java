package com.prediction.market.trading_engine.repositories;

import java.util.List;
import java.util.Optional;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import com.prediction.market.trading_engine.entity.Outcome;
import com.prediction.market.trading_engine.entity.Position;

@Repository
public interface PositionRepository extends MongoRepository<Position, String> {

    Optional<Position> findFirstByPoolIdAndMarketIdAndSideAndClosedAtIsNull(String poolId, String marketId, Outcome side);

    List<Position> findByMarketIdAndClosedAtIsNull(String marketId);
}
