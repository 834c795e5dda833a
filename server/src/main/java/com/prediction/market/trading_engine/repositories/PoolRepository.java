package com.prediction.market.trading_engine.repositories;

import java.util.List;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import com.prediction.market.trading_engine.entity.Pool;

@Repository
public interface PoolRepository extends MongoRepository<Pool, String> {
    List<Pool> findByOwnerId(String ownerId);
}
