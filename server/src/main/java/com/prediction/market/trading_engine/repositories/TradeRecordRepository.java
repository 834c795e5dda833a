package com.prediction.market.trading_engine.repositories;

import java.util.List;

import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import com.prediction.market.trading_engine.entity.TradeRecord;

@Repository
public interface TradeRecordRepository extends MongoRepository<TradeRecord, String> {
    List<TradeRecord> findByPoolIdOrderByCreatedAtDesc(String poolId, Pageable pageable);
}
