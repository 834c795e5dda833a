package com.prediction.market.trading_engine.repositories;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

import org.springframework.data.domain.PageRequest;
import org.springframework.transaction.support.TransactionTemplate;

import com.prediction.market.trading_engine.entity.BalanceTransaction;
import com.prediction.market.trading_engine.entity.Market;
import com.prediction.market.trading_engine.entity.Outcome;
import com.prediction.market.trading_engine.entity.PerpMarket;
import com.prediction.market.trading_engine.entity.PerpPosition;
import com.prediction.market.trading_engine.entity.PerpStatus;
import com.prediction.market.trading_engine.entity.Pool;
import com.prediction.market.trading_engine.entity.Position;
import com.prediction.market.trading_engine.entity.TradeRecord;

import lombok.RequiredArgsConstructor;

/**
 * MongoDB-backed store. Units of work run in a multi-document transaction (requires a replica set);
 * nested units join the outer transaction through REQUIRED propagation.
 */
@RequiredArgsConstructor
public class MongoTradingStore implements TradingStore {

    private final TransactionTemplate transactionTemplate;
    private final MarketRepository marketRepository;
    private final PoolRepository poolRepository;
    private final PositionRepository positionRepository;
    private final PerpMarketRepository perpMarketRepository;
    private final PerpPositionRepository perpPositionRepository;
    private final BalanceTransactionRepository balanceTransactionRepository;
    private final TradeRecordRepository tradeRecordRepository;

    @Override
    public <T> T inTransaction(Supplier<T> work) {
        return transactionTemplate.execute(status -> work.get());
    }

    @Override
    public Optional<Market> findMarket(String marketId) {
        return marketRepository.findById(marketId);
    }

    @Override
    public List<Market> findAllMarkets() {
        return marketRepository.findAll();
    }

    @Override
    public List<Market> findUnresolvedMarketsEndedBy(Instant now) {
        return marketRepository.findByResolvedFalseAndEndDateLessThanEqual(now);
    }

    @Override
    public Market saveMarket(Market market) {
        return marketRepository.save(market);
    }

    @Override
    public Optional<Pool> findPool(String poolId) {
        return poolRepository.findById(poolId);
    }

    @Override
    public List<Pool> findAllPools() {
        return poolRepository.findAll();
    }

    @Override
    public Pool savePool(Pool pool) {
        return poolRepository.save(pool);
    }

    @Override
    public Optional<Position> findPosition(String positionId) {
        return positionRepository.findById(positionId);
    }

    @Override
    public Optional<Position> findOpenPosition(String poolId, String marketId, Outcome side) {
        return positionRepository.findFirstByPoolIdAndMarketIdAndSideAndClosedAtIsNull(poolId, marketId, side);
    }

    @Override
    public List<Position> findOpenPositionsByMarket(String marketId) {
        return positionRepository.findByMarketIdAndClosedAtIsNull(marketId);
    }

    @Override
    public Position savePosition(Position position) {
        return positionRepository.save(position);
    }

    @Override
    public Optional<PerpMarket> findPerpMarket(String ticker) {
        return perpMarketRepository.findById(ticker);
    }

    @Override
    public List<PerpMarket> findAllPerpMarkets() {
        return perpMarketRepository.findAll();
    }

    @Override
    public PerpMarket savePerpMarket(PerpMarket perpMarket) {
        return perpMarketRepository.save(perpMarket);
    }

    @Override
    public Optional<PerpPosition> findPerpPosition(String positionId) {
        return perpPositionRepository.findById(positionId);
    }

    @Override
    public List<PerpPosition> findOpenPerpPositions() {
        return perpPositionRepository.findByStatus(PerpStatus.OPEN);
    }

    @Override
    public List<PerpPosition> findOpenPerpPositionsByTicker(String ticker) {
        return perpPositionRepository.findByTickerAndStatus(ticker, PerpStatus.OPEN);
    }

    @Override
    public PerpPosition savePerpPosition(PerpPosition position) {
        return perpPositionRepository.save(position);
    }

    @Override
    public BalanceTransaction appendTransaction(BalanceTransaction transaction) {
        // insert, not save: a duplicate (accountId, sequence) must fail instead of overwriting
        return balanceTransactionRepository.insert(transaction);
    }

    @Override
    public List<BalanceTransaction> findTransactions(String accountId) {
        return balanceTransactionRepository.findByAccountIdOrderBySequenceAsc(accountId);
    }

    @Override
    public List<BalanceTransaction> findRecentTransactions(String accountId, int limit) {
        return balanceTransactionRepository.findByAccountIdOrderBySequenceDesc(accountId, PageRequest.of(0, limit));
    }

    @Override
    public TradeRecord appendTrade(TradeRecord trade) {
        return tradeRecordRepository.insert(trade);
    }

    @Override
    public List<TradeRecord> findRecentTrades(String poolId, int limit) {
        return tradeRecordRepository.findByPoolIdOrderByCreatedAtDesc(poolId, PageRequest.of(0, limit));
    }
}
