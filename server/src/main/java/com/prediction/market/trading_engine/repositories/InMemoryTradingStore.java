package com.prediction.market.trading_engine.repositories;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BiConsumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.OptimisticLockingFailureException;

import com.prediction.market.trading_engine.entity.BalanceTransaction;
import com.prediction.market.trading_engine.entity.Market;
import com.prediction.market.trading_engine.entity.Outcome;
import com.prediction.market.trading_engine.entity.PerpMarket;
import com.prediction.market.trading_engine.entity.PerpPosition;
import com.prediction.market.trading_engine.entity.PerpStatus;
import com.prediction.market.trading_engine.entity.Pool;
import com.prediction.market.trading_engine.entity.Position;
import com.prediction.market.trading_engine.entity.TradeRecord;

import lombok.extern.slf4j.Slf4j;

/**
 * Heap-backed store for local runs and tests.
 *
 * A unit of work stages copies of every row it writes in a thread-local buffer; reads inside the unit see
 * the staged copies first. Commit checks every staged row's version against the stored one and then
 * publishes all of them under a single lock, so other threads observe either none or all of a unit's writes.
 * Rows are copied on the way in and out; callers never share instances with the store.
 */
@Slf4j
public class InMemoryTradingStore implements TradingStore {

    private final ThreadLocal<UnitOfWork> currentUnit = new ThreadLocal<>();
    private final Object commitLock = new Object();
    private final List<Table<?>> tables = new ArrayList<>();

    private final Table<Market> markets = register(new Table<>("market",
        Market::getId, m -> m.toBuilder().build(), Market::getVersion, Market::setVersion));
    private final Table<Pool> pools = register(new Table<>("pool",
        Pool::getId, p -> p.toBuilder().build(), Pool::getVersion, Pool::setVersion));
    private final Table<Position> positions = register(new Table<>("position",
        Position::getId, p -> p.toBuilder().build(), Position::getVersion, Position::setVersion));
    private final Table<PerpMarket> perpMarkets = register(new Table<>("perp_market",
        PerpMarket::getTicker, m -> m.toBuilder().build(), PerpMarket::getVersion, PerpMarket::setVersion));
    private final Table<PerpPosition> perpPositions = register(new Table<>("perp_position",
        PerpPosition::getId, p -> p.toBuilder().build(), PerpPosition::getVersion, PerpPosition::setVersion));
    // immutable rows, no copies or versions needed
    private final Table<BalanceTransaction> transactions = register(new Table<>("balance_transaction",
        BalanceTransaction::getId, UnaryOperator.identity(), null, null));
    private final Table<TradeRecord> trades = register(new Table<>("trade",
        TradeRecord::getId, UnaryOperator.identity(), null, null));

    @Override
    public <T> T inTransaction(Supplier<T> work) {
        if (currentUnit.get() != null) {
            return work.get();
        }

        UnitOfWork unit = new UnitOfWork();
        currentUnit.set(unit);
        try {
            T result = work.get();
            commit(unit);
            return result;
        } catch (RuntimeException e) {
            log.debug("Unit of work rolled back: {}", e.getMessage());
            throw e;
        } finally {
            currentUnit.remove();
        }
    }

    private void commit(UnitOfWork unit) {
        synchronized (commitLock) {
            for (Table<?> table : tables) {
                table.verify(unit);
            }
            for (Table<?> table : tables) {
                table.publish(unit);
            }
        }
    }

    @Override
    public Optional<Market> findMarket(String marketId) {
        return markets.find(marketId);
    }

    @Override
    public List<Market> findAllMarkets() {
        return markets.findAll(m -> true);
    }

    @Override
    public List<Market> findUnresolvedMarketsEndedBy(Instant now) {
        return markets.findAll(m -> !m.isResolved() && m.isExpired(now));
    }

    @Override
    public Market saveMarket(Market market) {
        return markets.save(market, false);
    }

    @Override
    public Optional<Pool> findPool(String poolId) {
        return pools.find(poolId);
    }

    @Override
    public List<Pool> findAllPools() {
        return pools.findAll(p -> true);
    }

    @Override
    public Pool savePool(Pool pool) {
        return pools.save(pool, false);
    }

    @Override
    public Optional<Position> findPosition(String positionId) {
        return positions.find(positionId);
    }

    @Override
    public Optional<Position> findOpenPosition(String poolId, String marketId, Outcome side) {
        return positions.findAll(p -> p.isOpen()
                && Objects.equals(p.getPoolId(), poolId)
                && Objects.equals(p.getMarketId(), marketId)
                && p.getSide() == side)
            .stream()
            .findFirst();
    }

    @Override
    public List<Position> findOpenPositionsByMarket(String marketId) {
        return positions.findAll(p -> p.isOpen() && Objects.equals(p.getMarketId(), marketId));
    }

    @Override
    public Position savePosition(Position position) {
        return positions.save(position, false);
    }

    @Override
    public Optional<PerpMarket> findPerpMarket(String ticker) {
        return perpMarkets.find(ticker);
    }

    @Override
    public List<PerpMarket> findAllPerpMarkets() {
        return perpMarkets.findAll(m -> true);
    }

    @Override
    public PerpMarket savePerpMarket(PerpMarket perpMarket) {
        return perpMarkets.save(perpMarket, false);
    }

    @Override
    public Optional<PerpPosition> findPerpPosition(String positionId) {
        return perpPositions.find(positionId);
    }

    @Override
    public List<PerpPosition> findOpenPerpPositions() {
        return perpPositions.findAll(p -> p.getStatus() == PerpStatus.OPEN);
    }

    @Override
    public List<PerpPosition> findOpenPerpPositionsByTicker(String ticker) {
        return perpPositions.findAll(p -> p.getStatus() == PerpStatus.OPEN && Objects.equals(p.getTicker(), ticker));
    }

    @Override
    public PerpPosition savePerpPosition(PerpPosition position) {
        return perpPositions.save(position, false);
    }

    @Override
    public BalanceTransaction appendTransaction(BalanceTransaction transaction) {
        return transactions.save(transaction, true);
    }

    @Override
    public List<BalanceTransaction> findTransactions(String accountId) {
        return transactions.findAll(t -> Objects.equals(t.getAccountId(), accountId)).stream()
            .sorted(Comparator.comparingLong(BalanceTransaction::getSequence))
            .collect(Collectors.toList());
    }

    @Override
    public List<BalanceTransaction> findRecentTransactions(String accountId, int limit) {
        return transactions.findAll(t -> Objects.equals(t.getAccountId(), accountId)).stream()
            .sorted(Comparator.comparingLong(BalanceTransaction::getSequence).reversed())
            .limit(limit)
            .collect(Collectors.toList());
    }

    @Override
    public TradeRecord appendTrade(TradeRecord trade) {
        return trades.save(trade, true);
    }

    @Override
    public List<TradeRecord> findRecentTrades(String poolId, int limit) {
        return trades.findAll(t -> Objects.equals(t.getPoolId(), poolId)).stream()
            .sorted(Comparator.comparing(TradeRecord::getCreatedAt, Comparator.nullsLast(Comparator.reverseOrder())))
            .limit(limit)
            .collect(Collectors.toList());
    }

    private <T> Table<T> register(Table<T> table) {
        tables.add(table);
        return table;
    }

    private static final class UnitOfWork {
        private final Map<Table<?>, Map<String, Object>> staged = new HashMap<>();

        @SuppressWarnings("unchecked")
        <T> Map<String, T> rows(Table<T> table) {
            return (Map<String, T>) (Map<String, ?>) staged.computeIfAbsent(table, t -> new LinkedHashMap<>());
        }
    }

    private final class Table<T> {
        private final String name;
        private final Map<String, T> rows = new ConcurrentHashMap<>();
        private final Function<T, String> idOf;
        private final UnaryOperator<T> copy;
        private final Function<T, Long> versionOf;
        private final BiConsumer<T, Long> versionSetter;

        Table(String name, Function<T, String> idOf, UnaryOperator<T> copy,
              Function<T, Long> versionOf, BiConsumer<T, Long> versionSetter) {
            this.name = name;
            this.idOf = idOf;
            this.copy = copy;
            this.versionOf = versionOf;
            this.versionSetter = versionSetter;
        }

        Optional<T> find(String id) {
            if (id == null) {
                return Optional.empty();
            }
            UnitOfWork unit = currentUnit.get();
            T row = unit != null && unit.rows(this).containsKey(id) ? unit.rows(this).get(id) : rows.get(id);
            return Optional.ofNullable(row).map(copy);
        }

        List<T> findAll(Predicate<T> filter) {
            Map<String, T> view = new LinkedHashMap<>(rows);
            UnitOfWork unit = currentUnit.get();
            if (unit != null) {
                view.putAll(unit.rows(this));
            }
            return view.values().stream().filter(filter).map(copy).collect(Collectors.toList());
        }

        T save(T entity, boolean insertOnly) {
            String id = idOf.apply(entity);
            if (id == null) {
                throw new IllegalArgumentException(name + " id must be assigned before saving");
            }

            UnitOfWork unit = currentUnit.get();
            if (unit == null) {
                synchronized (commitLock) {
                    checkInsert(id, insertOnly, null);
                    T stored = copy.apply(entity);
                    checkVersion(id, stored);
                    store(id, stored);
                    if (versionSetter != null) {
                        versionSetter.accept(entity, versionOf.apply(stored));
                    }
                }
                return entity;
            }

            checkInsert(id, insertOnly, unit);
            unit.rows(this).put(id, copy.apply(entity));
            return entity;
        }

        void verify(UnitOfWork unit) {
            for (Map.Entry<String, T> staged : unit.rows(this).entrySet()) {
                checkVersion(staged.getKey(), staged.getValue());
            }
        }

        void publish(UnitOfWork unit) {
            for (Map.Entry<String, T> staged : unit.rows(this).entrySet()) {
                store(staged.getKey(), staged.getValue());
            }
        }

        private void checkInsert(String id, boolean insertOnly, UnitOfWork unit) {
            if (insertOnly && (rows.containsKey(id) || (unit != null && unit.rows(this).containsKey(id)))) {
                throw new DuplicateKeyException(name + " " + id + " already exists");
            }
        }

        private void checkVersion(String id, T candidate) {
            if (versionOf == null) {
                return;
            }
            T current = rows.get(id);
            Long expected = versionOf.apply(candidate);
            Long actual = current == null ? null : versionOf.apply(current);
            if (!Objects.equals(expected, actual)) {
                throw new OptimisticLockingFailureException(String.format(
                    "%s %s was modified concurrently (expected version %s, found %s)", name, id, expected, actual));
            }
        }

        private void store(String id, T row) {
            if (versionSetter != null) {
                Long current = versionOf.apply(row);
                versionSetter.accept(row, current == null ? 0L : current + 1);
            }
            rows.put(id, row);
        }
    }
}
