package com.prediction.market.trading_engine.service;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Service;

import com.prediction.market.trading_engine.config.TradingProperties;
import com.prediction.market.trading_engine.entity.Market;
import com.prediction.market.trading_engine.entity.MarketType;
import com.prediction.market.trading_engine.entity.Money;
import com.prediction.market.trading_engine.entity.PerpMarket;
import com.prediction.market.trading_engine.entity.PerpPosition;
import com.prediction.market.trading_engine.entity.PerpStatus;
import com.prediction.market.trading_engine.entity.Pool;
import com.prediction.market.trading_engine.entity.Position;
import com.prediction.market.trading_engine.entity.TradeAction;
import com.prediction.market.trading_engine.entity.TradingDecision;
import com.prediction.market.trading_engine.exception.LiquidationConflictException;
import com.prediction.market.trading_engine.exception.MarketClosedException;
import com.prediction.market.trading_engine.exception.PositionNotFoundException;
import com.prediction.market.trading_engine.exception.ValidationException;
import com.prediction.market.trading_engine.repositories.TradingStore;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Strict decision validation.
 *
 * Every decision passes here before any lock is taken. Field problems are collected and reported
 * together; state problems (missing or closed market, foreign or closed position) throw the matching typed
 * exception. Read-only.
 *
 * The state checks are public so that execution can repeat them on the rows it re-reads inside its unit
 * of work.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DecisionValidator {

    private final TradingStore store;
    private final TradingProperties properties;
    private final Clock clock;

    /**
     * Result of field validation.
     */
    public static class ValidationResult {
        private final List<String> errors;

        private ValidationResult(List<String> errors) {
            this.errors = errors;
        }

        public boolean isValid() {
            return errors.isEmpty();
        }

        public List<String> getErrors() {
            return errors;
        }

        public String getErrorMessage() {
            return String.join("; ", errors);
        }
    }

    /**
     * Validate a decision against the current state.
     *
     * @return the market type the decision trades
     */
    public MarketType validate(TradingDecision decision) {
        ValidationResult fields = validateFields(decision);
        if (!fields.isValid()) {
            log.warn("Decision rejected: {} (actor={}, pool={})",
                fields.getErrors(), decision == null ? null : decision.getActorId(),
                decision == null ? null : decision.getPoolId());
            throw new ValidationException(fields.getErrorMessage());
        }

        MarketType marketType = marketTypeOf(decision);
        requireActivePool(decision.getPoolId());

        switch (decision.getAction()) {
            case BUY_YES, BUY_NO -> requireTradable(requireMarket(decision.getMarketId()));
            case SELL -> {
                Position position = requireOpenPosition(decision.getPositionId(), decision.getPoolId());
                requireSellableShares(position, Money.of(decision.getAmount()));
                requireTradable(requireMarket(position.getMarketId()));
            }
            case CLOSE_POSITION -> {
                if (marketType == MarketType.PERPETUAL) {
                    requireOpenPerpPosition(decision.getPositionId(), decision.getPoolId());
                } else {
                    Position position = requireOpenPosition(decision.getPositionId(), decision.getPoolId());
                    requireTradable(requireMarket(position.getMarketId()));
                }
            }
            case OPEN_LONG, OPEN_SHORT -> {
                PerpMarket market = requirePerpMarket(decision.getTicker());
                requireLeverage(leverageOf(decision), market);
                requireMinOrder(Money.of(decision.getAmount()), market);
            }
            case CLOSE_PERP -> requireOpenPerpPosition(decision.getPositionId(), decision.getPoolId());
            case HOLD -> throw new ValidationException("HOLD decisions are not executable");
        }
        return marketType;
    }

    public ValidationResult validateFields(TradingDecision decision) {
        List<String> errors = new ArrayList<>();
        if (decision == null) {
            errors.add("decision is required");
            return new ValidationResult(errors);
        }

        if (isBlank(decision.getActorId())) {
            errors.add("actorId is required");
        }
        if (isBlank(decision.getPoolId())) {
            errors.add("poolId is required");
        }
        TradeAction action = decision.getAction();
        if (action == null) {
            errors.add("action is required");
            return new ValidationResult(errors);
        }

        switch (action) {
            case BUY_YES, BUY_NO -> {
                requireText(decision.getMarketId(), "marketId", errors);
                requirePositiveAmount(decision.getAmount(), errors);
                if (decision.getAmount() != null
                        && decision.getAmount().compareTo(properties.minPredictionOrder()) < 0
                        && decision.getAmount().signum() > 0) {
                    errors.add(String.format("amount must be at least %s",
                        properties.minPredictionOrder().toPlainString()));
                }
            }
            case SELL -> {
                requireText(decision.getPositionId(), "positionId", errors);
                requirePositiveAmount(decision.getAmount(), errors);
            }
            case CLOSE_POSITION, CLOSE_PERP -> requireText(decision.getPositionId(), "positionId", errors);
            case OPEN_LONG, OPEN_SHORT -> {
                requireText(decision.getTicker(), "ticker", errors);
                requirePositiveAmount(decision.getAmount(), errors);
            }
            case HOLD -> {
                // nothing to check
            }
        }

        MarketType expected = expectedMarketType(action);
        if (decision.getMarketType() != null && expected != null && decision.getMarketType() != expected) {
            errors.add(String.format("action %s does not trade %s markets", action.getWireName(), decision.getMarketType()));
        }

        BigDecimal slippage = decision.getMaxSlippagePercent();
        if (slippage != null && slippage.signum() < 0) {
            errors.add("maxSlippagePercent cannot be negative");
        }

        return new ValidationResult(errors);
    }

    public MarketType marketTypeOf(TradingDecision decision) {
        MarketType expected = expectedMarketType(decision.getAction());
        if (expected != null) {
            return expected;
        }
        return decision.getMarketType() == null ? MarketType.PREDICTION : decision.getMarketType();
    }

    public int leverageOf(TradingDecision decision) {
        return decision.getLeverage() == null ? properties.defaultLeverage() : decision.getLeverage();
    }

    public Pool requireActivePool(String poolId) {
        Pool pool = store.findPool(poolId)
            .orElseThrow(() -> new ValidationException("Pool not found: " + poolId));
        if (!pool.isActive()) {
            throw new ValidationException("Pool is inactive: " + poolId);
        }
        return pool;
    }

    public Market requireMarket(String marketId) {
        return store.findMarket(marketId)
            .orElseThrow(() -> new ValidationException("Market not found: " + marketId));
    }

    public void requireTradable(Market market) {
        if (market.isResolved()) {
            throw new MarketClosedException(market.getId(), "market is resolved");
        }
        if (market.isExpired(clock.instant())) {
            throw new MarketClosedException(market.getId(), "market ended at " + market.getEndDate());
        }
    }

    public PerpMarket requirePerpMarket(String ticker) {
        return store.findPerpMarket(ticker)
            .orElseThrow(() -> new ValidationException("Perp market not found: " + ticker));
    }

    public Position requireOpenPosition(String positionId, String poolId) {
        Position position = store.findPosition(positionId)
            .orElseThrow(() -> new PositionNotFoundException(positionId, "not found"));
        checkOpenPosition(position, poolId);
        return position;
    }

    public void checkOpenPosition(Position position, String poolId) {
        if (!position.getPoolId().equals(poolId)) {
            throw new PositionNotFoundException(position.getId(), "does not belong to pool " + poolId);
        }
        if (!position.isOpen()) {
            throw new PositionNotFoundException(position.getId(), "already closed");
        }
    }

    public void requireSellableShares(Position position, Money shares) {
        if (shares.isGreaterThan(position.shareCount())) {
            throw new ValidationException(String.format("Cannot sell %s shares, position %s holds %s",
                shares, position.getId(), position.shareCount()));
        }
    }

    public PerpPosition requireOpenPerpPosition(String positionId, String poolId) {
        PerpPosition position = store.findPerpPosition(positionId)
            .orElseThrow(() -> new PositionNotFoundException(positionId, "not found"));
        checkOpenPerpPosition(position, poolId);
        return position;
    }

    public void checkOpenPerpPosition(PerpPosition position, String poolId) {
        if (!position.getOwnerId().equals(poolId)) {
            throw new PositionNotFoundException(position.getId(), "does not belong to pool " + poolId);
        }
        if (position.getStatus() == PerpStatus.LIQUIDATED) {
            throw new LiquidationConflictException(position.getId());
        }
        if (position.getStatus() != PerpStatus.OPEN) {
            throw new PositionNotFoundException(position.getId(), "already closed");
        }
    }

    public void requireLeverage(int leverage, PerpMarket market) {
        int max = Math.min(properties.maxLeverage(), market.getMaxLeverage());
        if (leverage < properties.minLeverage() || leverage > max) {
            throw new ValidationException(String.format("Leverage %d outside [%d, %d] for %s",
                leverage, properties.minLeverage(), max, market.getTicker()));
        }
    }

    private void requireMinOrder(Money margin, PerpMarket market) {
        Money min = Money.orZero(market.getMinOrderSize());
        if (margin.isLessThan(min)) {
            throw new ValidationException(String.format("Order of %s is below the %s minimum of %s",
                margin, market.getTicker(), min));
        }
    }

    private static MarketType expectedMarketType(TradeAction action) {
        return switch (action) {
            case BUY_YES, BUY_NO, SELL -> MarketType.PREDICTION;
            case OPEN_LONG, OPEN_SHORT, CLOSE_PERP -> MarketType.PERPETUAL;
            case CLOSE_POSITION, HOLD -> null;
        };
    }

    private static void requireText(String value, String field, List<String> errors) {
        if (isBlank(value)) {
            errors.add(field + " is required");
        }
    }

    private static void requirePositiveAmount(BigDecimal amount, List<String> errors) {
        if (amount == null || amount.signum() <= 0) {
            errors.add("amount must be positive");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
