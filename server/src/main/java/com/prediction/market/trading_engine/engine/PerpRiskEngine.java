package com.prediction.market.trading_engine.engine;

import java.math.BigDecimal;

import com.prediction.market.trading_engine.config.TradingProperties;
import com.prediction.market.trading_engine.entity.Money;
import com.prediction.market.trading_engine.entity.PerpSide;
import com.prediction.market.trading_engine.exception.ValidationException;

/**
 * Pure risk math for leveraged perpetuals: liquidation threshold, unrealized PnL, funding and mark price.
 */
public class PerpRiskEngine {

    private static final BigDecimal HOURS_PER_YEAR = BigDecimal.valueOf(365L * 24);

    public record PnlSnapshot(Money pnl, BigDecimal pnlPercent) {
    }

    /**
     * Cash result of closing a position. payout is what the pool gets back; realizedPnL is payout - margin.
     */
    public record Settlement(Money pnl, Money fee, Money payout, Money realizedPnL) {
    }

    private final BigDecimal liquidationBuffer;
    private final BigDecimal markIndexWeight;
    private final BigDecimal markFundingFactor;
    private final BigDecimal feeRate;
    private final int minLeverage;
    private final int maxLeverage;

    public PerpRiskEngine(TradingProperties properties) {
        this.liquidationBuffer = properties.liquidationBuffer();
        this.markIndexWeight = properties.markIndexWeight();
        this.markFundingFactor = properties.markFundingFactor();
        this.feeRate = properties.perpFeeRate();
        this.minLeverage = properties.minLeverage();
        this.maxLeverage = properties.maxLeverage();
    }

    /**
     * Price at which the position has lost {@code buffer / leverage} of its notional, i.e. 90% of its margin
     * with the default buffer. Longs liquidate below entry, shorts above. Higher leverage moves the price
     * closer to entry.
     */
    public Money liquidationPrice(Money entryPrice, PerpSide side, int leverage) {
        requirePositive(entryPrice, "Entry price");
        requireLeverage(leverage);

        BigDecimal move = liquidationBuffer.divide(BigDecimal.valueOf(leverage), Money.SCALE * 2, Money.ROUNDING_MODE);
        BigDecimal factor = side.isLong() ? BigDecimal.ONE.subtract(move) : BigDecimal.ONE.add(move);
        return entryPrice.multiply(factor);
    }

    public PnlSnapshot unrealizedPnl(Money entryPrice, Money currentPrice, PerpSide side, Money size) {
        requirePositive(entryPrice, "Entry price");
        requirePositive(size, "Size");

        Money move = side.isLong() ? currentPrice.subtract(entryPrice) : entryPrice.subtract(currentPrice);
        // multiply before dividing so that whole-unit moves stay exact
        Money pnl = Money.of(move.toBigDecimal().multiply(size.toBigDecimal())
            .divide(entryPrice.toBigDecimal(), Money.SCALE, Money.ROUNDING_MODE));
        return new PnlSnapshot(pnl, pnl.percentOf(size));
    }

    /**
     * Funding owed for holding {@code size} notional for {@code hoursHeld} at an annual rate:
     * {@code size * (rate / (365*3)) * (hours / 8)}. Positive means longs pay.
     */
    public Money fundingPayment(Money size, BigDecimal annualFundingRate, long hoursHeld) {
        if (hoursHeld <= 0 || annualFundingRate == null || annualFundingRate.signum() == 0) {
            return Money.ZERO;
        }
        BigDecimal owed = size.toBigDecimal()
            .multiply(annualFundingRate)
            .multiply(BigDecimal.valueOf(hoursHeld));
        return Money.of(owed.divide(HOURS_PER_YEAR, Money.SCALE, Money.ROUNDING_MODE));
    }

    /**
     * Blend of index and last trade price, nudged by the funding rate. Falls back to the index when no
     * trade has printed yet.
     */
    public Money markPrice(Money indexPrice, Money lastTradePrice, BigDecimal fundingRate) {
        requirePositive(indexPrice, "Index price");
        Money last = lastTradePrice != null && lastTradePrice.isPositive() ? lastTradePrice : indexPrice;
        BigDecimal rate = fundingRate == null ? BigDecimal.ZERO : fundingRate;

        Money blended = indexPrice.multiply(markIndexWeight)
            .add(last.multiply(BigDecimal.ONE.subtract(markIndexWeight)));
        return blended.multiply(BigDecimal.ONE.add(rate.multiply(markFundingFactor)));
    }

    public boolean shouldLiquidate(Money currentPrice, Money liquidationPrice, PerpSide side) {
        return side.isLong()
            ? currentPrice.isLessThanOrEqualTo(liquidationPrice)
            : currentPrice.isGreaterThanOrEqualTo(liquidationPrice);
    }

    /**
     * Settle a position at {@code exitPrice}. The close fee is capped at the remaining equity and the
     * payout never goes below zero, so a position can lose at most its margin.
     */
    public Settlement settle(Money entryPrice, Money exitPrice, PerpSide side, Money size, Money margin) {
        Money pnl = unrealizedPnl(entryPrice, exitPrice, side, size).pnl();
        Money equity = margin.add(pnl);
        Money fee = tradingFee(size).min(equity.max(Money.ZERO));
        Money payout = equity.subtract(fee).max(Money.ZERO);
        return new Settlement(pnl, fee, payout, payout.subtract(margin));
    }

    public Money tradingFee(Money size) {
        return size.multiply(feeRate);
    }

    public Money positionSize(Money margin, int leverage) {
        return margin.multiply(leverage);
    }

    public BigDecimal getFeeRate() {
        return feeRate;
    }

    public int getMinLeverage() {
        return minLeverage;
    }

    public int getMaxLeverage() {
        return maxLeverage;
    }

    private void requireLeverage(int leverage) {
        if (leverage < minLeverage || leverage > maxLeverage) {
            throw new ValidationException(
                String.format("Leverage %d outside [%d, %d]", leverage, minLeverage, maxLeverage));
        }
    }

    private static void requirePositive(Money value, String name) {
        if (value == null || !value.isPositive()) {
            throw new ValidationException(name + " must be positive");
        }
    }
}
