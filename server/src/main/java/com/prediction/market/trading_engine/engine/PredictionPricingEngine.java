package com.prediction.market.trading_engine.engine;

import java.math.BigDecimal;
import java.math.RoundingMode;

import com.prediction.market.trading_engine.entity.Market;
import com.prediction.market.trading_engine.entity.Money;
import com.prediction.market.trading_engine.entity.Outcome;
import com.prediction.market.trading_engine.exception.InvalidTradeException;
import com.prediction.market.trading_engine.exception.MarketClosedException;
import com.prediction.market.trading_engine.exception.ValidationException;

/**
 * Constant-product pricing for binary markets.
 *
 * The reserve opposite the traded side plays the role of collateral: a buy pushes the net spend into it,
 * a sell pulls proceeds out of it, and the traded side's reserve is solved so that yes * no stays equal to
 * k. k is kept unrounded and reserves carry {@link #RESERVE_SCALE} decimals, so yes * no stays within 1e-3
 * of k for reserves up to 1e12 per side. Shares, fees and proceeds are {@link Money}; the sub-1e-8 remainder
 * of a share rounding stays in the reserve.
 *
 * No I/O and no mutation; callers apply the returned quote.
 */
public class PredictionPricingEngine {

    public record BuyQuote(
        Money fee,
        Money netAmount,
        Money sharesOut,
        BigDecimal newYesReserve,
        BigDecimal newNoReserve,
        Money totalCost,
        Money averagePrice
    ) {
    }

    public record SellQuote(
        Money fee,
        Money grossProceeds,
        Money netProceeds,
        BigDecimal newYesReserve,
        BigDecimal newNoReserve,
        Money averagePrice
    ) {
    }

    public static final int RESERVE_SCALE = 18;

    private final BigDecimal feeRate;

    public PredictionPricingEngine(BigDecimal feeRate) {
        if (feeRate == null || feeRate.signum() < 0 || feeRate.compareTo(BigDecimal.ONE) >= 0) {
            throw new IllegalArgumentException("feeRate must be in [0, 1)");
        }
        this.feeRate = feeRate;
    }

    public BigDecimal getFeeRate() {
        return feeRate;
    }

    // Spot probability of a side: the other side's share of total reserves.
    public Money price(Money yesReserve, Money noReserve, Outcome side) {
        requirePositiveReserves(yesReserve, noReserve);
        Money opposite = side == Outcome.YES ? noReserve : yesReserve;
        return opposite.divide(yesReserve.add(noReserve));
    }

    /**
     * Price of the next infinitesimal share of {@code side}. Average fill prices of buys and sells converge to
     * this as the trade size shrinks, so it is the reference for slippage.
     */
    public Money marginalPrice(Money yesReserve, Money noReserve, Outcome side) {
        requirePositiveReserves(yesReserve, noReserve);
        return side == Outcome.YES ? noReserve.divide(yesReserve) : yesReserve.divide(noReserve);
    }

    /**
     * Quote against a stored market, solving against its fixed invariant rather than the product of its
     * (rounded) current reserves.
     */
    public BuyQuote quoteBuy(Market market, Outcome side, Money grossAmount) {
        requireTradable(market);
        return quoteBuy(market.getYesReserve(), market.getNoReserve(), market.invariant(), side, grossAmount);
    }

    public BuyQuote quoteBuy(Money yesReserve, Money noReserve, Outcome side, Money grossAmount) {
        requirePositiveReserves(yesReserve, noReserve);
        BigDecimal yes = yesReserve.toBigDecimal();
        BigDecimal no = noReserve.toBigDecimal();
        return quoteBuy(yes, no, yes.multiply(no), side, grossAmount);
    }

    private BuyQuote quoteBuy(BigDecimal yesReserve, BigDecimal noReserve, BigDecimal k, Outcome side,
                              Money grossAmount) {
        requireSide(side);
        if (grossAmount == null || !grossAmount.isPositive()) {
            throw new ValidationException("Buy amount must be positive");
        }
        requirePositiveReserves(yesReserve, noReserve);

        Money fee = grossAmount.multiply(feeRate);
        Money netAmount = grossAmount.subtract(fee);
        if (!netAmount.isPositive()) {
            throw new InvalidTradeException("Buy amount is consumed entirely by the fee");
        }

        BigDecimal boughtReserve = side == Outcome.YES ? yesReserve : noReserve;
        BigDecimal newOpposite = (side == Outcome.YES ? noReserve : yesReserve).add(netAmount.toBigDecimal());
        BigDecimal newBought = solve(k, newOpposite);

        if (newBought.signum() <= 0) {
            throw new InvalidTradeException("Trade would exhaust the " + side + " reserve");
        }
        Money sharesOut = Money.of(boughtReserve.subtract(newBought));
        if (!sharesOut.isPositive()) {
            throw new InvalidTradeException("Buy amount too small to yield any shares");
        }

        BigDecimal newYes = side == Outcome.YES ? newBought : newOpposite;
        BigDecimal newNo = side == Outcome.YES ? newOpposite : newBought;

        return new BuyQuote(fee, netAmount, sharesOut, newYes, newNo, grossAmount, netAmount.divide(sharesOut));
    }

    public SellQuote quoteSell(Market market, Outcome side, Money sharesIn) {
        requireTradable(market);
        return quoteSell(market.getYesReserve(), market.getNoReserve(), market.invariant(), side, sharesIn);
    }

    public SellQuote quoteSell(Money yesReserve, Money noReserve, Outcome side, Money sharesIn) {
        requirePositiveReserves(yesReserve, noReserve);
        BigDecimal yes = yesReserve.toBigDecimal();
        BigDecimal no = noReserve.toBigDecimal();
        return quoteSell(yes, no, yes.multiply(no), side, sharesIn);
    }

    private SellQuote quoteSell(BigDecimal yesReserve, BigDecimal noReserve, BigDecimal k, Outcome side,
                                Money sharesIn) {
        requireSide(side);
        if (sharesIn == null || !sharesIn.isPositive()) {
            throw new ValidationException("Shares to sell must be positive");
        }
        requirePositiveReserves(yesReserve, noReserve);

        BigDecimal oppositeReserve = side == Outcome.YES ? noReserve : yesReserve;
        BigDecimal newSold = (side == Outcome.YES ? yesReserve : noReserve).add(sharesIn.toBigDecimal());
        BigDecimal newOpposite = solve(k, newSold);

        if (newOpposite.signum() <= 0) {
            throw new InvalidTradeException("Trade would exhaust the " + side.opposite() + " reserve");
        }
        Money grossProceeds = Money.of(oppositeReserve.subtract(newOpposite));
        if (!grossProceeds.isPositive()) {
            throw new InvalidTradeException("Sell size too small to yield any proceeds");
        }

        Money fee = grossProceeds.multiply(feeRate);
        Money netProceeds = grossProceeds.subtract(fee);

        BigDecimal newYes = side == Outcome.YES ? newSold : newOpposite;
        BigDecimal newNo = side == Outcome.YES ? newOpposite : newSold;

        return new SellQuote(fee, grossProceeds, netProceeds, newYes, newNo, grossProceeds.divide(sharesIn));
    }

    private static BigDecimal solve(BigDecimal k, BigDecimal otherReserve) {
        return k.divide(otherReserve, RESERVE_SCALE, RoundingMode.HALF_EVEN);
    }

    private static void requireTradable(Market market) {
        if (market.isResolved()) {
            throw new MarketClosedException(market.getId(), "market is resolved");
        }
    }

    private static void requireSide(Outcome side) {
        if (side == null) {
            throw new ValidationException("Side must be YES or NO");
        }
    }

    private static void requirePositiveReserves(Money yesReserve, Money noReserve) {
        if (yesReserve == null || noReserve == null) {
            throw new InvalidTradeException("Market reserves must be positive");
        }
        requirePositiveReserves(yesReserve.toBigDecimal(), noReserve.toBigDecimal());
    }

    private static void requirePositiveReserves(BigDecimal yesReserve, BigDecimal noReserve) {
        if (yesReserve == null || noReserve == null || yesReserve.signum() <= 0 || noReserve.signum() <= 0) {
            throw new InvalidTradeException("Market reserves must be positive");
        }
    }
}
