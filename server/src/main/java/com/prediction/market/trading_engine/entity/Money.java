package com.prediction.market.trading_engine.entity;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * Fixed-precision money type for balances, shares, fees and prices.
 *
 * CRITICAL: Never use double/float for money in trading systems!
 * This class uses BigDecimal with fixed 8 decimal places.
 *
 * Immutable and thread-safe.
 */
public final class Money implements Comparable<Money> {

    /**
     * Fixed scale for all monetary values (8 decimal places).
     */
    public static final int SCALE = 8;

    /**
     * Rounding mode for all operations: HALF_EVEN (banker's rounding).
     * Prevents systematic bias in rounding errors.
     */
    public static final RoundingMode ROUNDING_MODE = RoundingMode.HALF_EVEN;

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final BigDecimal amount;

    public static final Money ZERO = new Money(BigDecimal.ZERO);
    public static final Money ONE = new Money(BigDecimal.ONE);

    private Money(BigDecimal amount) {
        this.amount = amount.setScale(SCALE, ROUNDING_MODE);
    }

    public static Money of(BigDecimal amount) {
        if (amount == null) {
            throw new IllegalArgumentException("Amount cannot be null");
        }
        return new Money(amount);
    }

    /**
     * Null-tolerant variant for optional persisted fields; null reads as zero.
     */
    public static Money orZero(BigDecimal amount) {
        return amount == null ? ZERO : new Money(amount);
    }

    public static Money of(long amount) {
        return new Money(BigDecimal.valueOf(amount));
    }

    /**
     * Create Money from String (safest for parsing user input).
     */
    public static Money of(String amount) {
        if (amount == null || amount.trim().isEmpty()) {
            throw new IllegalArgumentException("Amount string cannot be null or empty");
        }
        try {
            return new Money(new BigDecimal(amount));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid amount format: " + amount, e);
        }
    }

    public Money add(Money other) {
        return new Money(this.amount.add(other.amount));
    }

    public Money subtract(Money other) {
        return new Money(this.amount.subtract(other.amount));
    }

    /**
     * Multiply by a scalar value (rates, ratios).
     */
    public Money multiply(BigDecimal scalar) {
        return new Money(this.amount.multiply(scalar));
    }

    public Money multiply(Money other) {
        return new Money(this.amount.multiply(other.amount));
    }

    public Money multiply(int scalar) {
        return new Money(this.amount.multiply(BigDecimal.valueOf(scalar)));
    }

    public Money divide(BigDecimal scalar) {
        if (scalar.compareTo(BigDecimal.ZERO) == 0) {
            throw new ArithmeticException("Cannot divide by zero");
        }
        return new Money(this.amount.divide(scalar, SCALE, ROUNDING_MODE));
    }

    public Money divide(Money other) {
        return divide(other.amount);
    }

    public Money divide(int scalar) {
        if (scalar == 0) {
            throw new ArithmeticException("Cannot divide by zero");
        }
        return new Money(this.amount.divide(BigDecimal.valueOf(scalar), SCALE, ROUNDING_MODE));
    }

    /**
     * This amount as a percentage of {@code base} ({@code this / base * 100}).
     */
    public BigDecimal percentOf(Money base) {
        if (base.isZero()) {
            return BigDecimal.ZERO.setScale(SCALE);
        }
        return this.amount.multiply(HUNDRED).divide(base.amount, SCALE, ROUNDING_MODE);
    }

    public Money negate() {
        return new Money(this.amount.negate());
    }

    public Money abs() {
        return new Money(this.amount.abs());
    }

    public Money min(Money other) {
        return this.compareTo(other) <= 0 ? this : other;
    }

    public Money max(Money other) {
        return this.compareTo(other) >= 0 ? this : other;
    }

    public boolean isPositive() {
        return this.amount.compareTo(BigDecimal.ZERO) > 0;
    }

    public boolean isNegative() {
        return this.amount.compareTo(BigDecimal.ZERO) < 0;
    }

    public boolean isZero() {
        return this.amount.compareTo(BigDecimal.ZERO) == 0;
    }

    public boolean isGreaterThan(Money other) {
        return this.compareTo(other) > 0;
    }

    public boolean isGreaterThanOrEqualTo(Money other) {
        return this.compareTo(other) >= 0;
    }

    public boolean isLessThan(Money other) {
        return this.compareTo(other) < 0;
    }

    public boolean isLessThanOrEqualTo(Money other) {
        return this.compareTo(other) <= 0;
    }

    /**
     * Get underlying BigDecimal (for persistence and exact intermediate products only).
     */
    public BigDecimal toBigDecimal() {
        return amount;
    }

    @Override
    public int compareTo(Money other) {
        return this.amount.compareTo(other.amount);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        Money money = (Money) obj;
        return amount.compareTo(money.amount) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(amount);
    }

    @Override
    public String toString() {
        return amount.toPlainString();
    }
}
