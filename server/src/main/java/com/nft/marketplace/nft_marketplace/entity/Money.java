package com.nft.marketplace.nft_marketplace.entity;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Fixed-precision amount used for prices, bids, balances and escrow.
 *
 * Scale is 18 decimal places so one unit splits the same way a wei-denominated
 * coin does. Never use double/float for money.
 *
 * Serialized to JSON as a plain decimal string; accepts a JSON number or string.
 * Input with more than 18 decimal places is rejected.
 *
 * Immutable and thread-safe.
 */
public final class Money implements Comparable<Money> {

    /**
     * Fixed scale for all monetary values (18 decimal places).
     */
    public static final int SCALE = 18;

    /**
     * Rounding mode for all operations: HALF_EVEN (banker's rounding).
     */
    public static final RoundingMode ROUNDING_MODE = RoundingMode.HALF_EVEN;

    public static final Money ZERO = new Money(BigDecimal.ZERO);

    private final BigDecimal amount;

    private Money(BigDecimal amount) {
        this.amount = amount.setScale(SCALE, ROUNDING_MODE);
    }

    /**
     * Rejects amounts finer than {@link #SCALE} decimal places instead of rounding them.
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Money of(BigDecimal amount) {
        if (amount == null) {
            throw new IllegalArgumentException("Amount cannot be null");
        }
        if (amount.stripTrailingZeros().scale() > SCALE) {
            throw new IllegalArgumentException("Amount has more than " + SCALE + " decimal places: " + amount);
        }
        return new Money(amount);
    }

    /**
     * Create Money from String (safest for parsing user input).
     */
    public static Money of(String amount) {
        if (amount == null || amount.trim().isEmpty()) {
            throw new IllegalArgumentException("Amount string cannot be null or empty");
        }
        BigDecimal parsed;
        try {
            parsed = new BigDecimal(amount.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid amount format: " + amount, e);
        }
        return of(parsed);
    }

    /**
     * Create Money from long (for whole amounts).
     */
    public static Money of(long amount) {
        return new Money(BigDecimal.valueOf(amount));
    }

    public Money add(Money other) {
        return new Money(this.amount.add(other.amount));
    }

    public Money subtract(Money other) {
        return new Money(this.amount.subtract(other.amount));
    }

    public Money negate() {
        return new Money(this.amount.negate());
    }

    public boolean isPositive() {
        return this.amount.compareTo(BigDecimal.ZERO) > 0;
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

    /**
     * Get underlying BigDecimal (for persistence/serialization only).
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

    /**
     * Plain string without trailing zeros, e.g. {@code 0.2}.
     */
    @JsonValue
    @Override
    public String toString() {
        BigDecimal stripped = amount.stripTrailingZeros();
        return (stripped.scale() < 0 ? stripped.setScale(0) : stripped).toPlainString();
    }
}
