package com.poc.eurverifier.engine;

import lombok.NonNull;
import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Exact decimal amount tagged with the currency of the grid it was read from.
 * Never backed by binary floating point.
 */
@Value
public class MonetaryValue {

    public static final int CENT_SCALE = 2;

    @NonNull BigDecimal amount;
    @NonNull Currency currency;

    public static MonetaryValue of(BigDecimal amount, Currency currency) {
        return new MonetaryValue(amount, currency);
    }

    /**
     * Round-half-up (ties away from zero) to cent precision.
     */
    public MonetaryValue toCents() {
        return new MonetaryValue(amount.setScale(CENT_SCALE, RoundingMode.HALF_UP), currency);
    }

    public MonetaryValue subtract(MonetaryValue other) {
        requireSameCurrency(other);
        return new MonetaryValue(amount.subtract(other.amount), currency);
    }

    /**
     * Numeric equality ignoring scale, so 51.1 and 51.10 compare equal.
     */
    public boolean isSameAmount(MonetaryValue other) {
        requireSameCurrency(other);
        return amount.compareTo(other.amount) == 0;
    }

    private void requireSameCurrency(MonetaryValue other) {
        if (currency != other.currency) {
            throw new IllegalArgumentException("Currency mismatch: " + currency + " vs " + other.currency);
        }
    }

    @Override
    public String toString() {
        return amount.toPlainString() + " " + currency;
    }
}
