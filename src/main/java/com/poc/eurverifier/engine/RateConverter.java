package com.poc.eurverifier.engine;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.regex.Pattern;

/**
 * Reads raw cell values as {@link MonetaryValue}s and converts them at a fixed rate.
 * Stateless; safe to share between concurrent verification runs.
 */
public class RateConverter {

    // Regular, non-breaking and narrow no-break spaces used as thousands separators
    private static final Pattern GROUPING_SPACES = Pattern.compile("[\\s\\u00A0\\u202F]");

    // Amounts outside these bounds are not money and would make cent arithmetic overflow
    static final int MAX_SCALE = 50;
    static final int MAX_INTEGER_DIGITS = 30;

    private final ExchangeRate rate;

    public RateConverter(ExchangeRate rate) {
        this.rate = rate;
    }

    public ExchangeRate getRate() {
        return rate;
    }

    /**
     * Parses a raw cell value.
     *
     * @throws NonNumericValueException for empty cells, text, booleans, dates, non-finite numbers
     *                                  and amounts with an absurd exponent
     */
    public MonetaryValue toMonetary(Object rawValue, Currency currency) {
        return MonetaryValue.of(toDecimal(rawValue), currency);
    }

    public boolean isNumeric(Object rawValue) {
        try {
            toDecimal(rawValue);
            return true;
        } catch (NonNumericValueException e) {
            return false;
        }
    }

    /**
     * Divides by the fixed rate and rounds the exact quotient half-up to cents in one step.
     */
    public MonetaryValue convert(MonetaryValue value) {
        if (value.getCurrency() != rate.getFrom()) {
            throw new IllegalArgumentException("Expected " + rate.getFrom() + " amount, got " + value);
        }
        BigDecimal converted = value.getAmount()
                .divide(rate.getDivisor(), MonetaryValue.CENT_SCALE, RoundingMode.HALF_UP);
        return MonetaryValue.of(converted, rate.getTo());
    }

    public MonetaryValue convertBgnToEur(MonetaryValue bgnValue) {
        return convert(bgnValue);
    }

    public MonetaryValue roundToCents(MonetaryValue value) {
        return value.toCents();
    }

    private BigDecimal toDecimal(Object rawValue) {
        BigDecimal value = readDecimal(rawValue);
        if (value.scale() > MAX_SCALE || value.precision() - value.scale() > MAX_INTEGER_DIGITS) {
            throw new NonNumericValueException(rawValue);
        }
        return value;
    }

    private BigDecimal readDecimal(Object rawValue) {
        if (rawValue instanceof BigDecimal) {
            return (BigDecimal) rawValue;
        }
        if (rawValue instanceof Integer || rawValue instanceof Long
                || rawValue instanceof Short || rawValue instanceof Byte) {
            return BigDecimal.valueOf(((Number) rawValue).longValue());
        }
        if (rawValue instanceof BigInteger) {
            return new BigDecimal((BigInteger) rawValue);
        }
        if (rawValue instanceof Double || rawValue instanceof Float) {
            double d = ((Number) rawValue).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                throw new NonNumericValueException(rawValue);
            }
            // Shortest decimal representation, not the binary expansion
            return new BigDecimal(rawValue instanceof Float ? rawValue.toString() : Double.toString(d));
        }
        if (rawValue instanceof CharSequence) {
            return parse(rawValue.toString(), rawValue);
        }
        throw new NonNumericValueException(rawValue);
    }

    private BigDecimal parse(String text, Object rawValue) {
        String cleaned = GROUPING_SPACES.matcher(text).replaceAll("").replace(',', '.');
        if (cleaned.isEmpty()) {
            throw new NonNumericValueException(rawValue);
        }
        try {
            return new BigDecimal(cleaned);
        } catch (NumberFormatException e) {
            throw new NonNumericValueException(rawValue, e);
        }
    }
}
