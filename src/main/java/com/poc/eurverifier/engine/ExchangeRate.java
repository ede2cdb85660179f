package com.poc.eurverifier.engine;

import lombok.NonNull;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Fixed conversion rate expressed as source units per one target unit.
 */
@Value
public class ExchangeRate {

    /** Irrevocably fixed rate: 1 EUR = 1.95583 BGN. */
    public static final ExchangeRate BGN_EUR =
            new ExchangeRate(Currency.BGN, Currency.EUR, new BigDecimal("1.95583"));

    @NonNull Currency from;
    @NonNull Currency to;
    @NonNull BigDecimal divisor;

    public ExchangeRate(Currency from, Currency to, BigDecimal divisor) {
        if (divisor.signum() <= 0) {
            throw new IllegalArgumentException("Exchange rate divisor must be positive: " + divisor);
        }
        this.from = from;
        this.to = to;
        this.divisor = divisor;
    }
}
