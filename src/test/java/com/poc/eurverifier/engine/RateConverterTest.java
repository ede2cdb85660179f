package com.poc.eurverifier.engine;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("RateConverter")
class RateConverterTest {

    private RateConverter converter;

    @BeforeEach
    void setUp() {
        converter = new RateConverter(ExchangeRate.BGN_EUR);
    }

    private MonetaryValue bgn(String amount) {
        return MonetaryValue.of(new BigDecimal(amount), Currency.BGN);
    }

    @Nested
    @DisplayName("convertBgnToEur")
    class Conversion {

        @Test
        @DisplayName("Should convert the rate itself times 100000 to exactly 100000.00 EUR")
        void identity() {
            MonetaryValue eur = converter.convertBgnToEur(bgn("195583"));

            assertThat(eur.getAmount()).isEqualTo(new BigDecimal("100000.00"));
            assertThat(eur.getCurrency()).isEqualTo(Currency.EUR);
        }

        @Test
        @DisplayName("Should round 100.00 BGN to 51.13 EUR")
        void hundredLeva() {
            assertThat(converter.convertBgnToEur(bgn("100.00")).getAmount()).isEqualTo(new BigDecimal("51.13"));
        }

        @Test
        @DisplayName("Should round an exact midpoint away from zero")
        void midpointRoundsUp() {
            // 19.56807915 / 1.95583 = 10.005 exactly
            assertThat(converter.convertBgnToEur(bgn("19.56807915")).getAmount()).isEqualTo(new BigDecimal("10.01"));
            assertThat(converter.convertBgnToEur(bgn("-19.56807915")).getAmount()).isEqualTo(new BigDecimal("-10.01"));
        }

        @Test
        @DisplayName("Should round just below a midpoint down")
        void belowMidpointRoundsDown() {
            assertThat(converter.convertBgnToEur(bgn("19.56807914")).getAmount()).isEqualTo(new BigDecimal("10.00"));
        }

        @Test
        @DisplayName("Should always produce cent scale")
        void centScale() {
            assertThat(converter.convertBgnToEur(bgn("0")).getAmount().scale()).isEqualTo(2);
            assertThat(converter.convertBgnToEur(bgn("3.9116600")).getAmount()).isEqualTo(new BigDecimal("2.00"));
        }

        @Test
        @DisplayName("Should use a substituted rate")
        void substitutedRate() {
            RateConverter halving = new RateConverter(new ExchangeRate(Currency.BGN, Currency.EUR, new BigDecimal("2")));

            assertThat(halving.convertBgnToEur(bgn("100.01")).getAmount()).isEqualTo(new BigDecimal("50.01"));
        }

        @Test
        @DisplayName("Should reject an amount in the wrong currency")
        void wrongCurrency() {
            MonetaryValue eur = MonetaryValue.of(BigDecimal.TEN, Currency.EUR);

            assertThatThrownBy(() -> converter.convertBgnToEur(eur)).isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("toMonetary")
    class Parsing {

        @Test
        @DisplayName("Should accept integers, decimals and long fractions")
        void numbers() {
            assertThat(converter.toMonetary(42, Currency.BGN).getAmount()).isEqualByComparingTo("42");
            assertThat(converter.toMonetary(7L, Currency.BGN).getAmount()).isEqualByComparingTo("7");
            assertThat(converter.toMonetary(new BigDecimal("12.345678"), Currency.BGN).getAmount())
                    .isEqualTo(new BigDecimal("12.345678"));
        }

        @Test
        @DisplayName("Should read doubles through their decimal representation")
        void doubles() {
            assertThat(converter.toMonetary(0.1d, Currency.EUR).getAmount()).isEqualTo(new BigDecimal("0.1"));
            assertThat(converter.toMonetary(51.13d, Currency.EUR).getAmount()).isEqualTo(new BigDecimal("51.13"));
            assertThat(converter.toMonetary(0.1f, Currency.EUR).getAmount()).isEqualTo(new BigDecimal("0.1"));
        }

        @Test
        @DisplayName("Should clean grouping spaces and decimal commas in text")
        void text() {
            assertThat(converter.toMonetary(" 1 234,56 ", Currency.BGN).getAmount()).isEqualTo(new BigDecimal("1234.56"));
            assertThat(converter.toMonetary("1 000.5", Currency.BGN).getAmount()).isEqualTo(new BigDecimal("1000.5"));
            assertThat(converter.toMonetary("-3.14", Currency.BGN).getAmount()).isEqualTo(new BigDecimal("-3.14"));
        }

        @Test
        @DisplayName("Should reject empty, textual, boolean, date and non-finite values")
        void nonNumeric() {
            Object[] values = {null, "", "   ", "Total", true, LocalDateTime.of(2025, 1, 1, 0, 0),
                    Double.NaN, Double.POSITIVE_INFINITY, "1.2.3"};
            for (Object value : values) {
                assertThatThrownBy(() -> converter.toMonetary(value, Currency.BGN))
                        .as("value %s", value)
                        .isInstanceOf(NonNumericValueException.class);
                assertThat(converter.isNumeric(value)).as("value %s", value).isFalse();
            }
        }

        @Test
        @DisplayName("Should reject amounts with an extreme exponent")
        void extremeExponent() {
            Object[] values = {"1E-999999999", "1E+999999999", new BigDecimal("1E+31"), 1e-300d};
            for (Object value : values) {
                assertThatThrownBy(() -> converter.toMonetary(value, Currency.BGN))
                        .as("value %s", value)
                        .isInstanceOf(NonNumericValueException.class);
                assertThat(converter.isNumeric(value)).as("value %s", value).isFalse();
            }
            assertThat(converter.toMonetary("1E+3", Currency.BGN).getAmount()).isEqualByComparingTo("1000");
            assertThat(converter.toMonetary(new BigDecimal("1E+29"), Currency.BGN).getAmount())
                    .isEqualByComparingTo("1E+29");
        }
    }

    @Test
    @DisplayName("roundToCents should round half up and keep the currency")
    void roundToCents() {
        MonetaryValue value = MonetaryValue.of(new BigDecimal("51.125"), Currency.EUR);

        MonetaryValue rounded = converter.roundToCents(value);

        assertThat(rounded.getAmount()).isEqualTo(new BigDecimal("51.13"));
        assertThat(rounded.getCurrency()).isEqualTo(Currency.EUR);
        assertThat(converter.roundToCents(MonetaryValue.of(new BigDecimal("51.1249"), Currency.EUR)).getAmount())
                .isEqualTo(new BigDecimal("51.12"));
    }

    @Test
    @DisplayName("Exchange rate should reject a non-positive divisor")
    void invalidRate() {
        assertThatThrownBy(() -> new ExchangeRate(Currency.BGN, Currency.EUR, BigDecimal.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
