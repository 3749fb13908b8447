package com.ratint.types;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ratint.test.TestBase;
import com.ratint.test.TestCategories;
import java.math.BigInteger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@TestCategories.Tier1
@TestCategories.Unit
@TestCategories.Algebra
@DisplayName("Rational Tests")
public class RationalTest extends TestBase {

    @Nested
    @DisplayName("Normalization")
    class Normalization {

        @Test
        @DisplayName("Fractions are reduced with a positive denominator")
        void testReducedWithPositiveDenominator() {
            Rational r = Rational.of(6, -4);

            assertThat(r.numerator()).isEqualTo(BigInteger.valueOf(-3));
            assertThat(r.denominator()).isEqualTo(BigInteger.TWO);
            assertThat(r).isEqualTo(Rational.of(-3, 2));
        }

        @Test
        @DisplayName("Zero denominator is rejected")
        void testZeroDenominator() {
            assertThatThrownBy(() -> Rational.of(1, 0))
                .isInstanceOf(ArithmeticException.class)
                .hasMessageContaining("Zero denominator");
        }

        @ParameterizedTest
        @CsvSource({
            "3/4, 3/4",
            "-6/8, -3/4",
            "10, 10",
            "' 2 / 6 ', 1/3"
        })
        @DisplayName("parse accepts fractions and integers")
        void testParse(String text, String expected) {
            assertThat(Rational.parse(text).toString()).isEqualTo(expected);
        }
    }

    @Nested
    @DisplayName("Arithmetic")
    class Arithmetic {

        @Test
        @DisplayName("Field operations are exact")
        void testFieldOperations() {
            Rational a = Rational.of(1, 3);
            Rational b = Rational.of(1, 6);

            assertThat(a.add(b)).isEqualTo(Rational.HALF);
            assertThat(a.subtract(b)).isEqualTo(Rational.of(1, 6));
            assertThat(a.multiply(b)).isEqualTo(Rational.of(1, 18));
            assertThat(a.divide(b)).isEqualTo(Rational.TWO);
            assertThat(a.inverse()).isEqualTo(Rational.of(3));
        }

        @Test
        @DisplayName("Zero has no inverse")
        void testZeroInverse() {
            assertThatThrownBy(() -> Rational.ZERO.inverse()).isInstanceOf(ArithmeticException.class);
        }

        @Test
        @DisplayName("Integer powers, including negative exponents")
        void testPower() {
            assertThat(Rational.of(2, 3).power(3)).isEqualTo(Rational.of(8, 27));
            assertThat(Rational.of(2, 3).power(-2)).isEqualTo(Rational.of(9, 4));
            assertThat(Rational.of(5).pow(0)).isEqualTo(Rational.ONE);
        }

        @Test
        @DisplayName("Exact square roots exist only for perfect squares")
        void testExactSquareRoot() {
            assertThat(Rational.of(9, 16).exactSquareRoot()).isEqualTo(Rational.of(3, 4));
            assertThat(Rational.of(2).exactSquareRoot()).isNull();
            assertThat(Rational.of(-4).exactSquareRoot()).isNull();
        }

        @Test
        @DisplayName("Ordering follows the numeric value")
        void testCompare() {
            assertThat(Rational.of(1, 3)).isLessThan(Rational.HALF);
            assertThat(Rational.of(-1, 2).compareTo(Rational.of(-2, 4))).isZero();
            assertThat(Rational.of(7, 4).doubleValue()).isEqualTo(1.75);
        }
    }
}
