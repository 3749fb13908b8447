package com.ratint.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ratint.exception.InvalidIntegrandException;
import com.ratint.expression.Constant;
import com.ratint.expression.Expression;
import com.ratint.expression.Expressions;
import com.ratint.expression.Symbol;
import com.ratint.polynomial.Polynomial;
import com.ratint.polynomial.RationalFunction;
import com.ratint.test.TestBase;
import com.ratint.test.TestCategories;
import com.ratint.types.RadicalNumber;
import com.ratint.types.Rational;
import java.math.BigInteger;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("Rational Function Conversion Tests")
public class RationalFunctionConverterTest extends TestBase {

    private final RationalFunctionConverter<RadicalNumber> converter =
        new RationalFunctionConverter<>(RadicalDomain.get(), X);

    @Nested
    @DisplayName("Radical coefficients")
    class Radical {

        @Test
        @DisplayName("Quotients are reduced to lowest terms")
        void testLowestTerms() {
            Expression e = Expressions.divide(expr(-1, 0, 1), expr(-1, 1));

            RationalFunction<RadicalNumber> f = converter.convert(e);

            assertThat(f.numerator()).isEqualTo(poly(1, 1));
            assertThat(f.denominator()).isEqualTo(poly(1));
            assertThat(f.isPolynomial()).isTrue();
            assertThat(f.isConstant()).isFalse();
            assertThat(converter.convert(Constant.of(7)).isConstant()).isTrue();
        }

        @Test
        @DisplayName("Denominators are made monic")
        void testMonicDenominator() {
            Expression e = Expressions.divide(Constant.ONE, expr(4, 2));

            RationalFunction<RadicalNumber> f = converter.convert(e);

            assertThat(f.denominator()).isEqualTo(poly(2, 1));
            assertThat(f.numerator()).isEqualTo(Polynomial.constant(X, RadicalNumber.of(Rational.HALF)));
        }

        @Test
        @DisplayName("Square roots and I become radical coefficients")
        void testRadicalConstants() {
            Expression e = Expressions.add(Expressions.multiply(Expressions.sqrt(Constant.TWO), X), Constant.ONE);

            RationalFunction<RadicalNumber> f = converter.convert(e);

            assertThat(f.numerator().coefficient(1)).isEqualTo(RadicalNumber.sqrt(Rational.TWO).orElseThrow());
            assertThat(RadicalDomain.get().fromExpression(Expressions.sqrt(Constant.of(-4))))
                .isEqualTo(RadicalNumber.I.multiply(2));
        }

        @Test
        @DisplayName("Transcendental subexpressions of x are rejected")
        void testRejectsLog() {
            assertThatThrownBy(() -> converter.convert(Expressions.add(Expressions.log(X), X)))
                .isInstanceOf(InvalidIntegrandException.class)
                .hasMessageContaining("not a polynomial");
        }

        @Test
        @DisplayName("Cube roots of constants are rejected")
        void testRejectsCubeRoot() {
            Expression e = Expressions.multiply(Expressions.power(Constant.TWO, Constant.of(1, 3)), X);

            assertThatThrownBy(() -> converter.convert(e))
                .isInstanceOf(InvalidIntegrandException.class)
                .hasMessageContaining("square roots");
        }

        @Test
        @DisplayName("Exponents beyond the int range are rejected")
        void testExponentOutOfRange() {
            Expression huge = Constant.of(Rational.of(BigInteger.TWO.pow(40)));
            Expression variablePower = Expressions.power(X, huge);
            Expression constantPower = Expressions.multiply(
                Expressions.power(Expressions.add(Expressions.sqrt(Constant.TWO), Constant.ONE), huge), X);

            assertThatThrownBy(() -> converter.convert(variablePower))
                .isInstanceOf(InvalidIntegrandException.class)
                .hasMessageContaining("Exponent out of range")
                .hasCauseInstanceOf(ArithmeticException.class);
            assertThatThrownBy(() -> converter.convert(constantPower))
                .isInstanceOf(InvalidIntegrandException.class)
                .hasMessageContaining("Exponent out of range");
        }

        @Test
        @DisplayName("Symbols other than x are rejected without a parametric domain")
        void testRejectsFreeSymbol() {
            Expression e = Expressions.add(X, Symbol.of("a"));

            assertThatThrownBy(() -> converter.convert(e))
                .isInstanceOf(InvalidIntegrandException.class);
        }
    }

    @Nested
    @DisplayName("Parametric coefficients")
    class Parametric {

        @Test
        @DisplayName("Parameters become rational functions in the coefficient field")
        void testParameter() {
            Symbol a = Symbol.of("a");
            ParametricDomain<RadicalNumber> domain = new ParametricDomain<>(RadicalDomain.get(), a);
            RationalFunctionConverter<RationalFunction<RadicalNumber>> parametric =
                new RationalFunctionConverter<>(domain, X);

            RationalFunction<RationalFunction<RadicalNumber>> f =
                parametric.convert(Expressions.divide(X, Expressions.add(X, a)));

            RationalFunction<RadicalNumber> aValue = RationalFunction.variable(a, RadicalNumber.ONE);
            assertThat(f.numerator()).isEqualTo(Polynomial.of(X, domain.zero(), List.of(domain.zero(), domain.one())));
            assertThat(f.denominator()).isEqualTo(Polynomial.of(X, domain.zero(), List.of(aValue, domain.one())));
            assertThat(domain.toExpression(aValue)).isEqualTo(a);
        }
    }
}
