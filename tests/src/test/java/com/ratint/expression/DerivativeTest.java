package com.ratint.expression;

import static org.assertj.core.api.Assertions.assertThat;

import com.ratint.test.Complex;
import com.ratint.test.NumericVerifier;
import com.ratint.test.TestBase;
import com.ratint.test.TestCategories;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("Derivative Tests")
public class DerivativeTest extends TestBase {

    private static final Complex POINT = new Complex(0.7, 0.2);

    private static Complex at(Expression e) {
        return NumericVerifier.evaluate(e, Map.of(X, POINT));
    }

    @Test
    @DisplayName("Power rule for polynomials")
    void testPolynomial() {
        Expression d = Derivative.differentiate(Expressions.power(X, 3), X);

        assertThat(d).isEqualTo(Expressions.multiply(Constant.of(3), Expressions.power(X, 2)));
    }

    @Test
    @DisplayName("Constants and other symbols differentiate to zero")
    void testConstants() {
        assertThat(Derivative.differentiate(Symbol.of("a"), X)).isEqualTo(Constant.ZERO);
        assertThat(Derivative.differentiate(ImaginaryUnit.get(), X)).isEqualTo(Constant.ZERO);
    }

    @Test
    @DisplayName("d/dx log(x^2 + 1) = 2x/(x^2 + 1)")
    void testLog() {
        Expression u = Expressions.add(Expressions.power(X, 2), Constant.ONE);

        Complex actual = at(Derivative.differentiate(Expressions.log(u), X));
        Complex expected = at(Expressions.multiply(Constant.TWO, X)).divide(at(u));

        assertThat(actual.isClose(expected, 1e-12)).isTrue();
    }

    @Test
    @DisplayName("d/dx atan(x) = 1/(1 + x^2)")
    void testAtan() {
        Complex actual = at(Derivative.differentiate(Expressions.atan(X), X));
        Complex expected = Complex.ONE.divide(Complex.ONE.add(POINT.multiply(POINT)));

        assertThat(actual.isClose(expected, 1e-12)).isTrue();
    }

    @Test
    @DisplayName("Quotient through negative powers")
    void testQuotient() {
        Expression f = Expressions.divide(X, Expressions.add(X, Constant.ONE));

        Complex actual = at(Derivative.differentiate(f, X));
        Complex expected = Complex.ONE.divide(POINT.add(Complex.ONE).pow(2));

        assertThat(actual.isClose(expected, 1e-12)).isTrue();
    }

    @Test
    @DisplayName("Root sums differentiate under the sum")
    void testRootSum() {
        Symbol t = Symbol.dummy("t", false);
        Expression body = Expressions.multiply(t, Expressions.log(Expressions.subtract(X, t)));
        Expression sum = Expressions.rootSum(List.of(Constant.of(-1), Constant.ZERO, Constant.ONE), t, body);

        Expression d = Derivative.differentiate(sum, X);

        assertThat(d).isInstanceOf(RootSum.class);
        // Σ t/(x - t) over t = ±1 is 2/(x^2 - 1)
        Complex expected = Complex.of(2).divide(POINT.multiply(POINT).subtract(Complex.ONE));
        assertThat(at(d).isClose(expected, 1e-9)).isTrue();
    }
}
