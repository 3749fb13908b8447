package com.ratint.integration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ratint.config.DomainMode;
import com.ratint.config.IntegrationOptions;
import com.ratint.exception.InvalidIntegrandException;
import com.ratint.expression.Atan;
import com.ratint.expression.Constant;
import com.ratint.expression.Expression;
import com.ratint.expression.ExpressionUtils;
import com.ratint.expression.ImaginaryUnit;
import com.ratint.expression.Expressions;
import com.ratint.expression.RootSum;
import com.ratint.expression.Symbol;
import com.ratint.test.Complex;
import com.ratint.test.NumericVerifier;
import com.ratint.test.TestBase;
import com.ratint.test.TestCategories;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

/**
 * End-to-end tests of {@link RationalIntegrator}.
 *
 * <p>Every result is checked by differentiating it and comparing with the
 * integrand at complex sample points; closed forms are also compared exactly
 * where they are short.
 */
@TestCategories.Tier1
@TestCategories.Integration
@DisplayName("Rational Integrator Tests")
public class RationalIntegratorTest extends TestBase {

    private final RationalIntegrator integrator = new RationalIntegrator();

    private static boolean containsNode(Expression e, Class<? extends Expression> kind) {
        if (kind.isInstance(e)) {
            return true;
        }
        return e.children().stream().anyMatch(child -> containsNode(child, kind));
    }

    @Nested
    @DisplayName("Closed forms")
    class ClosedForms {

        @Test
        @DisplayName("36/(x^5 - 2x^4 - 2x^3 + 4x^2 + x - 2)")
        void testTextbookExample() {
            Expression q = expr(-2, 1, 4, -2, -2, 1);

            logStep("integrate");
            Expression result = integrator.integrate(Constant.of(36), q, X);

            logStep("verify " + result);
            assertThat(containsNode(result, RootSum.class)).isFalse();
            assertThat(containsNode(result, Atan.class)).isFalse();
            assertThat(ExpressionUtils.contains(result,
                Expressions.multiply(Constant.of(4), Expressions.log(expr(-2, 1))))).isTrue();
            assertThat(ExpressionUtils.contains(result,
                Expressions.multiply(Constant.of(-4), Expressions.log(expr(1, 1))))).isTrue();
            NumericVerifier.assertAntiderivative(result, Constant.of(36), q, X);
        }

        @Test
        @DisplayName("1/(x^2 + 1) = atan(x)")
        void testArctangent() {
            assertThat(integrator.integrate(Constant.ONE, expr(1, 0, 1), X)).isEqualTo(Expressions.atan(X));
        }

        @Test
        @DisplayName("A single quotient expression is split into numerator and denominator")
        void testSingleExpression() {
            Expression f = Expressions.divide(Constant.ONE, expr(1, 0, 1));

            assertThat(integrator.integrate(f, X)).isEqualTo(Expressions.atan(X));
        }

        @Test
        @DisplayName("Polynomials integrate termwise")
        void testPolynomial() {
            assertThat(integrator.integrate(expr(0, 0, 1), X))
                .isEqualTo(Expressions.multiply(Constant.of(1, 3), Expressions.power(X, 3)));
            assertThat(integrator.integrate(Constant.of(5), X))
                .isEqualTo(Expressions.multiply(Constant.of(5), X));
        }

        @Test
        @DisplayName("Zero integrates to zero")
        void testZero() {
            assertThat(integrator.integrate(Constant.ZERO, expr(1, 0, 1), X)).isEqualTo(Constant.ZERO);
        }

        @Test
        @DisplayName("1/(x - 3) = log(x - 3)")
        void testSimplePole() {
            assertThat(integrator.integrate(Constant.ONE, expr(-3, 1), X)).isEqualTo(Expressions.log(expr(-3, 1)));
        }

        @Test
        @DisplayName("Constants with square roots are kept exact")
        void testRadicalCoefficient() {
            Expression p = Expressions.sqrt(Constant.TWO);

            Expression result = integrator.integrate(p, expr(1, 0, 1), X);

            assertThat(result).isEqualTo(Expressions.multiply(Expressions.sqrt(Constant.TWO), Expressions.atan(X)));
        }
    }

    @Nested
    @DisplayName("Antiderivatives verified by differentiation")
    class Verified {

        @TestCategories.Tier2
        @ParameterizedTest(name = "({0}) / ({1})")
        @CsvSource({
            "'1', '1 0 2 0 1'",
            "'0 0 0 0 1', '1 0 1'",
            "'1', '-1 0 0 0 1'",
            "'1 0 1', '1 0 0 0 1'",
            "'1', '0 -1 0 1'",
            "'6 0 -3 0 1', '-4 0 5 0 -5 0 1'",
            "'1', '0 0 1 2 1'",
            "'2 1', '5 2 1'"
        })
        void testDerivativeMatches(String numerator, String denominator) {
            Expression p = expr(parse(numerator));
            Expression q = expr(parse(denominator));

            Expression result = integrator.integrate(p, q, X);

            logStep("result " + result);
            assertThat(containsNode(result, RootSum.class)).isFalse();
            NumericVerifier.assertAntiderivative(result, p, q, X);
        }

        @Test
        @TestCategories.Tier2
        @Timeout(60)
        @DisplayName("Sextic denominator without closed-form roots finishes in real mode")
        void testSexticWithoutClosedForm() {
            Expression p = expr(1, 2, 3, 4);
            Expression q = expr(1, -1, 1, -1, 1, -1, 1);

            Expression result = integrator.integrate(p, q, X, IntegrationOptions.defaults().withMode(DomainMode.REAL));

            logStep("result " + result);
            NumericVerifier.assertAntiderivative(result, p, q, X);
        }

        @Test
        @DisplayName("Irreducible cubic denominator stays a root sum")
        void testRootSumFallback() {
            Expression q = expr(1, 1, 0, 1);

            Expression result = integrator.integrate(Constant.ONE, q, X);

            assertThat(result).isInstanceOf(RootSum.class);
            assertThat(((RootSum) result).variable().name()).isEqualTo("t");
            NumericVerifier.assertAntiderivative(result, Constant.ONE, q, X);
        }

        @Test
        @DisplayName("Rational part and root sum together")
        void testMixed() {
            Expression q = Expressions.multiply(expr(1, 1, 0, 1), expr(1, 1, 0, 1));

            Expression result = integrator.integrate(expr(0, 1), q, X);

            assertThat(containsNode(result, RootSum.class)).isTrue();
            NumericVerifier.assertAntiderivative(result, expr(0, 1), q, X);
        }
    }

    @Nested
    @DisplayName("Output domain")
    class OutputDomain {

        @Test
        @DisplayName("Complex mode keeps conjugate roots in a root sum")
        void testComplexArctangent() {
            IntegrationOptions options = IntegrationOptions.defaults().withMode(DomainMode.COMPLEX);

            Expression result = integrator.integrate(Constant.ONE, expr(1, 0, 1), X, options);

            assertThat(result).isInstanceOf(RootSum.class);
            NumericVerifier.assertAntiderivative(result, Constant.ONE, expr(1, 0, 1), X);
        }

        @Test
        @DisplayName("Complex mode still writes closed-form real roots as logarithms")
        void testComplexRealRoots() {
            IntegrationOptions options = IntegrationOptions.defaults().withMode(DomainMode.COMPLEX);

            Expression result = integrator.integrate(Constant.ONE, expr(-2, 0, 1), X, options);

            assertThat(containsNode(result, RootSum.class)).isFalse();
            assertThat(containsNode(result, Atan.class)).isFalse();
            NumericVerifier.assertAntiderivative(result, Constant.ONE, expr(-2, 0, 1), X);
        }

        @TestCategories.Tier2
        @ParameterizedTest(name = "1 / ({0})")
        @CsvSource({
            "'1 0 0 0 1'",
            "'-4 4 -5 5 -1 1'",
            "'1 0 -10 0 1'"
        })
        @DisplayName("Real mode factors the residue polynomial before giving up")
        void testRealModeClosedForms(String denominator) {
            Expression q = expr(parse(denominator));
            IntegrationOptions options = IntegrationOptions.defaults().withMode(DomainMode.REAL);

            Expression result = integrator.integrate(Constant.ONE, q, X, options);

            logStep("result " + result);
            assertThat(containsNode(result, RootSum.class)).isFalse();
            NumericVerifier.assertAntiderivative(result, Constant.ONE, q, X);
        }

        @Test
        @DisplayName("Real and complex mode agree on a denominator with only real roots")
        void testRealRootsInBothModes() {
            Expression q = expr(1, 0, -10, 0, 1);

            Expression real = integrator.integrate(Constant.ONE, q, X,
                IntegrationOptions.defaults().withMode(DomainMode.REAL));
            Expression complex = integrator.integrate(Constant.ONE, q, X,
                IntegrationOptions.defaults().withMode(DomainMode.COMPLEX));

            assertThat(containsNode(real, Atan.class)).isFalse();
            assertThat(real).isEqualTo(complex);
        }

        @Test
        @DisplayName("The imaginary unit selects complex output")
        void testImaginaryCoefficient() {
            Expression p = Expressions.add(X, Expressions.multiply(Constant.TWO, ImaginaryUnit.get()));

            Expression result = integrator.integrate(p, expr(1, 0, 1), X);

            assertThat(containsNode(result, Atan.class)).isFalse();
            NumericVerifier.assertAntiderivative(result, p, expr(1, 0, 1), X);
        }

        @Test
        @DisplayName("Root sum variable follows the options")
        void testSymbolName() {
            IntegrationOptions options = IntegrationOptions.of("z", DomainMode.REAL);

            Expression result = integrator.integrate(Constant.ONE, expr(1, 1, 0, 1), X, options);

            assertThat(result).isInstanceOf(RootSum.class);
            assertThat(((RootSum) result).variable().name()).isEqualTo("z");
        }
    }

    @Nested
    @DisplayName("Parameters")
    class Parameters {

        private final Symbol a = Symbol.of("a");

        @Test
        @DisplayName("1/(x + a) = log(x + a)")
        void testLinear() {
            Expression result = integrator.integrate(Constant.ONE, Expressions.add(X, a), X);

            assertThat(result).isEqualTo(Expressions.log(Expressions.add(X, a)));
        }

        @Test
        @DisplayName("1/(x^2 + a) is a root sum over Q(a)")
        void testQuadratic() {
            Expression q = Expressions.add(Expressions.power(X, 2), a);

            Expression result = integrator.integrate(Constant.ONE, q, X);

            assertThat(containsNode(result, RootSum.class)).isTrue();
            assertThat(ExpressionUtils.freeSymbols(result)).containsExactlyInAnyOrder(X, a);
            NumericVerifier.assertAntiderivative(result, Constant.ONE, q, X, Map.of(a, Complex.of(2.3)));
        }

        @Test
        @TestCategories.Tier2
        @DisplayName("Repeated factors with a parameter go through Hermite reduction")
        void testRepeatedParametric() {
            Expression base = Expressions.add(X, a);
            Expression q = Expressions.multiply(Expressions.power(base, 2), expr(1, 1));

            Expression result = integrator.integrate(Constant.ONE, q, X);

            NumericVerifier.assertAntiderivative(result, Constant.ONE, q, X, Map.of(a, new Complex(0.6, 0.1)));
        }
    }

    @Nested
    @DisplayName("Determinism and errors")
    class Contract {

        @Test
        @DisplayName("Repeated calls give equal results")
        void testIdempotent() {
            Expression q = expr(1, 1, 0, 1);

            Expression first = integrator.integrate(expr(2, 0, 1), q, X);
            Expression second = integrator.integrate(expr(2, 0, 1), q, X);

            assertThat(first).isEqualTo(second);
            assertThat(integrator.integrate(Constant.of(36), expr(-2, 1, 4, -2, -2, 1), X))
                .isEqualTo(integrator.integrate(Constant.of(36), expr(-2, 1, 4, -2, -2, 1), X));
        }

        @Test
        @DisplayName("Zero denominator is rejected")
        void testZeroDenominator() {
            assertThatThrownBy(() -> integrator.integrate(Constant.ONE, Constant.ZERO, X))
                .isInstanceOf(InvalidIntegrandException.class)
                .hasMessageContaining("zero denominator");
        }

        @Test
        @DisplayName("Non-rational integrands are rejected")
        void testNonRational() {
            assertThatThrownBy(() -> integrator.integrate(Expressions.atan(X), expr(1, 1), X))
                .isInstanceOf(InvalidIntegrandException.class);
            assertThatThrownBy(() -> integrator.integrate(Expressions.sqrt(X), X))
                .isInstanceOf(InvalidIntegrandException.class);
        }

        @Test
        @DisplayName("Null arguments are rejected")
        void testNulls() {
            assertThatThrownBy(() -> integrator.integrate(Constant.ONE, null, X))
                .isInstanceOf(NullPointerException.class);
            assertThatThrownBy(() -> integrator.integrate(Constant.ONE, Constant.ONE, X, null))
                .isInstanceOf(NullPointerException.class);
        }
    }

    private static long[] parse(String coefficients) {
        String[] parts = coefficients.trim().split("\\s+");
        long[] values = new long[parts.length];
        for (int i = 0; i < parts.length; i++) {
            values[i] = Long.parseLong(parts[i]);
        }
        return values;
    }
}
