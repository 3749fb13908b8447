package com.ratint.expression;

import static org.assertj.core.api.Assertions.assertThat;

import com.ratint.test.TestBase;
import com.ratint.test.TestCategories;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("Expression Factory Tests")
public class ExpressionsTest extends TestBase {

    @Nested
    @DisplayName("Simplification")
    class Simplification {

        @Test
        @DisplayName("Constants fold and zero terms vanish")
        void testConstantFolding() {
            Expression e = Expressions.add(X, Constant.ONE, Constant.TWO, Constant.ZERO);

            assertThat(e.format()).isEqualTo("x + 3");
        }

        @Test
        @DisplayName("Like terms merge")
        void testLikeTerms() {
            Expression e = Expressions.add(X, Expressions.multiply(Constant.TWO, X));

            assertThat(e).isEqualTo(Expressions.multiply(Constant.of(3), X));
            assertThat(Expressions.subtract(X, X)).isEqualTo(Constant.ZERO);
        }

        @Test
        @DisplayName("Equal bases merge into powers")
        void testPowersMerge() {
            assertThat(Expressions.multiply(X, X)).isEqualTo(Expressions.power(X, 2));
            assertThat(Expressions.multiply(Expressions.power(X, 2), Expressions.power(X, -2)))
                .isEqualTo(Constant.ONE);
        }

        @Test
        @DisplayName("Powers of the imaginary unit reduce")
        void testImaginaryUnit() {
            Expression i = ImaginaryUnit.get();

            assertThat(Expressions.multiply(i, i)).isEqualTo(Constant.MINUS_ONE);
            assertThat(Expressions.power(i, 4)).isEqualTo(Constant.ONE);
            assertThat(Expressions.power(i, 3)).isEqualTo(Expressions.negate(i));
        }

        @Test
        @DisplayName("Square roots of constants are reduced")
        void testSquareRoots() {
            assertThat(Expressions.sqrt(Constant.of(8)).format()).isEqualTo("2*sqrt(2)");
            assertThat(Expressions.sqrt(Constant.of(9, 4))).isEqualTo(Constant.of(3, 2));
            assertThat(Expressions.multiply(Expressions.sqrt(Constant.TWO), Expressions.sqrt(Constant.TWO)))
                .isEqualTo(Constant.TWO);
        }

        @Test
        @DisplayName("Constants distribute over a single sum")
        void testDistribution() {
            Expression e = Expressions.multiply(Constant.TWO, Expressions.add(X, Constant.ONE));

            assertThat(e).isEqualTo(Expressions.add(Expressions.multiply(Constant.TWO, X), Constant.TWO));
        }

        @Test
        @DisplayName("log(1) and atan(0) vanish")
        void testFunctionIdentities() {
            assertThat(Expressions.log(Constant.ONE)).isEqualTo(Constant.ZERO);
            assertThat(Expressions.atan(Constant.ZERO)).isEqualTo(Constant.ZERO);
        }
    }

    @Nested
    @DisplayName("Formatting")
    class Formatting {

        @Test
        @DisplayName("Negative terms print with a minus sign")
        void testNegativeTerms() {
            assertThat(Expressions.subtract(Expressions.power(X, 2), Constant.ONE).format()).isEqualTo("x^2 - 1");
        }

        @Test
        @DisplayName("Negative exponents print as a denominator")
        void testDenominator() {
            Expression e = Expressions.multiply(Constant.TWO,
                Expressions.power(Expressions.add(X, Constant.ONE), -1));

            assertThat(e.format()).isEqualTo("2/(x + 1)");
        }

        @Test
        @DisplayName("Logarithm of a sum")
        void testLog() {
            Expression e = Expressions.multiply(Constant.of(-4), Expressions.log(Expressions.add(X, Constant.ONE)));

            assertThat(e.format()).isEqualTo("-4*log(x + 1)");
        }

        @Test
        @DisplayName("Polynomials print highest degree first")
        void testPolynomial() {
            Expression e = Expressions.polynomial(List.of(Constant.ONE, Constant.ZERO, Constant.of(3)), X);

            assertThat(e.format()).isEqualTo("3*x^2 + 1");
        }
    }

    @Nested
    @DisplayName("Root sums")
    class RootSums {

        @Test
        @DisplayName("Root sums compare up to renaming of the bound variable")
        void testAlphaEquivalence() {
            Symbol t1 = Symbol.dummy("t", false);
            Symbol t2 = Symbol.dummy("t", false);
            List<Expression> q = List.of(Constant.ONE, Constant.ONE, Constant.ZERO, Constant.ONE);

            Expression a = Expressions.rootSum(q, t1, Expressions.multiply(t1, Expressions.log(Expressions.add(X, t1))));
            Expression b = Expressions.rootSum(q, t2, Expressions.multiply(t2, Expressions.log(Expressions.add(X, t2))));

            assertThat(t1.isDummy()).isTrue();
            assertThat(t1).isNotEqualTo(t2);
            assertThat(a).isEqualTo(b);
            assertThat(a.hashCode()).isEqualTo(b.hashCode());
        }

        @Test
        @DisplayName("A zero body gives zero")
        void testZeroBody() {
            Symbol t = Symbol.dummy("t", false);

            assertThat(Expressions.rootSum(List.of(Constant.ONE, Constant.ONE), t, Constant.ZERO))
                .isEqualTo(Constant.ZERO);
        }
    }
}
