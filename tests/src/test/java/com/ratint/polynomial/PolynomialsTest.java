package com.ratint.polynomial;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ratint.test.TestBase;
import com.ratint.test.TestCategories;
import com.ratint.types.RadicalNumber;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@TestCategories.Tier1
@TestCategories.Unit
@TestCategories.Algebra
@DisplayName("Polynomial Algorithms Tests")
public class PolynomialsTest extends TestBase {

    @Nested
    @DisplayName("Ring operations")
    class RingOperations {

        @Test
        @DisplayName("Trailing zero coefficients are dropped")
        void testTrailingZeros() {
            Polynomial<RadicalNumber> p = poly(1, 2, 0, 0);

            assertThat(p.degree()).isEqualTo(1);
            assertThat(poly().degree()).isEqualTo(-1);
            assertThat(poly(5).isConstant()).isTrue();
            assertThat(p.isConstant()).isFalse();
            assertThat(poly().isZero()).isTrue();
        }

        @Test
        @DisplayName("Multiplication and derivative")
        void testMultiplyAndDerivative() {
            Polynomial<RadicalNumber> p = poly(-1, 1).multiply(poly(1, 1));

            assertThat(p).isEqualTo(poly(-1, 0, 1));
            assertThat(p.derivative()).isEqualTo(poly(0, 2));
            assertThat(p.evaluate(RadicalNumber.of(3))).isEqualTo(RadicalNumber.of(8));
        }

        @Test
        @DisplayName("Exact quotient rejects inexact division")
        void testExactQuotient() {
            assertThat(poly(-1, 0, 1).exactQuotient(poly(1, 1))).isEqualTo(poly(-1, 1));
            assertThatThrownBy(() -> poly(1, 0, 1).exactQuotient(poly(1, 1)))
                .isInstanceOf(ArithmeticException.class)
                .hasMessageContaining("Inexact");
        }
    }

    @Nested
    @DisplayName("Euclidean algorithms")
    class Euclidean {

        @Test
        @DisplayName("Division with remainder")
        void testDivide() {
            DivisionResult<RadicalNumber> result = Polynomials.divide(poly(1, 0, 0, 1), poly(-1, 1));

            assertThat(result.quotient()).isEqualTo(poly(1, 1, 1));
            assertThat(result.remainder()).isEqualTo(poly(2));
        }

        @Test
        @DisplayName("gcd is monic")
        void testGcd() {
            Polynomial<RadicalNumber> a = poly(-2, 0, 2);
            Polynomial<RadicalNumber> b = poly(3, 6, 3);

            assertThat(Polynomials.gcd(a, b)).isEqualTo(poly(1, 1));
        }

        @Test
        @DisplayName("Extended gcd satisfies the Bezout identity")
        void testExtendedGcd() {
            Polynomial<RadicalNumber> a = poly(1, 0, 1);
            Polynomial<RadicalNumber> b = poly(-2, 1);

            ExtendedGcd<RadicalNumber> e = Polynomials.extendedGcd(a, b);

            assertThat(e.gcd()).isEqualTo(poly(1));
            assertThat(e.s().multiply(a).add(e.t().multiply(b))).isEqualTo(e.gcd());
            assertThat(e.s().degree()).isLessThan(b.degree());
        }

        @Test
        @DisplayName("Inverse modulo a coprime polynomial")
        void testInvert() {
            Polynomial<RadicalNumber> modulus = poly(1, 0, 1);

            Polynomial<RadicalNumber> inverse = Polynomials.invert(poly(0, 1), modulus);

            assertThat(inverse).isEqualTo(poly(0, -1));
            assertThat(Polynomials.remainder(inverse.multiply(poly(0, 1)), modulus)).isEqualTo(poly(1));
        }

        @Test
        @DisplayName("Inverse modulo a polynomial with a common factor fails")
        void testInvertNotCoprime() {
            assertThatThrownBy(() -> Polynomials.invert(poly(-1, 1), poly(-1, 0, 1)))
                .isInstanceOf(ArithmeticException.class)
                .hasMessageContaining("not invertible");
        }
    }

    @Nested
    @DisplayName("Square-free factorization")
    class SquareFree {

        @Test
        @DisplayName("Factors are grouped by multiplicity")
        void testSquareFree() {
            // 3 * (x + 2) * (x - 1)^2
            Polynomial<RadicalNumber> p = poly(2, 1).multiply(poly(-1, 1)).multiply(poly(-1, 1)).multiply(3);

            SquareFreeDecomposition<RadicalNumber> d = Polynomials.squareFree(p);

            assertThat(d.content()).isEqualTo(RadicalNumber.of(3));
            assertThat(d.factors()).containsExactly(
                new SquareFreeDecomposition.Factor<>(poly(2, 1), 1),
                new SquareFreeDecomposition.Factor<>(poly(-1, 1), 2));
        }

        @Test
        @DisplayName("Square-free part and test")
        void testSquareFreePart() {
            Polynomial<RadicalNumber> p = poly(0, 0, 1).multiply(poly(1, 1));

            assertThat(Polynomials.isSquareFree(p)).isFalse();
            assertThat(Polynomials.squareFreePart(p)).isEqualTo(poly(0, 1, 1));
            assertThat(Polynomials.isSquareFree(poly(1, 0, 1))).isTrue();
        }

        @Test
        @DisplayName("Zero cannot be factored")
        void testZero() {
            assertThatThrownBy(() -> Polynomials.squareFree(poly()))
                .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
