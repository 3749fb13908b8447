package com.ratint.roots;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ratint.polynomial.Polynomial;
import com.ratint.test.TestBase;
import com.ratint.test.TestCategories;
import com.ratint.types.RadicalNumber;
import com.ratint.types.Rational;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@TestCategories.Tier1
@TestCategories.Unit
@TestCategories.Algebra
@DisplayName("RationalFactorizer Tests")
public class RationalFactorizerTest extends TestBase {

    private static Polynomial<RadicalNumber> monic(Rational c0, Rational c1) {
        return Polynomial.of(X, RadicalNumber.ZERO,
            List.of(RadicalNumber.of(c0), RadicalNumber.of(c1), RadicalNumber.ONE));
    }

    @Test
    @DisplayName("Rational root test works on the primitive integer form")
    void testRationalRootCandidates() {
        Polynomial<RadicalNumber> p = Polynomial.of(X, RadicalNumber.ZERO,
            List.of(RadicalNumber.of(-1, 3), RadicalNumber.ONE));

        assertThat(RationalFactorizer.rationalRoots(p)).containsExactly(Rational.of(1, 3));
    }

    @Test
    @DisplayName("Linear and quadratic factors of a quintic")
    void testQuintic() {
        // (10x - 1)(72x^2 + 12x + 1)(720x^2 - 48x + 1)
        Polynomial<RadicalNumber> p = poly(-1, 10).multiply(poly(1, 12, 72)).multiply(poly(1, -48, 720));

        List<Polynomial<RadicalNumber>> factors = RationalFactorizer.factor(p);

        assertThat(factors).containsExactlyInAnyOrder(
            Polynomial.of(X, RadicalNumber.ZERO, List.of(RadicalNumber.of(-1, 10), RadicalNumber.ONE)),
            monic(Rational.of(1, 72), Rational.of(1, 6)),
            monic(Rational.of(1, 720), Rational.of(-1, 15)));
    }

    @Test
    @DisplayName("The factor x comes first")
    void testZeroRoot() {
        // x (x^2 + 1)
        List<Polynomial<RadicalNumber>> factors = RationalFactorizer.factor(poly(0, 1, 0, 1));

        assertThat(factors).containsExactly(poly(0, 1), poly(1, 0, 1));
    }

    @Test
    @DisplayName("Irreducible quartics are left whole")
    void testIrreducible() {
        assertThat(RationalFactorizer.factor(poly(1, 0, 0, 0, 1))).containsExactly(poly(1, 0, 0, 0, 1));
        assertThat(RationalFactorizer.factor(poly(1, 0, -10, 0, 1))).containsExactly(poly(1, 0, -10, 0, 1));
    }

    @Test
    @DisplayName("Sophie Germain quartic splits into two quadratics")
    void testSophieGermain() {
        // 4x^4 + 1 = (2x^2 + 2x + 1)(2x^2 - 2x + 1)
        List<Polynomial<RadicalNumber>> factors = RationalFactorizer.factor(poly(1, 0, 0, 0, 4));

        assertThat(factors).containsExactlyInAnyOrder(
            monic(Rational.HALF, Rational.ONE), monic(Rational.HALF, Rational.MINUS_ONE));
    }

    @Test
    @DisplayName("Irrational coefficients are rejected")
    void testIrrational() {
        RadicalNumber sqrt2 = RadicalNumber.sqrt(Rational.TWO).orElseThrow();
        Polynomial<RadicalNumber> p = Polynomial.of(X, RadicalNumber.ZERO, List.of(sqrt2, RadicalNumber.ONE));

        assertThatThrownBy(() -> RationalFactorizer.factor(p)).isInstanceOf(IllegalArgumentException.class);
    }
}
