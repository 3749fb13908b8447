package com.ratint.polynomial;

import com.ratint.types.FieldElement;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Euclidean algorithms for polynomials over a field.
 */
public final class Polynomials {

    private Polynomials() {}

    /**
     * Long division.
     *
     * @param dividend the dividend
     * @param divisor the divisor, nonzero
     * @param <C> the field type
     * @return quotient and remainder
     * @throws ArithmeticException if the divisor is zero
     */
    public static <C extends FieldElement<C>> DivisionResult<C> divide(Polynomial<C> dividend, Polynomial<C> divisor) {
        if (divisor.isZero()) {
            throw new ArithmeticException("Polynomial division by zero");
        }
        C zero = dividend.coefficientZero();
        int shiftMax = dividend.degree() - divisor.degree();
        if (shiftMax < 0) {
            return new DivisionResult<>(dividend.zero(), dividend);
        }
        List<C> remainder = new ArrayList<>(dividend.coefficients());
        List<C> quotient = new ArrayList<>(Collections.nCopies(shiftMax + 1, zero));
        C inverseLead = divisor.leadingCoefficient().inverse();
        int d = divisor.degree();
        for (int shift = shiftMax; shift >= 0; shift--) {
            C top = remainder.get(shift + d);
            if (top.isZero()) continue;
            C q = top.multiply(inverseLead);
            quotient.set(shift, q);
            for (int j = 0; j <= d; j++) {
                remainder.set(shift + j, remainder.get(shift + j).subtract(q.multiply(divisor.coefficient(j))));
            }
        }
        return new DivisionResult<>(
            Polynomial.of(dividend.variable(), zero, quotient),
            Polynomial.of(dividend.variable(), zero, remainder.subList(0, Math.min(d, remainder.size()))));
    }

    public static <C extends FieldElement<C>> Polynomial<C> remainder(Polynomial<C> dividend, Polynomial<C> divisor) {
        return divide(dividend, divisor).remainder();
    }

    public static <C extends FieldElement<C>> Polynomial<C> quotient(Polynomial<C> dividend, Polynomial<C> divisor) {
        return divide(dividend, divisor).quotient();
    }

    /**
     * Scales to leading coefficient 1; the zero polynomial is returned unchanged.
     */
    public static <C extends FieldElement<C>> Polynomial<C> monic(Polynomial<C> p) {
        if (p.isZero() || p.leadingCoefficient().isOne()) {
            return p;
        }
        return p.scale(p.leadingCoefficient().inverse());
    }

    /**
     * Returns the monic greatest common divisor; {@code gcd(0, 0) = 0}.
     */
    public static <C extends FieldElement<C>> Polynomial<C> gcd(Polynomial<C> a, Polynomial<C> b) {
        Polynomial<C> x = a;
        Polynomial<C> y = b;
        while (!y.isZero()) {
            Polynomial<C> r = remainder(x, y);
            x = y;
            y = r;
        }
        return monic(x);
    }

    /**
     * Extended Euclidean algorithm.
     *
     * <p>The cofactors are the minimal ones: {@code deg s < deg b - deg gcd} and
     * {@code deg t < deg a - deg gcd} whenever those bounds are positive.
     *
     * @param a the first polynomial
     * @param b the second polynomial
     * @param <C> the field type
     * @return {@code (s, t, h)} with {@code s*a + t*b = h}, {@code h} monic
     */
    public static <C extends FieldElement<C>> ExtendedGcd<C> extendedGcd(Polynomial<C> a, Polynomial<C> b) {
        Polynomial<C> r0 = a;
        Polynomial<C> r1 = b;
        Polynomial<C> s0 = a.one();
        Polynomial<C> s1 = a.zero();
        Polynomial<C> t0 = a.zero();
        Polynomial<C> t1 = a.one();
        while (!r1.isZero()) {
            DivisionResult<C> division = divide(r0, r1);
            Polynomial<C> r2 = division.remainder();
            Polynomial<C> s2 = s0.subtract(division.quotient().multiply(s1));
            Polynomial<C> t2 = t0.subtract(division.quotient().multiply(t1));
            r0 = r1;
            r1 = r2;
            s0 = s1;
            s1 = s2;
            t0 = t1;
            t1 = t2;
        }
        if (r0.isZero()) {
            return new ExtendedGcd<>(s0, t0, r0);
        }
        C inverseLead = r0.leadingCoefficient().inverse();
        return new ExtendedGcd<>(s0.scale(inverseLead), t0.scale(inverseLead), r0.scale(inverseLead));
    }

    /**
     * Returns the inverse of {@code a} modulo {@code modulus}, reduced below the modulus degree.
     *
     * @throws ArithmeticException if {@code a} and {@code modulus} are not coprime
     */
    public static <C extends FieldElement<C>> Polynomial<C> invert(Polynomial<C> a, Polynomial<C> modulus) {
        ExtendedGcd<C> e = extendedGcd(remainder(a, modulus), modulus);
        if (e.gcd().degree() != 0) {
            throw new ArithmeticException(a + " is not invertible modulo " + modulus);
        }
        return remainder(e.s(), modulus);
    }

    public static <C extends FieldElement<C>> boolean isSquareFree(Polynomial<C> p) {
        return gcd(p, p.derivative()).degree() <= 0;
    }

    /**
     * Returns the monic product of the distinct irreducible factors of {@code p}.
     */
    public static <C extends FieldElement<C>> Polynomial<C> squareFreePart(Polynomial<C> p) {
        if (p.degree() <= 0) {
            return monic(p);
        }
        return monic(p.exactQuotient(gcd(p, p.derivative())));
    }

    /**
     * Square-free factorization by Yun's algorithm (characteristic zero).
     *
     * @param p the polynomial, nonzero
     * @param <C> the field type
     * @return the content and the monic square-free factors
     * @throws IllegalArgumentException if {@code p} is zero
     */
    public static <C extends FieldElement<C>> SquareFreeDecomposition<C> squareFree(Polynomial<C> p) {
        if (p.isZero()) {
            throw new IllegalArgumentException("Cannot factor the zero polynomial");
        }
        C content = p.leadingCoefficient();
        List<SquareFreeDecomposition.Factor<C>> factors = new ArrayList<>();
        if (p.degree() == 0) {
            return new SquareFreeDecomposition<>(content, factors);
        }
        Polynomial<C> f = monic(p);
        Polynomial<C> fPrime = f.derivative();
        Polynomial<C> a = gcd(f, fPrime);
        Polynomial<C> b = f.exactQuotient(a);
        Polynomial<C> c = fPrime.exactQuotient(a);
        Polynomial<C> d = c.subtract(b.derivative());
        int multiplicity = 1;
        while (b.degree() > 0) {
            Polynomial<C> factor = gcd(b, d);
            b = b.exactQuotient(factor);
            c = d.exactQuotient(factor);
            d = c.subtract(b.derivative());
            if (factor.degree() > 0) {
                factors.add(new SquareFreeDecomposition.Factor<>(factor, multiplicity));
            }
            multiplicity++;
        }
        return new SquareFreeDecomposition<>(content, factors);
    }
}
