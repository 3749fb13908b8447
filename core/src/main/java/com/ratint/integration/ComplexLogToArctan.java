package com.ratint.integration;

import com.ratint.domain.CoefficientDomain;
import com.ratint.exception.IntegrationInvariantException;
import com.ratint.expression.Constant;
import com.ratint.expression.Expression;
import com.ratint.expression.Expressions;
import com.ratint.polynomial.DivisionResult;
import com.ratint.polynomial.ExtendedGcd;
import com.ratint.polynomial.Polynomial;
import com.ratint.polynomial.Polynomials;
import com.ratint.types.FieldElement;
import java.util.ArrayList;
import java.util.List;

/**
 * Rewrites {@code I*log((f + I*g)/(f - I*g))} as a sum of arctangents of polynomials.
 *
 * <p>Both forms have the same derivative. Using {@code atan} of polynomials
 * only, instead of {@code atan(f/g)}, keeps the result free of the spurious
 * jumps that the rational argument would introduce at the real roots of
 * {@code g}.
 */
public final class ComplexLogToArctan {

    private ComplexLogToArctan() {}

    /**
     * Converts the pair {@code (f, g)}.
     *
     * <p>Each step either finishes with {@code 2*atan(f/g)} when {@code g}
     * divides {@code f}, or emits {@code 2*atan((f*s + g*t)/h)} for the Bezout
     * identity {@code g*s - f*t = h} and continues with {@code (s, t)}, whose
     * degrees are strictly smaller.
     *
     * @param f the real part, a polynomial in x
     * @param g the imaginary part, a polynomial in x
     * @param domain conversion of coefficients to expressions
     * @param <C> the coefficient field
     * @return the sum of arctangents; zero when {@code g} is zero
     * @throws IntegrationInvariantException if the iteration exceeds its degree bound
     */
    public static <C extends FieldElement<C>> Expression convert(
            Polynomial<C> f, Polynomial<C> g, CoefficientDomain<C> domain) {
        int bound = Math.max(f.degree(), 0) + Math.max(g.degree(), 0) + 1;
        List<Expression> terms = new ArrayList<>();
        Polynomial<C> a = f;
        Polynomial<C> b = g;
        for (int step = 0; !b.isZero(); step++) {
            if (step > bound) {
                throw new IntegrationInvariantException(
                    "Arctangent conversion of (" + f + ", " + g + ") did not terminate within " + bound + " steps",
                    "arctan");
            }
            if (a.degree() < b.degree()) {
                Polynomial<C> swap = a;
                a = b.negate();
                b = swap;
            }
            DivisionResult<C> division = Polynomials.divide(a, b);
            if (division.remainder().isZero()) {
                terms.add(twiceAtan(division.quotient(), domain));
                break;
            }
            ExtendedGcd<C> bezout = Polynomials.extendedGcd(b, a.negate());
            Polynomial<C> u = a.multiply(bezout.s()).add(b.multiply(bezout.t())).exactQuotient(bezout.gcd());
            terms.add(twiceAtan(u, domain));
            a = bezout.s();
            b = bezout.t();
        }
        return Expressions.add(terms);
    }

    private static <C extends FieldElement<C>> Expression twiceAtan(Polynomial<C> p, CoefficientDomain<C> domain) {
        return Expressions.multiply(Constant.TWO, Expressions.atan(p.toExpression(domain::toExpression)));
    }
}
