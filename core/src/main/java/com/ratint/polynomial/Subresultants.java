package com.ratint.polynomial;

import com.ratint.types.RingElement;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Subresultant polynomial remainder sequences over an integral domain.
 *
 * <p>All divisions are exact ring divisions, so the algorithms run over
 * coefficient rings such as {@code K[t]} without introducing fractions. This
 * is what the logarithmic-part algorithm needs: the members of the sequence
 * are polynomials in x whose coefficients are polynomials in the parameter.
 */
public final class Subresultants {

    private Subresultants() {}

    /**
     * Result of {@link #sequence}: the remainder sequence and the scalar
     * subdeterminants.
     *
     * @param remainders {@code [f, g, r₂, ...]} ending with the last nonzero member
     * @param scalars the principal subresultant coefficients, starting with 1
     * @param <C> the coefficient type
     */
    public record Sequence<C extends RingElement<C>>(List<Polynomial<C>> remainders, List<C> scalars) {

        public Sequence {
            remainders = Collections.unmodifiableList(remainders);
            scalars = Collections.unmodifiableList(scalars);
        }
    }

    /**
     * Pseudo-remainder: {@code lc(g)^(deg f - deg g + 1) * f} reduced modulo {@code g}.
     *
     * @param f the dividend
     * @param g the divisor, nonzero
     * @param <C> the coefficient type
     * @return the pseudo-remainder
     * @throws ArithmeticException if {@code g} is zero
     */
    public static <C extends RingElement<C>> Polynomial<C> pseudoRemainder(Polynomial<C> f, Polynomial<C> g) {
        if (g.isZero()) {
            throw new ArithmeticException("Pseudo-remainder by the zero polynomial");
        }
        int dg = g.degree();
        int dr = f.degree();
        if (dr < dg) {
            return f;
        }
        int n = dr - dg + 1;
        C lcG = g.leadingCoefficient();
        Polynomial<C> r = f;
        while (true) {
            C lcR = r.leadingCoefficient();
            int j = dr - dg;
            n--;
            r = r.scale(lcG).subtract(g.scale(lcR).multiply(Polynomial.monomial(g.variable(), lcR.one(), j)));
            int previous = dr;
            dr = r.degree();
            if (dr < dg) {
                break;
            }
            if (dr >= previous) {
                throw new IllegalStateException("Pseudo-remainder failed to reduce the degree");
            }
        }
        return r.scale(lcG.pow(n));
    }

    /**
     * Computes the subresultant PRS of {@code f} and {@code g}.
     *
     * <p>When {@code deg f < deg g} the arguments are swapped. The scalar
     * sequence follows the same recurrence, including the abnormal case where a
     * degree drops by more than one.
     *
     * @param f the first polynomial
     * @param g the second polynomial
     * @param <C> the coefficient type
     * @return the remainder sequence and its scalar subdeterminants
     */
    public static <C extends RingElement<C>> Sequence<C> sequence(Polynomial<C> f, Polynomial<C> g) {
        int n = f.degree();
        int m = g.degree();
        if (n < m) {
            Polynomial<C> swap = f;
            f = g;
            g = swap;
            int degree = n;
            n = m;
            m = degree;
        }
        List<Polynomial<C>> remainders = new ArrayList<>();
        List<C> scalars = new ArrayList<>();
        C one = f.coefficientZero().one();
        if (f.isZero()) {
            return new Sequence<>(remainders, scalars);
        }
        if (g.isZero()) {
            remainders.add(f);
            scalars.add(one);
            return new Sequence<>(remainders, scalars);
        }

        remainders.add(f);
        remainders.add(g);
        int d = n - m;
        C b = ((d + 1) % 2 == 0) ? one : one.negate();
        Polynomial<C> h = pseudoRemainder(f, g).scale(b);
        C lc = g.leadingCoefficient();
        C c = lc.pow(d);
        scalars.add(one);
        scalars.add(c);
        c = c.negate();

        while (!h.isZero()) {
            int k = h.degree();
            remainders.add(h);
            f = g;
            g = h;
            d = m - k;
            m = k;

            b = lc.negate().multiply(c.pow(d));
            h = pseudoRemainder(f, g).exactQuotientByCoefficient(b);
            lc = g.leadingCoefficient();

            if (d > 1) {
                C q = c.pow(d - 1);
                c = lc.negate().pow(d).exactQuotient(q);
            } else {
                c = lc.negate();
            }
            scalars.add(c.negate());
        }
        return new Sequence<>(remainders, scalars);
    }

    /**
     * Resultant via the subresultant PRS; zero when either argument is zero or
     * the arguments share a factor.
     *
     * @param f the first polynomial
     * @param g the second polynomial
     * @param <C> the coefficient type
     * @return the resultant
     */
    public static <C extends RingElement<C>> C resultant(Polynomial<C> f, Polynomial<C> g) {
        return resultant(f, g, sequence(f, g));
    }

    /**
     * Resultant read off an already computed sequence of {@code f} and {@code g}.
     */
    public static <C extends RingElement<C>> C resultant(Polynomial<C> f, Polynomial<C> g, Sequence<C> sequence) {
        C zero = f.coefficientZero();
        if (f.isZero() || g.isZero()) {
            return zero;
        }
        List<Polynomial<C>> remainders = sequence.remainders();
        if (remainders.get(remainders.size() - 1).degree() > 0) {
            return zero;
        }
        return sequence.scalars().get(sequence.scalars().size() - 1);
    }
}
