package com.ratint.roots;

import com.ratint.polynomial.Polynomial;
import com.ratint.polynomial.Polynomials;
import com.ratint.types.RadicalNumber;
import com.ratint.types.Rational;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Sturm sequence of a real polynomial, used to count its distinct real roots.
 *
 * <p>Signs are computed exactly with {@link RadicalNumber#signum()}, so the count
 * is certified and independent of any root approximation.
 */
public final class SturmSequence {

    private final List<Polynomial<RadicalNumber>> sequence;

    private SturmSequence(List<Polynomial<RadicalNumber>> sequence) {
        this.sequence = Collections.unmodifiableList(sequence);
    }

    /**
     * Builds {@code p, p', -rem(p, p'), ...} down to the last nonzero remainder.
     *
     * @param p a nonzero polynomial with real coefficients
     * @return the sequence
     * @throws IllegalArgumentException if {@code p} is zero or has non-real coefficients
     */
    public static SturmSequence of(Polynomial<RadicalNumber> p) {
        if (p.isZero()) {
            throw new IllegalArgumentException("Sturm sequence of the zero polynomial");
        }
        for (RadicalNumber c : p.coefficients()) {
            if (!c.isReal()) {
                throw new IllegalArgumentException("Sturm sequence needs real coefficients: " + p);
            }
        }
        List<Polynomial<RadicalNumber>> sequence = new ArrayList<>();
        sequence.add(p);
        Polynomial<RadicalNumber> previous = p;
        Polynomial<RadicalNumber> current = p.derivative();
        while (!current.isZero()) {
            sequence.add(current);
            Polynomial<RadicalNumber> next = normalize(Polynomials.remainder(previous, current).negate());
            previous = current;
            current = next;
        }
        return new SturmSequence(sequence);
    }

    /**
     * Returns the number of distinct real roots of the first polynomial.
     *
     * @return the root count
     */
    public int countRealRoots() {
        return signChangesAtInfinity(-1) - signChangesAtInfinity(1);
    }

    /**
     * Returns the number of distinct real roots in the half-open interval {@code (a, b]}.
     *
     * @param a the lower bound
     * @param b the upper bound, at least {@code a}
     * @return the root count
     */
    public int countRealRoots(RadicalNumber a, RadicalNumber b) {
        if (a.compareTo(b) > 0) {
            throw new IllegalArgumentException("empty interval (" + a + ", " + b + "]");
        }
        return signChangesAt(a) - signChangesAt(b);
    }

    /**
     * Scales by a positive constant, which keeps every sign: integer and primitive
     * for rational coefficients, leading coefficient of absolute value one otherwise.
     */
    private static Polynomial<RadicalNumber> normalize(Polynomial<RadicalNumber> p) {
        if (p.isZero()) {
            return p;
        }
        if (p.coefficients().stream().allMatch(RadicalNumber::isRational)) {
            BigInteger lcm = BigInteger.ONE;
            BigInteger content = BigInteger.ZERO;
            for (RadicalNumber c : p.coefficients()) {
                Rational value = c.rationalValue();
                lcm = lcm.divide(lcm.gcd(value.denominator())).multiply(value.denominator());
                content = content.gcd(value.numerator());
            }
            // lcm of the denominators over gcd of the numerators
            Rational factor = Rational.of(lcm, content);
            return p.map(c -> c.scale(factor));
        }
        RadicalNumber lead = p.leadingCoefficient();
        RadicalNumber scale = (lead.signum() < 0 ? lead.negate() : lead).inverse();
        return p.map(c -> c.multiply(scale));
    }

    private int signChangesAtInfinity(int direction) {
        List<Integer> signs = new ArrayList<>(sequence.size());
        for (Polynomial<RadicalNumber> p : sequence) {
            int sign = p.leadingCoefficient().signum();
            if (direction < 0 && p.degree() % 2 == 1) {
                sign = -sign;
            }
            signs.add(sign);
        }
        return signChanges(signs);
    }

    private int signChangesAt(RadicalNumber point) {
        List<Integer> signs = new ArrayList<>(sequence.size());
        for (Polynomial<RadicalNumber> p : sequence) {
            signs.add(p.evaluate(point).signum());
        }
        return signChanges(signs);
    }

    private static int signChanges(List<Integer> signs) {
        int changes = 0;
        int last = 0;
        for (int sign : signs) {
            if (sign == 0) continue;
            if (last != 0 && sign != last) {
                changes++;
            }
            last = sign;
        }
        return changes;
    }

    /**
     * Convenience for {@code of(p).countRealRoots()}.
     */
    public static int countDistinctRealRoots(Polynomial<RadicalNumber> p) {
        return of(p).countRealRoots();
    }
}
