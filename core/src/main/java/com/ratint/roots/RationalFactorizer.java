package com.ratint.roots;

import com.ratint.config.IntegrationLimits;
import com.ratint.polynomial.Polynomial;
import com.ratint.polynomial.Polynomials;
import com.ratint.types.RadicalNumber;
import com.ratint.types.Rational;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Splits square-free polynomials with rational coefficients into factors over Q.
 *
 * <p>Linear factors come from the rational root test. Quadratic factors come from
 * Kronecker's method: an integer quadratic {@code g} dividing the integer form
 * {@code f} satisfies {@code g(k) | f(k)} for {@code k = -1, 0, 1}, and the three
 * values determine {@code g}. Whatever is left after both searches is returned as
 * one factor, which need not be irreducible.
 *
 * <p>Both searches stop early, without error, when the divisor enumeration would
 * exceed the bounds in {@link IntegrationLimits}.
 */
public final class RationalFactorizer {

    private static final Logger logger = LoggerFactory.getLogger(RationalFactorizer.class);

    private RationalFactorizer() {}

    /**
     * Factors {@code p} into monic pieces.
     *
     * @param p a square-free polynomial of positive degree with rational coefficients
     * @return monic factors whose product is {@code p} divided by its leading coefficient
     * @throws IllegalArgumentException if {@code p} is constant or has irrational coefficients
     */
    public static List<Polynomial<RadicalNumber>> factor(Polynomial<RadicalNumber> p) {
        if (p.degree() <= 0) {
            throw new IllegalArgumentException("Cannot factor a constant: " + p);
        }
        if (!hasRationalCoefficients(p)) {
            throw new IllegalArgumentException("Factoring over Q needs rational coefficients: " + p);
        }
        List<Polynomial<RadicalNumber>> factors = new ArrayList<>();
        Polynomial<RadicalNumber> rest = Polynomials.monic(p);
        if (rest.constantTerm().isZero()) {
            Polynomial<RadicalNumber> x = Polynomial.identity(rest.variable(), RadicalNumber.ONE);
            factors.add(x);
            rest = rest.exactQuotient(x);
        }
        if (rest.degree() > 0) {
            for (Rational r : rationalRoots(rest)) {
                Polynomial<RadicalNumber> linear = Polynomial.of(rest.variable(), RadicalNumber.ZERO,
                    List.of(RadicalNumber.of(r.negate()), RadicalNumber.ONE));
                factors.add(linear);
                rest = rest.exactQuotient(linear);
            }
        }
        // a cubic without rational roots is irreducible
        while (rest.degree() >= 4) {
            Optional<Polynomial<RadicalNumber>> quadratic = quadraticFactor(rest);
            if (quadratic.isEmpty()) {
                break;
            }
            factors.add(quadratic.get());
            rest = rest.exactQuotient(quadratic.get());
        }
        if (rest.degree() > 0) {
            factors.add(rest);
        }
        logger.debug("Split degree {} polynomial into factors of degrees {}", p.degree(),
            factors.stream().map(Polynomial::degree).toList());
        return factors;
    }

    static boolean hasRationalCoefficients(Polynomial<RadicalNumber> p) {
        return p.coefficients().stream().allMatch(RadicalNumber::isRational);
    }

    // ==================== Rational Root Test ====================

    /**
     * Rational roots of a polynomial with rational coefficients and nonzero
     * constant term, by the rational root theorem.
     */
    static List<Rational> rationalRoots(Polynomial<RadicalNumber> p) {
        List<BigInteger> integers = integerCoefficients(p);
        BigInteger constant = integers.get(0).abs();
        BigInteger leading = integers.get(integers.size() - 1).abs();
        if (!factorable(constant) || !factorable(leading)) {
            logger.debug("Skipping rational root test: coefficients too large to factor");
            return List.of();
        }
        List<BigInteger> numerators = divisors(constant);
        List<BigInteger> denominators = divisors(leading);
        if (2L * numerators.size() * denominators.size() > IntegrationLimits.MAX_RATIONAL_ROOT_CANDIDATES) {
            logger.debug("Skipping rational root test: {} x {} candidates", numerators.size(), denominators.size());
            return List.of();
        }

        TreeSet<Rational> found = new TreeSet<>();
        for (BigInteger n : numerators) {
            for (BigInteger d : denominators) {
                Rational candidate = Rational.of(n, d);
                for (Rational r : List.of(candidate, candidate.negate())) {
                    if (!found.contains(r) && p.evaluate(RadicalNumber.of(r)).isZero()) {
                        found.add(r);
                    }
                }
            }
        }
        return new ArrayList<>(found);
    }

    // ==================== Kronecker ====================

    /**
     * Finds a monic quadratic factor of {@code p} with rational coefficients.
     * {@code p} must have no rational roots.
     */
    static Optional<Polynomial<RadicalNumber>> quadraticFactor(Polynomial<RadicalNumber> p) {
        List<BigInteger> f = integerCoefficients(p);
        BigInteger atMinusOne = evaluate(f, -1);
        BigInteger atZero = f.get(0);
        BigInteger atOne = evaluate(f, 1);
        if (atMinusOne.signum() == 0 || atZero.signum() == 0 || atOne.signum() == 0) {
            return Optional.empty();
        }
        if (!factorable(atMinusOne.abs()) || !factorable(atZero.abs()) || !factorable(atOne.abs())) {
            logger.debug("Skipping quadratic factor search: values too large to factor");
            return Optional.empty();
        }
        // g and -g divide alike, so g(0) > 0
        List<BigInteger> constants = divisors(atZero.abs());
        List<BigInteger> valuesAtOne = signed(divisors(atOne.abs()));
        List<BigInteger> valuesAtMinusOne = signed(divisors(atMinusOne.abs()));
        long candidates = (long) constants.size() * valuesAtOne.size() * valuesAtMinusOne.size();
        if (candidates > IntegrationLimits.MAX_RATIONAL_ROOT_CANDIDATES) {
            logger.debug("Skipping quadratic factor search: {} candidates", candidates);
            return Optional.empty();
        }

        BigInteger atTwo = evaluate(f, 2);
        BigInteger atMinusTwo = evaluate(f, -2);
        for (BigInteger c : constants) {
            for (BigInteger g1 : valuesAtOne) {
                for (BigInteger gm1 : valuesAtMinusOne) {
                    BigInteger sum = g1.add(gm1);
                    if (sum.testBit(0)) {
                        continue;
                    }
                    BigInteger a = sum.shiftRight(1).subtract(c);
                    BigInteger b = g1.subtract(gm1).shiftRight(1);
                    if (a.signum() == 0) {
                        continue;
                    }
                    List<BigInteger> g = List.of(c, b, a);
                    if (!divides(evaluate(g, 2), atTwo) || !divides(evaluate(g, -2), atMinusTwo)) {
                        continue;
                    }
                    Polynomial<RadicalNumber> candidate = Polynomial.of(p.variable(), RadicalNumber.ZERO, List.of(
                        RadicalNumber.of(Rational.of(c, a)), RadicalNumber.of(Rational.of(b, a)), RadicalNumber.ONE));
                    if (Polynomials.remainder(p, candidate).isZero()) {
                        return Optional.of(candidate);
                    }
                }
            }
        }
        return Optional.empty();
    }

    private static boolean divides(BigInteger d, BigInteger n) {
        return d.signum() != 0 && n.mod(d.abs()).signum() == 0;
    }

    private static BigInteger evaluate(List<BigInteger> coefficients, long point) {
        BigInteger x = BigInteger.valueOf(point);
        BigInteger result = BigInteger.ZERO;
        for (int k = coefficients.size() - 1; k >= 0; k--) {
            result = result.multiply(x).add(coefficients.get(k));
        }
        return result;
    }

    // ==================== Integer Helpers ====================

    private static boolean factorable(BigInteger n) {
        return n.compareTo(IntegrationLimits.MAX_FACTORABLE_MAGNITUDE) <= 0;
    }

    /** Primitive integer multiple of a polynomial with rational coefficients. */
    private static List<BigInteger> integerCoefficients(Polynomial<RadicalNumber> p) {
        BigInteger lcm = BigInteger.ONE;
        for (RadicalNumber c : p.coefficients()) {
            BigInteger d = c.rationalValue().denominator();
            lcm = lcm.divide(lcm.gcd(d)).multiply(d);
        }
        List<BigInteger> integers = new ArrayList<>(p.coefficients().size());
        BigInteger content = BigInteger.ZERO;
        for (RadicalNumber c : p.coefficients()) {
            Rational scaled = c.rationalValue().multiply(Rational.of(lcm));
            integers.add(scaled.numerator());
            content = content.gcd(scaled.numerator());
        }
        List<BigInteger> primitive = new ArrayList<>(integers.size());
        for (BigInteger i : integers) {
            primitive.add(i.divide(content));
        }
        return primitive;
    }

    private static List<BigInteger> signed(List<BigInteger> divisors) {
        List<BigInteger> result = new ArrayList<>(2 * divisors.size());
        for (BigInteger d : divisors) {
            result.add(d);
            result.add(d.negate());
        }
        return result;
    }

    private static List<BigInteger> divisors(BigInteger n) {
        List<BigInteger> small = new ArrayList<>();
        List<BigInteger> large = new ArrayList<>();
        BigInteger i = BigInteger.ONE;
        while (i.multiply(i).compareTo(n) <= 0) {
            if (n.mod(i).signum() == 0) {
                small.add(i);
                BigInteger other = n.divide(i);
                if (!other.equals(i)) {
                    large.add(other);
                }
            }
            i = i.add(BigInteger.ONE);
        }
        Collections.reverse(large);
        small.addAll(large);
        return small;
    }
}
