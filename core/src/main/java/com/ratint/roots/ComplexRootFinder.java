package com.ratint.roots;

import com.ratint.polynomial.Polynomial;
import com.ratint.polynomial.Polynomials;
import com.ratint.types.RadicalNumber;
import com.ratint.types.Rational;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds all roots of a real polynomial, real and non-real, in closed form.
 *
 * <p>Works piece by piece like {@link RealRootFinder}. A quadratic with negative
 * discriminant gives {@code u ± I*v}; an even piece {@code P(x^2)} gives the two
 * square roots of every root {@code y = a + I*b} of P, using
 * <pre>
 *   sqrt(y) = ±(sqrt((|y| + a)/2) + I*sign(b)*sqrt((|y| - a)/2))
 * </pre>
 * The answer is all or nothing: either every root is found, or the result is empty.
 */
public final class ComplexRootFinder {

    private static final Logger logger = LoggerFactory.getLogger(ComplexRootFinder.class);

    private ComplexRootFinder() {}

    /**
     * Returns the distinct roots of {@code p}.
     *
     * @param p a nonzero polynomial with real coefficients
     * @return every distinct root, or empty when some root has no closed form
     * @throws IllegalArgumentException if {@code p} is zero or has non-real coefficients
     */
    public static Optional<List<ComplexRoot>> roots(Polynomial<RadicalNumber> p) {
        if (p.isZero()) {
            throw new IllegalArgumentException("Every number is a root of the zero polynomial");
        }
        if (!p.coefficients().stream().allMatch(RadicalNumber::isReal)) {
            throw new IllegalArgumentException("Complex root finding needs real coefficients: " + p);
        }
        List<ComplexRoot> roots = new ArrayList<>();
        if (p.degree() == 0) {
            return Optional.of(roots);
        }
        Polynomial<RadicalNumber> squareFree = Polynomials.squareFreePart(p);
        for (Polynomial<RadicalNumber> piece : RealRootFinder.pieces(squareFree)) {
            Optional<List<ComplexRoot>> solved = solve(piece);
            if (solved.isEmpty()) {
                logger.debug("No closed-form roots for degree {} factor {}", piece.degree(), piece);
                return Optional.empty();
            }
            roots.addAll(solved.get());
        }
        if (roots.size() != squareFree.degree()) {
            logger.debug("Found {} of {} roots of {}", roots.size(), squareFree.degree(), p);
            return Optional.empty();
        }
        return Optional.of(roots);
    }

    private static Optional<List<ComplexRoot>> solve(Polynomial<RadicalNumber> piece) {
        if (piece.degree() == 1) {
            return Optional.of(List.of(
                ComplexRoot.real(piece.constantTerm().negate().divide(piece.leadingCoefficient()))));
        }
        if (piece.degree() == 2) {
            return quadraticRoots(piece.coefficient(2), piece.coefficient(1), piece.coefficient(0));
        }
        if (RealRootFinder.isEven(piece)) {
            return evenRoots(piece);
        }
        return Optional.empty();
    }

    private static Optional<List<ComplexRoot>> quadraticRoots(RadicalNumber a, RadicalNumber b, RadicalNumber c) {
        RadicalNumber discriminant = b.multiply(b).subtract(a.multiply(c).multiply(4));
        if (discriminant.signum() >= 0) {
            return RealRootFinder.quadraticRoots(a, b, c)
                .map(real -> real.stream().map(ComplexRoot::real).toList());
        }
        RadicalNumber twoA = a.multiply(2);
        Optional<RadicalNumber> root = discriminant.negate().sqrt();
        if (root.isEmpty()) {
            return Optional.empty();
        }
        RadicalNumber u = b.negate().divide(twoA);
        RadicalNumber v = root.get().divide(twoA);
        return Optional.of(List.of(new ComplexRoot(u, v), new ComplexRoot(u, v.negate())));
    }

    private static Optional<List<ComplexRoot>> evenRoots(Polynomial<RadicalNumber> piece) {
        Optional<List<ComplexRoot>> inner = roots(RealRootFinder.halve(piece));
        if (inner.isEmpty()) {
            return Optional.empty();
        }
        List<ComplexRoot> roots = new ArrayList<>(piece.degree());
        for (ComplexRoot y : inner.get()) {
            Optional<ComplexRoot> root = squareRoot(y);
            if (root.isEmpty()) {
                logger.debug("No closed-form square root of {}", y);
                return Optional.empty();
            }
            roots.add(root.get());
            roots.add(new ComplexRoot(root.get().real().negate(), root.get().imaginary().negate()));
        }
        return Optional.of(roots);
    }

    /** One square root of {@code y}; the other is its negation. */
    private static Optional<ComplexRoot> squareRoot(ComplexRoot y) {
        RadicalNumber a = y.real();
        RadicalNumber b = y.imaginary();
        if (b.isZero()) {
            if (a.signum() >= 0) {
                return a.sqrt().map(ComplexRoot::real);
            }
            return a.negate().sqrt().map(s -> new ComplexRoot(RadicalNumber.ZERO, s));
        }
        Optional<RadicalNumber> modulus = a.multiply(a).add(b.multiply(b)).sqrt();
        if (modulus.isEmpty()) {
            return Optional.empty();
        }
        Optional<RadicalNumber> u = modulus.get().add(a).scale(Rational.HALF).sqrt();
        Optional<RadicalNumber> v = modulus.get().subtract(a).scale(Rational.HALF).sqrt();
        if (u.isEmpty() || v.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new ComplexRoot(u.get(), b.signum() > 0 ? v.get() : v.get().negate()));
    }
}
