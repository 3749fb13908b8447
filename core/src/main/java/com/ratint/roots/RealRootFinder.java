package com.ratint.roots;

import com.ratint.polynomial.Polynomial;
import com.ratint.polynomial.Polynomials;
import com.ratint.types.RadicalNumber;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds real roots of real polynomials in closed form.
 *
 * <p>The finder splits the square-free part into pieces: the factor x, and the
 * factors over Q from {@link RationalFactorizer} when every coefficient is
 * rational. Each piece is then solved when it is
 * <ul>
 *   <li>linear or quadratic, with square roots that exist in {@link RadicalNumber};</li>
 *   <li>even, {@code P(x^2)}, and the positive roots of {@code P} are found
 *       recursively and have square roots.</li>
 * </ul>
 *
 * <p>A piece that cannot be solved contributes no roots. {@link #realRoots} may
 * therefore be incomplete; {@link #certifiedRealRoots} checks that the unsolved
 * pieces have no real roots at all, by a sign test at a few sample points and
 * then a {@link SturmSequence}.
 */
public final class RealRootFinder {

    private static final Logger logger = LoggerFactory.getLogger(RealRootFinder.class);

    private static final List<RadicalNumber> SAMPLE_POINTS = List.of(
        RadicalNumber.ZERO, RadicalNumber.of(1, 2), RadicalNumber.of(-1, 2), RadicalNumber.ONE, RadicalNumber.of(-1));

    private RealRootFinder() {}

    /** Roots of the solved pieces, and the pieces left unsolved. */
    private record Search(List<RadicalNumber> roots, List<Polynomial<RadicalNumber>> unsolved) {
    }

    /**
     * Returns the distinct real roots found, in increasing order.
     *
     * @param p a nonzero polynomial with real coefficients
     * @return the roots found
     * @throws IllegalArgumentException if {@code p} is zero
     */
    public static List<RadicalNumber> realRoots(Polynomial<RadicalNumber> p) {
        return search(p).roots();
    }

    /**
     * Returns every distinct real root of {@code p} in increasing order, or empty
     * when some real root has no closed form.
     *
     * @param p a nonzero polynomial with real coefficients
     * @return all real roots, or empty
     * @throws IllegalArgumentException if {@code p} is zero
     */
    public static Optional<List<RadicalNumber>> certifiedRealRoots(Polynomial<RadicalNumber> p) {
        Search search = search(p);
        for (Polynomial<RadicalNumber> piece : search.unsolved()) {
            if (hasSignChange(piece)) {
                logger.debug("Degree {} factor changes sign; its real roots have no closed form", piece.degree());
                return Optional.empty();
            }
            int count = SturmSequence.countDistinctRealRoots(piece);
            if (count > 0) {
                logger.debug("Degree {} factor has {} real roots without closed form", piece.degree(), count);
                return Optional.empty();
            }
        }
        return Optional.of(search.roots());
    }

    /**
     * True when {@code p} visibly has a real root: odd degree, or a sample point
     * where its sign differs from the sign at infinity.
     */
    private static boolean hasSignChange(Polynomial<RadicalNumber> p) {
        if (p.degree() % 2 == 1) {
            return true;
        }
        int atInfinity = p.leadingCoefficient().signum();
        for (RadicalNumber point : SAMPLE_POINTS) {
            if (p.evaluate(point).signum() == -atInfinity) {
                return true;
            }
        }
        return false;
    }

    private static Search search(Polynomial<RadicalNumber> p) {
        if (p.isZero()) {
            throw new IllegalArgumentException("Every number is a root of the zero polynomial");
        }
        List<RadicalNumber> roots = new ArrayList<>();
        List<Polynomial<RadicalNumber>> unsolved = new ArrayList<>();
        if (p.degree() == 0) {
            return new Search(roots, unsolved);
        }
        for (Polynomial<RadicalNumber> piece : pieces(Polynomials.squareFreePart(p))) {
            Optional<List<RadicalNumber>> solved = solve(piece);
            if (solved.isPresent()) {
                roots.addAll(solved.get());
            } else {
                unsolved.add(piece);
            }
        }
        roots.sort(null);
        logger.debug("Found {} closed-form real roots of degree {} polynomial", roots.size(), p.degree());
        return new Search(roots, unsolved);
    }

    /**
     * Splits a square-free polynomial into x (when 0 is a root), and the factors
     * over Q or the remaining cofactor.
     */
    static List<Polynomial<RadicalNumber>> pieces(Polynomial<RadicalNumber> squareFree) {
        if (RationalFactorizer.hasRationalCoefficients(squareFree)) {
            return RationalFactorizer.factor(squareFree);
        }
        List<Polynomial<RadicalNumber>> pieces = new ArrayList<>(2);
        Polynomial<RadicalNumber> rest = squareFree;
        if (rest.constantTerm().isZero()) {
            Polynomial<RadicalNumber> x = Polynomial.identity(rest.variable(), RadicalNumber.ONE);
            pieces.add(x);
            rest = rest.exactQuotient(x);
        }
        if (rest.degree() > 0) {
            pieces.add(rest);
        }
        return pieces;
    }

    /** All real roots of a square-free piece, or empty when they are not all found. */
    private static Optional<List<RadicalNumber>> solve(Polynomial<RadicalNumber> piece) {
        if (piece.degree() == 1) {
            return Optional.of(List.of(piece.constantTerm().negate().divide(piece.leadingCoefficient())));
        }
        if (piece.degree() == 2) {
            return quadraticRoots(piece.coefficient(2), piece.coefficient(1), piece.coefficient(0));
        }
        if (isEven(piece)) {
            return evenRoots(piece);
        }
        return Optional.empty();
    }

    /** Real roots of {@code a*x^2 + b*x + c}. */
    static Optional<List<RadicalNumber>> quadraticRoots(RadicalNumber a, RadicalNumber b, RadicalNumber c) {
        RadicalNumber discriminant = b.multiply(b).subtract(a.multiply(c).multiply(4));
        int sign = discriminant.signum();
        if (sign < 0) {
            return Optional.of(List.of());
        }
        RadicalNumber twoA = a.multiply(2);
        if (sign == 0) {
            return Optional.of(List.of(b.negate().divide(twoA)));
        }
        Optional<RadicalNumber> root = discriminant.sqrt();
        if (root.isEmpty()) {
            logger.debug("Discriminant {} has no square root in closed form", discriminant);
            return Optional.empty();
        }
        return Optional.of(List.of(b.negate().add(root.get()).divide(twoA),
                                   b.negate().subtract(root.get()).divide(twoA)));
    }

    /** Real roots of {@code P(x^2)}: the square roots of the positive roots of P. */
    private static Optional<List<RadicalNumber>> evenRoots(Polynomial<RadicalNumber> piece) {
        Search inner = search(halve(piece));
        if (!inner.unsolved().isEmpty()) {
            return Optional.empty();
        }
        List<RadicalNumber> roots = new ArrayList<>();
        for (RadicalNumber y : inner.roots()) {
            if (y.signum() <= 0) {
                continue;
            }
            Optional<RadicalNumber> x = y.sqrt();
            if (x.isEmpty()) {
                logger.debug("No closed-form square root of {}", y);
                return Optional.empty();
            }
            roots.add(x.get());
            roots.add(x.get().negate());
        }
        return Optional.of(roots);
    }

    /** True for {@code P(x^2)} of degree at least 4. */
    static boolean isEven(Polynomial<RadicalNumber> p) {
        if (p.degree() < 4 || p.degree() % 2 != 0) {
            return false;
        }
        for (int k = 1; k < p.degree(); k += 2) {
            if (!p.coefficient(k).isZero()) {
                return false;
            }
        }
        return true;
    }

    /** {@code P} from {@code P(x^2)}. */
    static Polynomial<RadicalNumber> halve(Polynomial<RadicalNumber> p) {
        List<RadicalNumber> coefficients = new ArrayList<>(p.degree() / 2 + 1);
        for (int k = 0; k <= p.degree(); k += 2) {
            coefficients.add(p.coefficient(k));
        }
        return Polynomial.of(p.variable(), RadicalNumber.ZERO, coefficients);
    }
}
