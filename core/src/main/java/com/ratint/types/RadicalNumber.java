package com.ratint.types;

import com.ratint.config.IntegrationLimits;
import com.ratint.solver.GaussianElimination;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Exact element of the multi-quadratic field Q(i, √2, √3, √5, ...).
 *
 * <p>A value is a finite sum {@code Σ q·iᵉ·√m} with rational {@code q},
 * {@code e ∈ {0, 1}} and {@code m} a positive square-free integer. Distinct
 * basis elements {@code iᵉ·√m} are linearly independent over Q, so the
 * representation is canonical: a value is zero exactly when it has no terms,
 * and equality is structural.
 *
 * <p>This is the coefficient field of the integrator. It contains Q, it is
 * closed under the square roots produced by the closed-form root finder, and
 * every test it performs (zero, sign, equality) is exact.
 *
 * <p>Examples:
 * <pre>
 *   RadicalNumber.of(3)                      -- 3
 *   RadicalNumber.sqrt(Rational.of(8))       -- 2*sqrt(2)
 *   RadicalNumber.sqrt(Rational.of(-1, 4))   -- 1/2*I
 * </pre>
 */
public final class RadicalNumber implements FieldElement<RadicalNumber>, Comparable<RadicalNumber> {

    /**
     * One term {@code coefficient * (imaginary ? I : 1) * sqrt(radicand)}.
     *
     * @param coefficient the rational coefficient, nonzero
     * @param imaginary whether the term carries the imaginary unit
     * @param radicand the positive square-free radicand (1 for rational terms)
     */
    public record Term(Rational coefficient, boolean imaginary, BigInteger radicand) {
    }

    private record Basis(boolean imaginary, BigInteger radicand) implements Comparable<Basis> {

        static final Basis ONE = new Basis(false, BigInteger.ONE);
        static final Basis IMAGINARY_ONE = new Basis(true, BigInteger.ONE);

        Scaled times(Basis other) {
            BigInteger g = radicand.gcd(other.radicand);
            BigInteger product = radicand.divide(g).multiply(other.radicand.divide(g));
            BigInteger factor = (imaginary && other.imaginary) ? g.negate() : g;
            return new Scaled(factor, new Basis(imaginary ^ other.imaginary, product));
        }

        @Override
        public int compareTo(Basis other) {
            if (imaginary != other.imaginary) {
                return imaginary ? 1 : -1;
            }
            return radicand.compareTo(other.radicand);
        }
    }

    private record Scaled(BigInteger factor, Basis basis) {
    }

    private record SquareFreeSplit(BigInteger square, BigInteger free) {
    }

    public static final RadicalNumber ZERO = new RadicalNumber(new TreeMap<>());
    public static final RadicalNumber ONE = fromTerm(Rational.ONE, Basis.ONE);
    public static final RadicalNumber I = fromTerm(Rational.ONE, Basis.IMAGINARY_ONE);

    private final TreeMap<Basis, Rational> terms;

    private RadicalNumber(TreeMap<Basis, Rational> terms) {
        this.terms = terms;
    }

    private static RadicalNumber fromTerm(Rational coefficient, Basis basis) {
        TreeMap<Basis, Rational> map = new TreeMap<>();
        if (!coefficient.isZero()) {
            map.put(basis, coefficient);
        }
        return new RadicalNumber(map);
    }

    public static RadicalNumber of(Rational value) {
        return fromTerm(value, Basis.ONE);
    }

    public static RadicalNumber of(long value) {
        return of(Rational.of(value));
    }

    public static RadicalNumber of(long numerator, long denominator) {
        return of(Rational.of(numerator, denominator));
    }

    /**
     * Returns the principal square root of a rational, when its square-free part
     * can be certified.
     *
     * <p>Negative values yield {@code I * sqrt(-value)}. The result is empty only
     * when the radicand is too large to split into square and square-free parts
     * within {@link IntegrationLimits#TRIAL_DIVISION_LIMIT}.
     *
     * @param value the radicand
     * @return the square root, or empty
     */
    public static Optional<RadicalNumber> sqrt(Rational value) {
        if (value.signum() == 0) {
            return Optional.of(ZERO);
        }
        if (value.signum() < 0) {
            return sqrt(value.negate()).map(root -> root.multiply(I));
        }
        // sqrt(n/d) = sqrt(n*d) / d
        return squareFreeSplit(value.numerator().multiply(value.denominator()))
            .map(split -> fromTerm(Rational.of(split.square(), value.denominator()),
                                   new Basis(false, split.free())));
    }

    // ==================== Field Operations ====================

    @Override
    public RadicalNumber add(RadicalNumber other) {
        if (other.isZero()) return this;
        if (isZero()) return other;
        TreeMap<Basis, Rational> sum = new TreeMap<>(terms);
        for (Map.Entry<Basis, Rational> e : other.terms.entrySet()) {
            Rational updated = sum.getOrDefault(e.getKey(), Rational.ZERO).add(e.getValue());
            if (updated.isZero()) {
                sum.remove(e.getKey());
            } else {
                sum.put(e.getKey(), updated);
            }
        }
        return new RadicalNumber(sum);
    }

    @Override
    public RadicalNumber multiply(RadicalNumber other) {
        if (isZero() || other.isZero()) return ZERO;
        if (other.isOne()) return this;
        if (isOne()) return other;
        TreeMap<Basis, Rational> product = new TreeMap<>();
        for (Map.Entry<Basis, Rational> a : terms.entrySet()) {
            for (Map.Entry<Basis, Rational> b : other.terms.entrySet()) {
                Scaled scaled = a.getKey().times(b.getKey());
                Rational coefficient = a.getValue().multiply(b.getValue())
                    .multiply(Rational.of(scaled.factor()));
                Rational updated = product.getOrDefault(scaled.basis(), Rational.ZERO).add(coefficient);
                if (updated.isZero()) {
                    product.remove(scaled.basis());
                } else {
                    product.put(scaled.basis(), updated);
                }
            }
        }
        return new RadicalNumber(product);
    }

    @Override
    public RadicalNumber multiply(long factor) {
        return scale(Rational.of(factor));
    }

    public RadicalNumber scale(Rational factor) {
        if (factor.isZero()) return ZERO;
        if (factor.isOne()) return this;
        TreeMap<Basis, Rational> scaled = new TreeMap<>();
        terms.forEach((basis, coefficient) -> scaled.put(basis, coefficient.multiply(factor)));
        return new RadicalNumber(scaled);
    }

    @Override
    public RadicalNumber negate() {
        return scale(Rational.MINUS_ONE);
    }

    /**
     * Inverts by solving {@code this * y = 1} in the span of the basis elements
     * generated by this value's radicals.
     */
    @Override
    public RadicalNumber inverse() {
        if (isZero()) {
            throw new ArithmeticException("Division by zero");
        }
        if (isRational()) {
            return of(rationalValue().inverse());
        }

        List<Basis> basis = generatedBasis();
        Map<Basis, Integer> index = new HashMap<>();
        for (int i = 0; i < basis.size(); i++) {
            index.put(basis.get(i), i);
        }

        int n = basis.size();
        List<List<Rational>> matrix = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            matrix.add(new ArrayList<>(Collections.nCopies(n, Rational.ZERO)));
        }
        for (int column = 0; column < n; column++) {
            for (Map.Entry<Basis, Rational> term : terms.entrySet()) {
                Scaled scaled = term.getKey().times(basis.get(column));
                int row = index.get(scaled.basis());
                Rational entry = term.getValue().multiply(Rational.of(scaled.factor()));
                matrix.get(row).set(column, matrix.get(row).get(column).add(entry));
            }
        }
        List<Rational> rhs = new ArrayList<>(Collections.nCopies(n, Rational.ZERO));
        rhs.set(index.get(Basis.ONE), Rational.ONE);

        GaussianElimination.Solution<Rational> solution =
            GaussianElimination.solve(matrix, rhs, n, Rational.ZERO)
                .filter(GaussianElimination.Solution::isUnique)
                .orElseThrow(() -> new ArithmeticException("Singular multiplication map for " + this));

        TreeMap<Basis, Rational> inverse = new TreeMap<>();
        for (int i = 0; i < n; i++) {
            Rational value = solution.values().get(i);
            if (!value.isZero()) {
                inverse.put(basis.get(i), value);
            }
        }
        return new RadicalNumber(inverse);
    }

    /** Closure of {1} under multiplication by the basis elements of this value. */
    private List<Basis> generatedBasis() {
        TreeSet<Basis> seen = new TreeSet<>();
        Deque<Basis> queue = new ArrayDeque<>();
        seen.add(Basis.ONE);
        queue.add(Basis.ONE);
        while (!queue.isEmpty()) {
            Basis current = queue.poll();
            for (Basis generator : terms.keySet()) {
                Basis next = current.times(generator).basis();
                if (seen.add(next)) {
                    queue.add(next);
                }
            }
        }
        return new ArrayList<>(seen);
    }

    @Override
    public boolean isZero() {
        return terms.isEmpty();
    }

    @Override
    public boolean isOne() {
        return terms.size() == 1 && Rational.ONE.equals(terms.get(Basis.ONE));
    }

    @Override
    public RadicalNumber zero() {
        return ZERO;
    }

    @Override
    public RadicalNumber one() {
        return ONE;
    }

    // ==================== Structure ====================

    public boolean isRational() {
        return terms.isEmpty() || (terms.size() == 1 && terms.containsKey(Basis.ONE));
    }

    /**
     * Returns the rational value of a rational element.
     *
     * @return the value
     * @throws IllegalStateException if this element is not rational
     */
    public Rational rationalValue() {
        if (!isRational()) {
            throw new IllegalStateException(this + " is not rational");
        }
        return terms.getOrDefault(Basis.ONE, Rational.ZERO);
    }

    public boolean isReal() {
        return terms.keySet().stream().noneMatch(Basis::imaginary);
    }

    public RadicalNumber realPart() {
        TreeMap<Basis, Rational> real = new TreeMap<>();
        terms.forEach((basis, coefficient) -> {
            if (!basis.imaginary()) real.put(basis, coefficient);
        });
        return new RadicalNumber(real);
    }

    /**
     * Returns the imaginary part as a real number ({@code Im(a + I*b) = b}).
     *
     * @return the imaginary part
     */
    public RadicalNumber imaginaryPart() {
        TreeMap<Basis, Rational> imaginary = new TreeMap<>();
        terms.forEach((basis, coefficient) -> {
            if (basis.imaginary()) imaginary.put(new Basis(false, basis.radicand()), coefficient);
        });
        return new RadicalNumber(imaginary);
    }

    public RadicalNumber conjugate() {
        return realPart().subtract(imaginaryPart().multiply(I));
    }

    public List<Term> terms() {
        List<Term> result = new ArrayList<>(terms.size());
        terms.forEach((basis, coefficient) ->
            result.add(new Term(coefficient, basis.imaginary(), basis.radicand())));
        return result;
    }

    // ==================== Order ====================

    /**
     * Returns the exact sign of a real element.
     *
     * <p>Each term is approximated with a certified relative error; the
     * approximation is accepted once its magnitude exceeds the accumulated
     * error bound. Precision doubles until that happens, which terminates for
     * every nonzero value.
     *
     * @return -1, 0 or 1
     * @throws IllegalStateException if this element is not real
     */
    public int signum() {
        if (!isReal()) {
            throw new IllegalStateException("signum is undefined for non-real " + this);
        }
        if (isZero()) return 0;
        if (terms.size() == 1) {
            return terms.firstEntry().getValue().signum();
        }
        for (int digits = IntegrationLimits.SIGN_INITIAL_PRECISION;
             digits <= IntegrationLimits.SIGN_MAX_PRECISION; digits *= 2) {
            MathContext mc = new MathContext(digits + 10, RoundingMode.HALF_EVEN);
            BigDecimal tolerance = BigDecimal.ONE.scaleByPowerOfTen(-digits);
            BigDecimal approximation = BigDecimal.ZERO;
            BigDecimal error = BigDecimal.ZERO;
            for (Map.Entry<Basis, Rational> e : terms.entrySet()) {
                BigDecimal value = approximate(e.getValue(), e.getKey().radicand(), mc);
                approximation = approximation.add(value);
                error = error.add(value.abs().multiply(tolerance));
            }
            if (approximation.abs().compareTo(error) > 0) {
                return approximation.signum();
            }
        }
        throw new IllegalStateException("Could not certify the sign of " + this);
    }

    private static BigDecimal approximate(Rational coefficient, BigInteger radicand, MathContext mc) {
        BigDecimal c = new BigDecimal(coefficient.numerator())
            .divide(new BigDecimal(coefficient.denominator()), mc);
        if (radicand.equals(BigInteger.ONE)) {
            return c;
        }
        return c.multiply(new BigDecimal(radicand).sqrt(mc), mc);
    }

    @Override
    public int compareTo(RadicalNumber other) {
        return subtract(other).signum();
    }

    public double doubleValue() {
        if (!isReal()) {
            throw new IllegalStateException(this + " is not real");
        }
        BigDecimal sum = BigDecimal.ZERO;
        for (Map.Entry<Basis, Rational> e : terms.entrySet()) {
            sum = sum.add(approximate(e.getValue(), e.getKey().radicand(), MathContext.DECIMAL64));
        }
        return sum.doubleValue();
    }

    // ==================== Square Roots ====================

    /**
     * Returns a square root inside this representation, when one exists and
     * can be found.
     *
     * <p>Handles rational values and real values {@code a + b*sqrt(m)} that
     * denest as {@code sqrt((a+c)/2) ± sqrt((a-c)/2)} with
     * {@code c = sqrt(a² - b²m)} rational. Negative real values give
     * {@code I} times the root of the negation.
     *
     * @return the principal square root, or empty
     */
    public Optional<RadicalNumber> sqrt() {
        if (isZero()) {
            return Optional.of(ZERO);
        }
        if (isRational()) {
            return sqrt(rationalValue());
        }
        if (!isReal()) {
            return Optional.empty();
        }
        if (signum() < 0) {
            return negate().sqrt().map(root -> root.multiply(I));
        }
        if (terms.size() != 2 || !terms.containsKey(Basis.ONE)) {
            return Optional.empty();
        }

        Rational a = terms.get(Basis.ONE);
        Map.Entry<Basis, Rational> radical = terms.lastEntry();
        Rational b = radical.getValue();
        Rational m = Rational.of(radical.getKey().radicand());
        Rational c = a.multiply(a).subtract(b.multiply(b).multiply(m)).exactSquareRoot();
        if (c == null) {
            return Optional.empty();
        }
        Rational first = a.add(c).multiply(Rational.HALF);
        Rational second = a.subtract(c).multiply(Rational.HALF);
        if (first.signum() < 0 || second.signum() < 0) {
            return Optional.empty();
        }
        Optional<RadicalNumber> p = sqrt(first);
        Optional<RadicalNumber> q = sqrt(second);
        if (p.isEmpty() || q.isEmpty()) {
            return Optional.empty();
        }
        RadicalNumber candidate = b.signum() > 0 ? p.get().add(q.get()) : p.get().subtract(q.get());
        if (!candidate.multiply(candidate).equals(this) || candidate.signum() < 0) {
            return Optional.empty();
        }
        return Optional.of(candidate);
    }

    /**
     * Splits {@code n > 0} as {@code square² * free} with {@code free}
     * square-free, by trial division up to {@link IntegrationLimits#TRIAL_DIVISION_LIMIT}.
     */
    private static Optional<SquareFreeSplit> squareFreeSplit(BigInteger n) {
        BigInteger rest = n;
        BigInteger square = BigInteger.ONE;
        BigInteger free = BigInteger.ONE;
        boolean exhausted = false;
        for (long p = 2; ; p = (p == 2) ? 3 : p + 2) {
            BigInteger bp = BigInteger.valueOf(p);
            if (bp.multiply(bp).compareTo(rest) > 0) {
                exhausted = true;
                break;
            }
            if (p > IntegrationLimits.TRIAL_DIVISION_LIMIT) {
                break;
            }
            int exponent = 0;
            while (rest.mod(bp).signum() == 0) {
                rest = rest.divide(bp);
                exponent++;
            }
            if (exponent > 0) {
                square = square.multiply(bp.pow(exponent / 2));
                if (exponent % 2 == 1) {
                    free = free.multiply(bp);
                }
            }
        }

        if (rest.equals(BigInteger.ONE)) {
            return Optional.of(new SquareFreeSplit(square, free));
        }
        if (exhausted) {
            // no factor below sqrt(rest): rest is prime
            return Optional.of(new SquareFreeSplit(square, free.multiply(rest)));
        }
        BigInteger root = rest.sqrt();
        if (root.multiply(root).equals(rest)) {
            return Optional.of(new SquareFreeSplit(square.multiply(root), free));
        }
        if (rest.compareTo(IntegrationLimits.squareFreeCertificationBound()) < 0) {
            // at most two prime factors, both above the limit, and not a square
            return Optional.of(new SquareFreeSplit(square, free.multiply(rest)));
        }
        return Optional.empty();
    }

    // ==================== Object ====================

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof RadicalNumber)) return false;
        return terms.equals(((RadicalNumber) obj).terms);
    }

    @Override
    public int hashCode() {
        return terms.hashCode();
    }

    @Override
    public String toString() {
        if (terms.isEmpty()) {
            return "0";
        }
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<Basis, Rational> e : terms.entrySet()) {
            Rational coefficient = e.getValue();
            Basis basis = e.getKey();
            if (sb.length() > 0) {
                sb.append(coefficient.signum() < 0 ? " - " : " + ");
                coefficient = coefficient.abs();
            }
            StringBuilder factor = new StringBuilder();
            if (basis.imaginary()) factor.append("I");
            if (!basis.radicand().equals(BigInteger.ONE)) {
                if (factor.length() > 0) factor.append("*");
                factor.append("sqrt(").append(basis.radicand()).append(")");
            }
            if (factor.length() == 0) {
                sb.append(coefficient);
            } else if (coefficient.isOne()) {
                sb.append(factor);
            } else if (coefficient.equals(Rational.MINUS_ONE)) {
                sb.append("-").append(factor);
            } else {
                sb.append(coefficient).append("*").append(factor);
            }
        }
        return sb.toString();
    }
}
