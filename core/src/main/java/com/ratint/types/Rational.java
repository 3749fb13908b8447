package com.ratint.types;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Exact arbitrary-precision rational number.
 *
 * <p>Values are always normalized: the denominator is positive and the
 * fraction is reduced, so structural equality coincides with numeric
 * equality.
 */
public final class Rational implements FieldElement<Rational>, Comparable<Rational> {

    public static final Rational ZERO = new Rational(BigInteger.ZERO, BigInteger.ONE);
    public static final Rational ONE = new Rational(BigInteger.ONE, BigInteger.ONE);
    public static final Rational TWO = new Rational(BigInteger.TWO, BigInteger.ONE);
    public static final Rational HALF = new Rational(BigInteger.ONE, BigInteger.TWO);
    public static final Rational MINUS_ONE = new Rational(BigInteger.ONE.negate(), BigInteger.ONE);

    private final BigInteger numerator;
    private final BigInteger denominator;

    private Rational(BigInteger numerator, BigInteger denominator) {
        this.numerator = numerator;
        this.denominator = denominator;
    }

    /**
     * Creates a normalized rational {@code numerator / denominator}.
     *
     * @param numerator the numerator
     * @param denominator the denominator, nonzero
     * @return the rational
     * @throws ArithmeticException if the denominator is zero
     */
    public static Rational of(BigInteger numerator, BigInteger denominator) {
        Objects.requireNonNull(numerator, "numerator must not be null");
        Objects.requireNonNull(denominator, "denominator must not be null");
        if (denominator.signum() == 0) {
            throw new ArithmeticException("Zero denominator");
        }
        if (denominator.signum() < 0) {
            numerator = numerator.negate();
            denominator = denominator.negate();
        }
        BigInteger g = numerator.gcd(denominator);
        if (!g.equals(BigInteger.ONE)) {
            numerator = numerator.divide(g);
            denominator = denominator.divide(g);
        }
        return new Rational(numerator, denominator);
    }

    public static Rational of(BigInteger value) {
        return new Rational(value, BigInteger.ONE);
    }

    public static Rational of(long value) {
        return new Rational(BigInteger.valueOf(value), BigInteger.ONE);
    }

    public static Rational of(long numerator, long denominator) {
        return of(BigInteger.valueOf(numerator), BigInteger.valueOf(denominator));
    }

    /**
     * Parses {@code "a/b"} or {@code "a"} (surrounding whitespace allowed).
     *
     * @param text the text to parse
     * @return the rational
     * @throws NumberFormatException if the text is not a fraction of integers
     */
    public static Rational parse(String text) {
        String s = text.trim();
        int slash = s.indexOf('/');
        if (slash < 0) {
            return of(new BigInteger(s));
        }
        return of(new BigInteger(s.substring(0, slash).trim()),
                  new BigInteger(s.substring(slash + 1).trim()));
    }

    public BigInteger numerator() {
        return numerator;
    }

    public BigInteger denominator() {
        return denominator;
    }

    public int signum() {
        return numerator.signum();
    }

    public boolean isInteger() {
        return denominator.equals(BigInteger.ONE);
    }

    public Rational abs() {
        return numerator.signum() < 0 ? negate() : this;
    }

    @Override
    public Rational add(Rational other) {
        if (other.isZero()) return this;
        if (isZero()) return other;
        return of(numerator.multiply(other.denominator).add(other.numerator.multiply(denominator)),
                  denominator.multiply(other.denominator));
    }

    @Override
    public Rational subtract(Rational other) {
        return add(other.negate());
    }

    @Override
    public Rational multiply(Rational other) {
        if (isZero() || other.isZero()) return ZERO;
        return of(numerator.multiply(other.numerator), denominator.multiply(other.denominator));
    }

    @Override
    public Rational multiply(long factor) {
        return multiply(of(factor));
    }

    @Override
    public Rational negate() {
        return new Rational(numerator.negate(), denominator);
    }

    @Override
    public Rational inverse() {
        if (isZero()) {
            throw new ArithmeticException("Division by zero");
        }
        return of(denominator, numerator);
    }

    @Override
    public boolean isZero() {
        return numerator.signum() == 0;
    }

    @Override
    public boolean isOne() {
        return numerator.equals(BigInteger.ONE) && denominator.equals(BigInteger.ONE);
    }

    @Override
    public Rational zero() {
        return ZERO;
    }

    @Override
    public Rational one() {
        return ONE;
    }

    /**
     * Raises to an integer power; negative exponents invert first.
     *
     * @param exponent the exponent
     * @return {@code this^exponent}
     * @throws ArithmeticException for a negative power of zero
     */
    public Rational power(int exponent) {
        if (exponent < 0) {
            return inverse().power(-exponent);
        }
        return of(numerator.pow(exponent), denominator.pow(exponent));
    }

    /**
     * Returns the exact square root when both numerator and denominator are
     * perfect squares, or {@code null} otherwise.
     *
     * @return the non-negative square root, or null
     */
    public Rational exactSquareRoot() {
        if (numerator.signum() < 0) {
            return null;
        }
        BigInteger n = numerator.sqrt();
        BigInteger d = denominator.sqrt();
        if (n.multiply(n).equals(numerator) && d.multiply(d).equals(denominator)) {
            return new Rational(n, d);
        }
        return null;
    }

    public double doubleValue() {
        return new java.math.BigDecimal(numerator)
            .divide(new java.math.BigDecimal(denominator), java.math.MathContext.DECIMAL64)
            .doubleValue();
    }

    @Override
    public int compareTo(Rational other) {
        return numerator.multiply(other.denominator).compareTo(other.numerator.multiply(denominator));
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Rational)) return false;
        Rational that = (Rational) obj;
        return numerator.equals(that.numerator) && denominator.equals(that.denominator);
    }

    @Override
    public int hashCode() {
        return Objects.hash(numerator, denominator);
    }

    @Override
    public String toString() {
        return isInteger() ? numerator.toString() : numerator + "/" + denominator;
    }
}
