package com.ratint.expression;

import com.ratint.types.Rational;
import java.util.List;
import java.util.Objects;

/**
 * Exact rational constant.
 */
public final class Constant implements Expression {

    public static final Constant ZERO = new Constant(Rational.ZERO);
    public static final Constant ONE = new Constant(Rational.ONE);
    public static final Constant MINUS_ONE = new Constant(Rational.MINUS_ONE);
    public static final Constant TWO = new Constant(Rational.TWO);
    public static final Constant HALF = new Constant(Rational.HALF);

    private final Rational value;

    private Constant(Rational value) {
        this.value = Objects.requireNonNull(value, "value must not be null");
    }

    public static Constant of(Rational value) {
        if (value.isZero()) return ZERO;
        if (value.isOne()) return ONE;
        return new Constant(value);
    }

    public static Constant of(long value) {
        return of(Rational.of(value));
    }

    public static Constant of(long numerator, long denominator) {
        return of(Rational.of(numerator, denominator));
    }

    public Rational value() {
        return value;
    }

    public boolean isZero() {
        return value.isZero();
    }

    public boolean isOne() {
        return value.isOne();
    }

    @Override
    public List<Expression> children() {
        return List.of();
    }

    @Override
    public String format() {
        return value.toString();
    }

    @Override
    public String toString() {
        return format();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Constant)) return false;
        return value.equals(((Constant) obj).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }
}
