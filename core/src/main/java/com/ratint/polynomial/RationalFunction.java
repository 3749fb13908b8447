package com.ratint.polynomial;

import com.ratint.expression.Expression;
import com.ratint.expression.Expressions;
import com.ratint.expression.Symbol;
import com.ratint.types.FieldElement;
import java.util.Objects;
import java.util.function.Function;

/**
 * Quotient of two polynomials over a field, always in lowest terms with a monic
 * denominator.
 *
 * <p>The normalization makes equality structural. Since a rational function is
 * itself a {@link FieldElement}, {@code RationalFunction<RationalFunction<K>>}
 * is the field {@code K(a)(b)}: integrands with symbolic parameters are handled
 * by integrating over such a tower.
 *
 * @param <C> the coefficient field
 */
public final class RationalFunction<C extends FieldElement<C>> implements FieldElement<RationalFunction<C>> {

    private final Polynomial<C> numerator;
    private final Polynomial<C> denominator;

    private RationalFunction(Polynomial<C> numerator, Polynomial<C> denominator) {
        this.numerator = numerator;
        this.denominator = denominator;
    }

    /**
     * Creates {@code numerator / denominator} in lowest terms.
     *
     * @param numerator the numerator
     * @param denominator the denominator, nonzero
     * @param <C> the coefficient field
     * @return the normalized rational function
     * @throws ArithmeticException if the denominator is zero
     */
    public static <C extends FieldElement<C>> RationalFunction<C> of(Polynomial<C> numerator, Polynomial<C> denominator) {
        Objects.requireNonNull(numerator, "numerator must not be null");
        Objects.requireNonNull(denominator, "denominator must not be null");
        if (denominator.isZero()) {
            throw new ArithmeticException("Rational function with zero denominator");
        }
        if (numerator.isZero()) {
            return new RationalFunction<>(numerator, denominator.one());
        }
        Polynomial<C> g = Polynomials.gcd(numerator, denominator);
        Polynomial<C> n = numerator.exactQuotient(g);
        Polynomial<C> d = denominator.exactQuotient(g);
        C lead = d.leadingCoefficient();
        if (!lead.isOne()) {
            C inverse = lead.inverse();
            n = n.scale(inverse);
            d = d.scale(inverse);
        }
        return new RationalFunction<>(n, d);
    }

    public static <C extends FieldElement<C>> RationalFunction<C> of(Polynomial<C> polynomial) {
        return new RationalFunction<>(polynomial, polynomial.one());
    }

    public static <C extends FieldElement<C>> RationalFunction<C> constant(Symbol variable, C value) {
        return of(Polynomial.constant(variable, value));
    }

    public static <C extends FieldElement<C>> RationalFunction<C> variable(Symbol variable, C one) {
        return of(Polynomial.identity(variable, one));
    }

    public Polynomial<C> numerator() {
        return numerator;
    }

    public Polynomial<C> denominator() {
        return denominator;
    }

    public Symbol variable() {
        return numerator.variable();
    }

    public boolean isPolynomial() {
        return denominator.degree() == 0;
    }

    public boolean isConstant() {
        return numerator.degree() <= 0 && denominator.degree() == 0;
    }

    // ==================== Field Operations ====================

    @Override
    public RationalFunction<C> add(RationalFunction<C> other) {
        if (other.isZero()) return this;
        if (isZero()) return other;
        if (denominator.equals(other.denominator)) {
            return of(numerator.add(other.numerator), denominator);
        }
        return of(numerator.multiply(other.denominator).add(other.numerator.multiply(denominator)),
                  denominator.multiply(other.denominator));
    }

    @Override
    public RationalFunction<C> multiply(RationalFunction<C> other) {
        if (isZero() || other.isZero()) return zero();
        return of(numerator.multiply(other.numerator), denominator.multiply(other.denominator));
    }

    @Override
    public RationalFunction<C> multiply(long factor) {
        return of(numerator.multiply(factor), denominator);
    }

    @Override
    public RationalFunction<C> negate() {
        return new RationalFunction<>(numerator.negate(), denominator);
    }

    @Override
    public RationalFunction<C> inverse() {
        if (isZero()) {
            throw new ArithmeticException("Division by zero rational function");
        }
        return of(denominator, numerator);
    }

    @Override
    public boolean isZero() {
        return numerator.isZero();
    }

    @Override
    public boolean isOne() {
        return numerator.isOne() && denominator.isOne();
    }

    @Override
    public RationalFunction<C> zero() {
        return new RationalFunction<>(numerator.zero(), denominator.one());
    }

    @Override
    public RationalFunction<C> one() {
        return new RationalFunction<>(numerator.one(), denominator.one());
    }

    /**
     * Converts to an expression, {@code numerator / denominator}.
     */
    public Expression toExpression(Function<C, Expression> coefficientToExpression) {
        Expression n = numerator.toExpression(coefficientToExpression);
        if (denominator.isOne()) {
            return n;
        }
        return Expressions.divide(n, denominator.toExpression(coefficientToExpression));
    }

    // ==================== Object ====================

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof RationalFunction)) return false;
        RationalFunction<?> that = (RationalFunction<?>) obj;
        return numerator.equals(that.numerator) && denominator.equals(that.denominator);
    }

    @Override
    public int hashCode() {
        return Objects.hash(numerator, denominator);
    }

    @Override
    public String toString() {
        if (denominator.isOne()) {
            return numerator.toString();
        }
        return "(" + numerator + ")/(" + denominator + ")";
    }
}
