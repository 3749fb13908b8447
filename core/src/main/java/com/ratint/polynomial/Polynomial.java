package com.ratint.polynomial;

import com.ratint.expression.Expression;
import com.ratint.expression.Expressions;
import com.ratint.expression.Symbol;
import com.ratint.types.RingElement;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Dense univariate polynomial over a commutative ring.
 *
 * <p>Coefficients are stored lowest degree first and trailing zeros are always
 * trimmed, so the leading coefficient is nonzero unless the polynomial is zero
 * (degree -1). The coefficient type may itself be a polynomial ring, giving
 * {@code K[t][x]} as {@code Polynomial<Polynomial<K>>}.
 *
 * <p>Because polynomials are themselves {@link RingElement}s, every algorithm
 * written against {@code RingElement} (for example the subresultant PRS) runs
 * unchanged over nested polynomial rings.
 *
 * @param <C> the coefficient type
 */
public final class Polynomial<C extends RingElement<C>> implements RingElement<Polynomial<C>> {

    private final Symbol variable;
    private final C coefficientZero;
    private final List<C> coefficients;

    private Polynomial(Symbol variable, C coefficientZero, List<C> coefficients) {
        this.variable = variable;
        this.coefficientZero = coefficientZero;
        this.coefficients = coefficients;
    }

    /**
     * Creates a polynomial from its coefficients, lowest degree first.
     *
     * @param variable the variable
     * @param zero the zero of the coefficient ring
     * @param coefficients the coefficients; trailing zeros are dropped
     * @param <C> the coefficient type
     * @return the polynomial
     */
    public static <C extends RingElement<C>> Polynomial<C> of(Symbol variable, C zero, List<C> coefficients) {
        Objects.requireNonNull(variable, "variable must not be null");
        Objects.requireNonNull(zero, "zero must not be null");
        int size = coefficients.size();
        while (size > 0 && coefficients.get(size - 1).isZero()) {
            size--;
        }
        return new Polynomial<>(variable, zero, Collections.unmodifiableList(new ArrayList<>(coefficients.subList(0, size))));
    }

    public static <C extends RingElement<C>> Polynomial<C> zero(Symbol variable, C zero) {
        return new Polynomial<>(variable, zero, List.of());
    }

    public static <C extends RingElement<C>> Polynomial<C> constant(Symbol variable, C value) {
        return monomial(variable, value, 0);
    }

    /**
     * Creates {@code coefficient * variable^degree}.
     */
    public static <C extends RingElement<C>> Polynomial<C> monomial(Symbol variable, C coefficient, int degree) {
        if (degree < 0) {
            throw new IllegalArgumentException("degree must be non-negative: " + degree);
        }
        C zero = coefficient.zero();
        if (coefficient.isZero()) {
            return zero(variable, zero);
        }
        List<C> coefficients = new ArrayList<>(Collections.nCopies(degree + 1, zero));
        coefficients.set(degree, coefficient);
        return new Polynomial<>(variable, zero, Collections.unmodifiableList(coefficients));
    }

    /**
     * Creates the polynomial {@code variable} itself.
     *
     * @param variable the variable
     * @param one the one of the coefficient ring
     * @param <C> the coefficient type
     * @return {@code x}
     */
    public static <C extends RingElement<C>> Polynomial<C> identity(Symbol variable, C one) {
        return monomial(variable, one, 1);
    }

    // ==================== Accessors ====================

    public Symbol variable() {
        return variable;
    }

    public C coefficientZero() {
        return coefficientZero;
    }

    /**
     * Returns the degree, or -1 for the zero polynomial.
     *
     * @return the degree
     */
    public int degree() {
        return coefficients.size() - 1;
    }

    public List<C> coefficients() {
        return coefficients;
    }

    /**
     * Returns the coefficient of {@code variable^i}, zero outside the stored range.
     */
    public C coefficient(int i) {
        return (i >= 0 && i < coefficients.size()) ? coefficients.get(i) : coefficientZero;
    }

    public C leadingCoefficient() {
        return coefficients.isEmpty() ? coefficientZero : coefficients.get(coefficients.size() - 1);
    }

    public C constantTerm() {
        return coefficient(0);
    }

    public boolean isConstant() {
        return coefficients.size() <= 1;
    }

    // ==================== Ring Operations ====================

    @Override
    public Polynomial<C> add(Polynomial<C> other) {
        checkVariable(other);
        if (other.isZero()) return this;
        if (isZero()) return other;
        int size = Math.max(coefficients.size(), other.coefficients.size());
        List<C> sum = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            sum.add(coefficient(i).add(other.coefficient(i)));
        }
        return of(variable, coefficientZero, sum);
    }

    @Override
    public Polynomial<C> multiply(Polynomial<C> other) {
        checkVariable(other);
        if (isZero() || other.isZero()) {
            return zero();
        }
        List<C> product = new ArrayList<>(Collections.nCopies(degree() + other.degree() + 1, coefficientZero));
        for (int i = 0; i < coefficients.size(); i++) {
            C a = coefficients.get(i);
            if (a.isZero()) continue;
            for (int j = 0; j < other.coefficients.size(); j++) {
                product.set(i + j, product.get(i + j).add(a.multiply(other.coefficients.get(j))));
            }
        }
        return of(variable, coefficientZero, product);
    }

    @Override
    public Polynomial<C> multiply(long factor) {
        return map(c -> c.multiply(factor));
    }

    /**
     * Multiplies every coefficient by {@code factor}.
     */
    public Polynomial<C> scale(C factor) {
        return map(c -> c.multiply(factor));
    }

    @Override
    public Polynomial<C> negate() {
        return map(RingElement::negate);
    }

    /**
     * Divides exactly by {@code divisor}.
     *
     * <p>Each step divides leading coefficients with
     * {@link RingElement#exactQuotient}, so over a field this is ordinary long
     * division and over a ring it succeeds only when the quotient exists.
     *
     * @param divisor the divisor
     * @return the quotient
     * @throws ArithmeticException if the divisor is zero or the division leaves a remainder
     */
    @Override
    public Polynomial<C> exactQuotient(Polynomial<C> divisor) {
        checkVariable(divisor);
        if (divisor.isZero()) {
            throw new ArithmeticException("Polynomial division by zero");
        }
        if (divisor.degree() == 0) {
            return exactQuotientByCoefficient(divisor.leadingCoefficient());
        }
        List<C> remainder = new ArrayList<>(coefficients);
        int shiftMax = degree() - divisor.degree();
        if (shiftMax < 0) {
            if (isZero()) return this;
            throw new ArithmeticException("Inexact polynomial division: " + this + " by " + divisor);
        }
        List<C> quotient = new ArrayList<>(Collections.nCopies(shiftMax + 1, coefficientZero));
        C lead = divisor.leadingCoefficient();
        for (int shift = shiftMax; shift >= 0; shift--) {
            C top = remainder.get(shift + divisor.degree());
            if (top.isZero()) continue;
            C q = top.exactQuotient(lead);
            quotient.set(shift, q);
            for (int j = 0; j <= divisor.degree(); j++) {
                remainder.set(shift + j, remainder.get(shift + j).subtract(q.multiply(divisor.coefficient(j))));
            }
        }
        for (C c : remainder) {
            if (!c.isZero()) {
                throw new ArithmeticException("Inexact polynomial division: " + this + " by " + divisor);
            }
        }
        return of(variable, coefficientZero, quotient);
    }

    /**
     * Divides every coefficient exactly by {@code divisor}.
     *
     * @throws ArithmeticException if some coefficient is not divisible
     */
    public Polynomial<C> exactQuotientByCoefficient(C divisor) {
        if (divisor.isOne()) return this;
        return map(c -> c.exactQuotient(divisor));
    }

    @Override
    public boolean isZero() {
        return coefficients.isEmpty();
    }

    @Override
    public boolean isOne() {
        return coefficients.size() == 1 && coefficients.get(0).isOne();
    }

    @Override
    public Polynomial<C> zero() {
        return zero(variable, coefficientZero);
    }

    @Override
    public Polynomial<C> one() {
        return constant(variable, coefficientZero.one());
    }

    // ==================== Calculus and Evaluation ====================

    public Polynomial<C> derivative() {
        if (coefficients.size() <= 1) {
            return zero();
        }
        List<C> result = new ArrayList<>(coefficients.size() - 1);
        for (int i = 1; i < coefficients.size(); i++) {
            result.add(coefficients.get(i).multiply(i));
        }
        return of(variable, coefficientZero, result);
    }

    /**
     * Evaluates at {@code point} by Horner's rule.
     */
    public C evaluate(C point) {
        C result = coefficientZero;
        for (int i = coefficients.size() - 1; i >= 0; i--) {
            result = result.multiply(point).add(coefficients.get(i));
        }
        return result;
    }

    /**
     * Applies {@code f} to every coefficient, keeping the variable.
     */
    public Polynomial<C> map(Function<C, C> f) {
        return mapCoefficients(f, coefficientZero);
    }

    /**
     * Applies {@code f} to every coefficient, producing a polynomial over another ring.
     *
     * @param f the coefficient map; must send zero to zero
     * @param zero the zero of the target ring
     * @param <D> the target coefficient type
     * @return the mapped polynomial
     */
    public <D extends RingElement<D>> Polynomial<D> mapCoefficients(Function<C, D> f, D zero) {
        List<D> mapped = new ArrayList<>(coefficients.size());
        for (C c : coefficients) {
            mapped.add(f.apply(c));
        }
        return of(variable, zero, mapped);
    }

    /**
     * Converts to an expression in this polynomial's variable.
     *
     * @param coefficientToExpression conversion of single coefficients
     * @return the expression, highest degree first
     */
    public Expression toExpression(Function<C, Expression> coefficientToExpression) {
        List<Expression> converted = new ArrayList<>(coefficients.size());
        for (C c : coefficients) {
            converted.add(coefficientToExpression.apply(c));
        }
        return Expressions.polynomial(converted, variable);
    }

    private void checkVariable(Polynomial<C> other) {
        if (!variable.equals(other.variable)) {
            throw new IllegalArgumentException(
                "Polynomials in different variables: " + variable + " and " + other.variable);
        }
    }

    // ==================== Object ====================

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Polynomial)) return false;
        Polynomial<?> that = (Polynomial<?>) obj;
        return variable.equals(that.variable) && coefficients.equals(that.coefficients);
    }

    @Override
    public int hashCode() {
        return Objects.hash(variable, coefficients);
    }

    @Override
    public String toString() {
        if (isZero()) {
            return "0";
        }
        StringBuilder sb = new StringBuilder();
        for (int i = coefficients.size() - 1; i >= 0; i--) {
            C c = coefficients.get(i);
            if (c.isZero()) continue;
            if (sb.length() > 0) sb.append(" + ");
            if (i == 0) {
                sb.append(c);
            } else {
                if (!c.isOne()) sb.append("(").append(c).append(")*");
                sb.append(variable);
                if (i > 1) sb.append("^").append(i);
            }
        }
        return sb.toString();
    }
}
