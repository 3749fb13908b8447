package com.ratint.expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Formal sum {@code Σ body(a)} over the roots {@code a} of a polynomial.
 *
 * <p>The polynomial is stored as its coefficients in the bound variable, lowest
 * degree first; the coefficients never mention the bound variable. Roots are
 * counted without multiplicity: the polynomial is square-free.
 *
 * <p>Two root sums are equal when they have the same polynomial and their bodies
 * agree after renaming one bound variable to the other.
 */
public final class RootSum implements Expression {

    private final List<Expression> coefficients;
    private final Symbol variable;
    private final Expression body;

    RootSum(List<Expression> coefficients, Symbol variable, Expression body) {
        if (coefficients.size() < 2) {
            throw new IllegalArgumentException("a root sum needs a polynomial of degree at least 1");
        }
        this.coefficients = Collections.unmodifiableList(new ArrayList<>(coefficients));
        this.variable = Objects.requireNonNull(variable, "variable must not be null");
        this.body = Objects.requireNonNull(body, "body must not be null");
    }

    public List<Expression> coefficients() {
        return coefficients;
    }

    public Symbol variable() {
        return variable;
    }

    public Expression body() {
        return body;
    }

    public int degree() {
        return coefficients.size() - 1;
    }

    /**
     * Returns the polynomial as an expression in the bound variable.
     *
     * @return the polynomial
     */
    public Expression polynomial() {
        return Expressions.polynomial(coefficients, variable);
    }

    @Override
    public List<Expression> children() {
        List<Expression> children = new ArrayList<>(coefficients);
        children.add(body);
        return children;
    }

    @Override
    public String format() {
        return "RootSum(" + polynomial().format() + ", " + variable.format() + " -> " + body.format() + ")";
    }

    @Override
    public String toString() {
        return format();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof RootSum)) return false;
        RootSum that = (RootSum) obj;
        if (!coefficients.equals(that.coefficients)) {
            return false;
        }
        Expression renamed = ExpressionUtils.substitute(that.body, Map.of(that.variable, variable));
        return body.equals(renamed);
    }

    @Override
    public int hashCode() {
        return coefficients.hashCode();
    }
}
