package com.ratint.expression;

import com.ratint.types.Rational;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Product of at least two factors.
 *
 * <p>Factors are never products themselves, at most one factor is a
 * {@link Constant} and it comes first, and no two factors share a base.
 * Equality ignores factor order.
 */
public final class Product implements Expression {

    private final List<Expression> factors;

    Product(List<Expression> factors) {
        if (factors.size() < 2) {
            throw new IllegalArgumentException("a product needs at least two factors, got " + factors.size());
        }
        this.factors = Collections.unmodifiableList(factors);
    }

    public List<Expression> factors() {
        return factors;
    }

    /**
     * Returns the rational coefficient of this product (1 when it has none).
     *
     * @return the coefficient
     */
    public Rational coefficient() {
        return factors.get(0) instanceof Constant c ? c.value() : Rational.ONE;
    }

    @Override
    public List<Expression> children() {
        return factors;
    }

    /**
     * Formats factors with negative integer exponents as a denominator:
     * {@code -(6 + 12*x)/(1 - x^2)}.
     */
    @Override
    public String format() {
        Rational coefficient = Rational.ONE;
        List<String> numerator = new ArrayList<>();
        List<String> denominator = new ArrayList<>();
        for (Expression factor : factors) {
            if (factor instanceof Constant c) {
                coefficient = c.value();
            } else if (factor instanceof Power p
                       && p.exponent() instanceof Constant e
                       && e.value().signum() < 0) {
                Expression inverted = Expressions.power(p.base(), Constant.of(e.value().negate()));
                denominator.add(NodeSupport.wrap(inverted, NodeSupport.POWER));
            } else {
                numerator.add(NodeSupport.wrap(factor, NodeSupport.POWER));
            }
        }

        StringBuilder sb = new StringBuilder();
        if (coefficient.signum() < 0) {
            sb.append("-");
        }
        Rational magnitude = coefficient.abs();
        if (!magnitude.isOne()) {
            numerator.add(0, magnitude.toString());
        }
        sb.append(numerator.isEmpty() ? "1" : String.join("*", numerator));
        if (!denominator.isEmpty()) {
            sb.append("/");
            if (denominator.size() == 1) {
                sb.append(denominator.get(0));
            } else {
                sb.append("(").append(String.join("*", denominator)).append(")");
            }
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return format();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Product)) return false;
        return NodeSupport.sameElements(factors, ((Product) obj).factors);
    }

    @Override
    public int hashCode() {
        return 31 * NodeSupport.unorderedHash(factors) + 2;
    }
}
