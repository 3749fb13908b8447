package com.ratint.expression;

import com.ratint.types.Rational;
import java.util.List;
import java.util.Objects;

/**
 * {@code base^exponent}. Square roots are powers with exponent {@code 1/2}.
 */
public final class Power implements Expression {

    private final Expression base;
    private final Expression exponent;

    Power(Expression base, Expression exponent) {
        this.base = Objects.requireNonNull(base, "base must not be null");
        this.exponent = Objects.requireNonNull(exponent, "exponent must not be null");
    }

    public Expression base() {
        return base;
    }

    public Expression exponent() {
        return exponent;
    }

    @Override
    public List<Expression> children() {
        return List.of(base, exponent);
    }

    @Override
    public String format() {
        if (exponent instanceof Constant e && e.value().equals(Rational.HALF)) {
            return "sqrt(" + base.format() + ")";
        }
        return NodeSupport.wrap(base, NodeSupport.ATOM) + "^" + NodeSupport.wrap(exponent, NodeSupport.ATOM);
    }

    @Override
    public String toString() {
        return format();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Power)) return false;
        Power that = (Power) obj;
        return base.equals(that.base) && exponent.equals(that.exponent);
    }

    @Override
    public int hashCode() {
        return Objects.hash(base, exponent);
    }
}
