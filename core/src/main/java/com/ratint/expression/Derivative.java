package com.ratint.expression;

import java.util.ArrayList;
import java.util.List;

/**
 * Symbolic differentiation.
 */
public final class Derivative {

    private Derivative() {}

    /**
     * Differentiates {@code e} with respect to {@code x}.
     *
     * <p>A {@link RootSum} is differentiated under the sum: its polynomial does
     * not depend on {@code x}.
     *
     * @param e the expression
     * @param x the variable
     * @return the derivative, simplified by the {@link Expressions} factories
     */
    public static Expression differentiate(Expression e, Symbol x) {
        if (e instanceof Constant || e instanceof ImaginaryUnit) {
            return Constant.ZERO;
        }
        if (e instanceof Symbol s) {
            return s.equals(x) ? Constant.ONE : Constant.ZERO;
        }
        if (e instanceof Sum sum) {
            List<Expression> terms = new ArrayList<>(sum.terms().size());
            for (Expression term : sum.terms()) {
                terms.add(differentiate(term, x));
            }
            return Expressions.add(terms);
        }
        if (e instanceof Product product) {
            List<Expression> factors = product.factors();
            List<Expression> terms = new ArrayList<>(factors.size());
            for (int i = 0; i < factors.size(); i++) {
                Expression d = differentiate(factors.get(i), x);
                if (d instanceof Constant c && c.isZero()) {
                    continue;
                }
                List<Expression> term = new ArrayList<>(factors);
                term.set(i, d);
                terms.add(Expressions.multiply(term));
            }
            return Expressions.add(terms);
        }
        if (e instanceof Power power) {
            return differentiatePower(power, x);
        }
        if (e instanceof Log log) {
            return Expressions.divide(differentiate(log.argument(), x), log.argument());
        }
        if (e instanceof Atan atan) {
            Expression u = atan.argument();
            return Expressions.divide(differentiate(u, x),
                Expressions.add(Constant.ONE, Expressions.power(u, 2)));
        }
        RootSum rootSum = (RootSum) e;
        return Expressions.rootSum(rootSum.coefficients(), rootSum.variable(),
            differentiate(rootSum.body(), x));
    }

    private static Expression differentiatePower(Power power, Symbol x) {
        Expression base = power.base();
        Expression exponent = power.exponent();
        Expression dBase = differentiate(base, x);
        if (!ExpressionUtils.contains(exponent, x)) {
            // n * b^(n-1) * b'
            return Expressions.multiply(exponent,
                Expressions.power(base, Expressions.subtract(exponent, Constant.ONE)), dBase);
        }
        // b^e * (e' * log(b) + e * b' / b)
        Expression dExponent = differentiate(exponent, x);
        return Expressions.multiply(power, Expressions.add(
            Expressions.multiply(dExponent, Expressions.log(base)),
            Expressions.divide(Expressions.multiply(exponent, dBase), base)));
    }
}
