package com.ratint.domain;

import com.ratint.exception.InvalidIntegrandException;
import com.ratint.expression.Constant;
import com.ratint.expression.Expression;
import com.ratint.expression.ExpressionUtils;
import com.ratint.expression.Power;
import com.ratint.expression.Product;
import com.ratint.expression.Sum;
import com.ratint.expression.Symbol;
import com.ratint.polynomial.RationalFunction;
import com.ratint.types.FieldElement;
import java.util.Objects;

/**
 * Converts an expression into a rational function of one variable.
 *
 * <p>Subexpressions free of the variable are handed to the coefficient domain;
 * sums, products and integer powers are combined with rational-function
 * arithmetic, so the input does not need to be expanded or put over a common
 * denominator.
 *
 * @param <C> the coefficient field
 */
public final class RationalFunctionConverter<C extends FieldElement<C>> {

    private final CoefficientDomain<C> domain;
    private final Symbol variable;

    public RationalFunctionConverter(CoefficientDomain<C> domain, Symbol variable) {
        this.domain = Objects.requireNonNull(domain, "domain must not be null");
        this.variable = Objects.requireNonNull(variable, "variable must not be null");
    }

    /**
     * Converts {@code e}.
     *
     * @param e the expression
     * @return the rational function in lowest terms
     * @throws InvalidIntegrandException if {@code e} is not a rational function of
     *         the variable, or divides by zero
     */
    public RationalFunction<C> convert(Expression e) {
        if (!ExpressionUtils.contains(e, variable)) {
            return RationalFunction.constant(variable, domain.fromExpression(e));
        }
        if (e instanceof Symbol) {
            return RationalFunction.variable(variable, domain.one());
        }
        if (e instanceof Sum sum) {
            RationalFunction<C> result = RationalFunction.constant(variable, domain.zero());
            for (Expression term : sum.terms()) {
                result = result.add(convert(term));
            }
            return result;
        }
        if (e instanceof Product product) {
            RationalFunction<C> result = RationalFunction.constant(variable, domain.one());
            for (Expression factor : product.factors()) {
                result = result.multiply(convert(factor));
            }
            return result;
        }
        if (e instanceof Power power
                && power.exponent() instanceof Constant exponent
                && exponent.value().isInteger()) {
            RationalFunction<C> base = convert(power.base());
            int n;
            try {
                n = exponent.value().numerator().intValueExact();
            } catch (ArithmeticException ex) {
                throw new InvalidIntegrandException("Exponent out of range", ex, e.format());
            }
            if (n >= 0) {
                return base.pow(n);
            }
            if (base.isZero()) {
                throw new InvalidIntegrandException("Division by zero (zero denominator)", e.format());
            }
            return base.inverse().pow(-n);
        }
        throw new InvalidIntegrandException(
            "Expression is not a polynomial or rational function of " + variable, e.format());
    }
}
