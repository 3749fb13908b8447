package com.ratint.domain;

import com.ratint.expression.Expression;
import com.ratint.expression.Symbol;
import com.ratint.polynomial.RationalFunction;
import com.ratint.types.FieldElement;
import com.ratint.types.Rational;
import java.util.Objects;

/**
 * Rational functions of one symbolic parameter over a base domain.
 *
 * <p>Nesting gives fields such as Q(a)(b). There is no real-logarithm converter:
 * the sign of a parametric expression is unknown, so logarithmic terms over this
 * domain stay as root sums.
 *
 * @param <C> the base field
 */
public final class ParametricDomain<C extends FieldElement<C>> implements CoefficientDomain<RationalFunction<C>> {

    private final CoefficientDomain<C> base;
    private final Symbol parameter;
    private final RationalFunctionConverter<C> converter;

    public ParametricDomain(CoefficientDomain<C> base, Symbol parameter) {
        this.base = Objects.requireNonNull(base, "base must not be null");
        this.parameter = Objects.requireNonNull(parameter, "parameter must not be null");
        this.converter = new RationalFunctionConverter<>(base, parameter);
    }

    public CoefficientDomain<C> base() {
        return base;
    }

    public Symbol parameter() {
        return parameter;
    }

    @Override
    public RationalFunction<C> zero() {
        return RationalFunction.constant(parameter, base.zero());
    }

    @Override
    public RationalFunction<C> one() {
        return RationalFunction.constant(parameter, base.one());
    }

    @Override
    public RationalFunction<C> fromRational(Rational value) {
        return RationalFunction.constant(parameter, base.fromRational(value));
    }

    @Override
    public RationalFunction<C> fromExpression(Expression e) {
        return converter.convert(e);
    }

    @Override
    public Expression toExpression(RationalFunction<C> value) {
        return value.toExpression(base::toExpression);
    }

    @Override
    public String toString() {
        return "ParametricDomain(" + parameter + " over " + base + ")";
    }
}
