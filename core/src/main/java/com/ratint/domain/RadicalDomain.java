package com.ratint.domain;

import com.ratint.exception.InvalidIntegrandException;
import com.ratint.expression.Atan;
import com.ratint.expression.Constant;
import com.ratint.expression.Expression;
import com.ratint.expression.Expressions;
import com.ratint.expression.ImaginaryUnit;
import com.ratint.expression.Log;
import com.ratint.expression.Power;
import com.ratint.expression.Product;
import com.ratint.expression.RootSum;
import com.ratint.expression.Sum;
import com.ratint.expression.Symbol;
import com.ratint.polynomial.Polynomial;
import com.ratint.roots.RealRootFinder;
import com.ratint.types.RadicalNumber;
import com.ratint.types.Rational;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The numeric coefficient domain: exact elements of Q(i, √2, √3, ...).
 *
 * <p>Accepts rational constants, the imaginary unit, and square roots whose
 * value lies in the field (for example {@code sqrt(8)} or {@code sqrt(3 + 2*sqrt(2))}).
 * Log terms over this field are the only ones with a real form.
 */
public final class RadicalDomain implements CoefficientDomain<RadicalNumber> {

    private static final RadicalDomain INSTANCE = new RadicalDomain();

    private RadicalDomain() {}

    public static RadicalDomain get() {
        return INSTANCE;
    }

    @Override
    public RadicalNumber zero() {
        return RadicalNumber.ZERO;
    }

    @Override
    public RadicalNumber one() {
        return RadicalNumber.ONE;
    }

    @Override
    public RadicalNumber fromRational(Rational value) {
        return RadicalNumber.of(value);
    }

    @Override
    public RadicalNumber fromExpression(Expression e) {
        if (e instanceof Constant c) {
            return RadicalNumber.of(c.value());
        }
        if (e instanceof ImaginaryUnit) {
            return RadicalNumber.I;
        }
        if (e instanceof Sum sum) {
            RadicalNumber result = RadicalNumber.ZERO;
            for (Expression term : sum.terms()) {
                result = result.add(fromExpression(term));
            }
            return result;
        }
        if (e instanceof Product product) {
            RadicalNumber result = RadicalNumber.ONE;
            for (Expression factor : product.factors()) {
                result = result.multiply(fromExpression(factor));
            }
            return result;
        }
        if (e instanceof Power power && power.exponent() instanceof Constant exponent) {
            return power(fromExpression(power.base()), exponent.value(), e);
        }
        if (e instanceof Symbol || e instanceof Log || e instanceof Atan || e instanceof RootSum) {
            throw new InvalidIntegrandException("Unsupported constant", e.format());
        }
        throw new InvalidIntegrandException("Unsupported constant exponent", e.format());
    }

    private static RadicalNumber power(RadicalNumber base, Rational exponent, Expression source) {
        BigInteger denominator = exponent.denominator();
        RadicalNumber root = base;
        if (denominator.equals(BigInteger.TWO)) {
            root = base.sqrt().orElseThrow(() -> new InvalidIntegrandException(
                "Square root has no closed form in the coefficient field", source.format()));
        } else if (!denominator.equals(BigInteger.ONE)) {
            throw new InvalidIntegrandException("Only square roots of constants are supported", source.format());
        }
        int n;
        try {
            n = exponent.numerator().intValueExact();
        } catch (ArithmeticException e) {
            throw new InvalidIntegrandException("Exponent out of range", e, source.format());
        }
        if (n < 0) {
            if (root.isZero()) {
                throw new InvalidIntegrandException("Division by zero constant (zero denominator)", source.format());
            }
            return root.inverse().pow(-n);
        }
        return root.pow(n);
    }

    @Override
    public Expression toExpression(RadicalNumber value) {
        List<Expression> terms = new ArrayList<>();
        for (RadicalNumber.Term term : value.terms()) {
            List<Expression> factors = new ArrayList<>();
            factors.add(Constant.of(term.coefficient()));
            if (term.imaginary()) {
                factors.add(ImaginaryUnit.get());
            }
            if (!term.radicand().equals(BigInteger.ONE)) {
                factors.add(Expressions.sqrt(Constant.of(Rational.of(term.radicand()))));
            }
            terms.add(Expressions.multiply(factors));
        }
        return Expressions.add(terms);
    }

    /**
     * Real coefficients only: every root must be real and found by
     * {@link RealRootFinder}.
     */
    @Override
    public Optional<List<RadicalNumber>> closedFormRoots(Polynomial<RadicalNumber> p) {
        if (!p.coefficients().stream().allMatch(RadicalNumber::isReal)) {
            return Optional.empty();
        }
        List<RadicalNumber> roots = RealRootFinder.realRoots(p);
        return roots.size() == p.degree() ? Optional.of(roots) : Optional.empty();
    }

    @Override
    public String toString() {
        return "RadicalDomain";
    }
}
