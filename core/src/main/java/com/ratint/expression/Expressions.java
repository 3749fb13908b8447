package com.ratint.expression;

import com.ratint.types.RadicalNumber;
import com.ratint.types.Rational;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Simplifying factories for expression nodes.
 *
 * <p>Every node is built here. The factories apply a fixed set of local
 * rewrites and nothing else:
 * <ul>
 *   <li>nested sums and products are flattened</li>
 *   <li>rational constants are folded; like terms {@code c1*e + c2*e} merge</li>
 *   <li>equal bases in a product add their exponents; {@code I^2 = -1}</li>
 *   <li>a constant times a single sum is distributed</li>
 *   <li>square roots of rationals are reduced ({@code sqrt(8) = 2*sqrt(2)})</li>
 *   <li>{@code log(1) = 0}, {@code atan(0) = 0}</li>
 * </ul>
 */
public final class Expressions {

    private Expressions() {}

    public static Constant constant(long value) {
        return Constant.of(value);
    }

    public static Constant constant(Rational value) {
        return Constant.of(value);
    }

    // ==================== Sums ====================

    public static Expression add(Expression... terms) {
        return add(Arrays.asList(terms));
    }

    public static Expression add(List<Expression> terms) {
        Rational constant = Rational.ZERO;
        Map<Expression, Rational> coefficients = new LinkedHashMap<>();
        for (Expression term : flatten(terms, Sum.class)) {
            if (term instanceof Constant c) {
                constant = constant.add(c.value());
                continue;
            }
            Rational coefficient = Rational.ONE;
            Expression rest = term;
            if (term instanceof Product p && p.factors().get(0) instanceof Constant c) {
                coefficient = c.value();
                List<Expression> others = p.factors().subList(1, p.factors().size());
                rest = others.size() == 1 ? others.get(0) : new Product(new ArrayList<>(others));
            }
            coefficients.merge(rest, coefficient, Rational::add);
        }

        List<Expression> result = new ArrayList<>();
        for (Map.Entry<Expression, Rational> e : coefficients.entrySet()) {
            if (!e.getValue().isZero()) {
                result.add(scaled(e.getValue(), e.getKey()));
            }
        }
        if (!constant.isZero()) {
            result.add(Constant.of(constant));
        }
        if (result.isEmpty()) return Constant.ZERO;
        if (result.size() == 1) return result.get(0);
        return new Sum(result);
    }

    /** {@code coefficient * rest} for a coefficient-free {@code rest}. */
    private static Expression scaled(Rational coefficient, Expression rest) {
        if (coefficient.isOne()) {
            return rest;
        }
        List<Expression> factors = new ArrayList<>();
        factors.add(Constant.of(coefficient));
        if (rest instanceof Product p) {
            factors.addAll(p.factors());
        } else {
            factors.add(rest);
        }
        return new Product(factors);
    }

    public static Expression negate(Expression e) {
        return multiply(Constant.MINUS_ONE, e);
    }

    public static Expression subtract(Expression a, Expression b) {
        return add(a, negate(b));
    }

    // ==================== Products ====================

    public static Expression multiply(Expression... factors) {
        return multiply(Arrays.asList(factors));
    }

    public static Expression multiply(List<Expression> factors) {
        Rational constant = Rational.ONE;
        int imaginary = 0;
        Map<Expression, Expression> exponents = new LinkedHashMap<>();
        Map<Expression, Expression> originals = new LinkedHashMap<>();
        for (Expression factor : flatten(factors, Product.class)) {
            if (factor instanceof Constant c) {
                constant = constant.multiply(c.value());
                continue;
            }
            if (factor instanceof ImaginaryUnit) {
                imaginary++;
                continue;
            }
            Expression base = factor;
            Expression exponent = Constant.ONE;
            if (factor instanceof Power p) {
                base = p.base();
                exponent = p.exponent();
            }
            if (exponents.containsKey(base)) {
                exponents.put(base, add(exponents.get(base), exponent));
                originals.put(base, null);
            } else {
                exponents.put(base, exponent);
                originals.put(base, factor);
            }
        }
        if (constant.isZero()) {
            return Constant.ZERO;
        }

        List<Expression> rest = new ArrayList<>();
        for (Map.Entry<Expression, Expression> e : exponents.entrySet()) {
            Expression original = originals.get(e.getKey());
            Expression merged = original != null ? original : power(e.getKey(), e.getValue());
            List<Expression> parts = merged instanceof Product p ? p.factors() : List.of(merged);
            for (Expression part : parts) {
                if (part instanceof Constant c) {
                    constant = constant.multiply(c.value());
                } else if (part instanceof ImaginaryUnit) {
                    imaginary++;
                } else {
                    rest.add(part);
                }
            }
        }

        switch (imaginary % 4) {
            case 1 -> rest.add(0, ImaginaryUnit.get());
            case 2 -> constant = constant.negate();
            case 3 -> {
                constant = constant.negate();
                rest.add(0, ImaginaryUnit.get());
            }
            default -> { }
        }

        if (constant.isZero()) return Constant.ZERO;
        if (rest.isEmpty()) return Constant.of(constant);
        if (rest.size() == 1) {
            Expression only = rest.get(0);
            if (constant.isOne()) {
                return only;
            }
            if (only instanceof Sum s) {
                List<Expression> distributed = new ArrayList<>(s.terms().size());
                Constant c = Constant.of(constant);
                for (Expression term : s.terms()) {
                    distributed.add(multiply(c, term));
                }
                return add(distributed);
            }
        }
        List<Expression> all = new ArrayList<>(rest.size() + 1);
        if (!constant.isOne()) {
            all.add(Constant.of(constant));
        }
        all.addAll(rest);
        return new Product(all);
    }

    public static Expression divide(Expression numerator, Expression denominator) {
        return multiply(numerator, power(denominator, Constant.MINUS_ONE));
    }

    // ==================== Powers ====================

    public static Expression power(Expression base, long exponent) {
        return power(base, Constant.of(exponent));
    }

    public static Expression power(Expression base, Expression exponent) {
        if (exponent instanceof Constant e) {
            Rational k = e.value();
            if (k.isZero()) return Constant.ONE;
            if (k.isOne()) return base;
            if (base instanceof Constant b) {
                return constantPower(b.value(), k);
            }
            if (k.isInteger()) {
                if (base instanceof ImaginaryUnit) {
                    return switch (k.numerator().mod(BigInteger.valueOf(4)).intValue()) {
                        case 0 -> Constant.ONE;
                        case 1 -> base;
                        case 2 -> Constant.MINUS_ONE;
                        default -> new Product(List.of(Constant.MINUS_ONE, base));
                    };
                }
                if (base instanceof Power p) {
                    return power(p.base(), multiply(p.exponent(), e));
                }
                if (base instanceof Product p) {
                    List<Expression> powered = new ArrayList<>(p.factors().size());
                    for (Expression factor : p.factors()) {
                        powered.add(power(factor, e));
                    }
                    return multiply(powered);
                }
            }
        }
        if (base instanceof Constant b && b.isOne()) {
            return Constant.ONE;
        }
        return new Power(base, exponent);
    }

    private static Expression constantPower(Rational base, Rational exponent) {
        if (base.isZero()) {
            if (exponent.signum() < 0) {
                throw new ArithmeticException("Zero raised to negative power " + exponent);
            }
            return Constant.ZERO;
        }
        if (base.isOne()) {
            return Constant.ONE;
        }
        if (exponent.isInteger()) {
            return Constant.of(base.power(exponent.numerator().intValueExact()));
        }
        if (exponent.denominator().equals(BigInteger.TWO)) {
            // base^(n/2) = base^((n-1)/2) * sqrt(base)
            int whole = exponent.numerator().subtract(BigInteger.ONE)
                .divide(BigInteger.TWO).intValueExact();
            return multiply(Constant.of(base.power(whole)), rationalSquareRoot(base));
        }
        return new Power(Constant.of(base), Constant.of(exponent));
    }

    private static Expression rationalSquareRoot(Rational value) {
        Optional<RadicalNumber> root = RadicalNumber.sqrt(value);
        if (root.isEmpty()) {
            Expression unreduced = new Power(Constant.of(value.abs()), Constant.HALF);
            return value.signum() < 0 ? multiply(ImaginaryUnit.get(), unreduced) : unreduced;
        }
        RadicalNumber.Term term = root.get().terms().get(0);
        List<Expression> factors = new ArrayList<>();
        factors.add(Constant.of(term.coefficient()));
        if (term.imaginary()) {
            factors.add(ImaginaryUnit.get());
        }
        if (!term.radicand().equals(BigInteger.ONE)) {
            factors.add(new Power(Constant.of(Rational.of(term.radicand())), Constant.HALF));
        }
        return multiply(factors);
    }

    public static Expression sqrt(Expression e) {
        return power(e, Constant.HALF);
    }

    // ==================== Functions ====================

    public static Expression log(Expression argument) {
        if (argument instanceof Constant c && c.isOne()) {
            return Constant.ZERO;
        }
        return new Log(argument);
    }

    public static Expression atan(Expression argument) {
        if (argument instanceof Constant c && c.isZero()) {
            return Constant.ZERO;
        }
        return new Atan(argument);
    }

    /**
     * Creates {@code Σ body(a)} over the roots {@code a} of the polynomial with the
     * given coefficients (lowest degree first) in {@code variable}.
     *
     * @param coefficients the polynomial coefficients, free of {@code variable}
     * @param variable the bound variable
     * @param body the summand
     * @return the root sum, or zero when the body is zero
     */
    public static Expression rootSum(List<Expression> coefficients, Symbol variable, Expression body) {
        if (body instanceof Constant c && c.isZero()) {
            return Constant.ZERO;
        }
        return new RootSum(coefficients, variable, body);
    }

    /**
     * Builds {@code Σ cᵢ·variableⁱ}, highest degree first.
     *
     * @param coefficients the coefficients, lowest degree first
     * @param variable the variable
     * @return the polynomial expression
     */
    public static Expression polynomial(List<Expression> coefficients, Expression variable) {
        List<Expression> terms = new ArrayList<>(coefficients.size());
        for (int i = coefficients.size() - 1; i >= 0; i--) {
            terms.add(multiply(coefficients.get(i), power(variable, i)));
        }
        return add(terms);
    }

    private static List<Expression> flatten(List<Expression> operands, Class<? extends Expression> kind) {
        List<Expression> flat = new ArrayList<>(operands.size());
        for (Expression operand : operands) {
            if (kind.isInstance(operand)) {
                flat.addAll(operand.children());
            } else {
                flat.add(operand);
            }
        }
        return flat;
    }
}
