package com.ratint.polynomial;

import com.ratint.expression.Expression;
import com.ratint.expression.Expressions;
import com.ratint.expression.Symbol;
import com.ratint.types.FieldElement;
import com.ratint.types.RingElement;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Sparse polynomial over a field in a fixed, ordered list of symbols.
 *
 * <p>Used as the coefficient ring of the Hermite reduction, where the symbols
 * are the unknown coefficients of the generic numerator polynomials. All
 * operands of a binary operation must share the same symbol list.
 *
 * @param <C> the coefficient field
 */
public final class MultivariatePolynomial<C extends FieldElement<C>>
        implements RingElement<MultivariatePolynomial<C>> {

    private static final Comparator<List<Integer>> EXPONENT_ORDER = (a, b) -> {
        for (int i = 0; i < a.size(); i++) {
            int cmp = Integer.compare(a.get(i), b.get(i));
            if (cmp != 0) return cmp;
        }
        return 0;
    };

    private final List<Symbol> symbols;
    private final C coefficientZero;
    private final TreeMap<List<Integer>, C> terms;

    private MultivariatePolynomial(List<Symbol> symbols, C coefficientZero, TreeMap<List<Integer>, C> terms) {
        this.symbols = symbols;
        this.coefficientZero = coefficientZero;
        this.terms = terms;
    }

    public static <C extends FieldElement<C>> MultivariatePolynomial<C> zero(List<Symbol> symbols, C zero) {
        return new MultivariatePolynomial<>(List.copyOf(symbols), zero, new TreeMap<>(EXPONENT_ORDER));
    }

    public static <C extends FieldElement<C>> MultivariatePolynomial<C> constant(List<Symbol> symbols, C value) {
        MultivariatePolynomial<C> result = zero(symbols, value.zero());
        if (!value.isZero()) {
            result.terms.put(zeroExponents(symbols.size()), value);
        }
        return result;
    }

    /**
     * Returns the polynomial consisting of the {@code index}-th symbol.
     *
     * @param symbols the symbol list
     * @param index position of the symbol
     * @param one the one of the coefficient field
     * @param <C> the coefficient field
     * @return the symbol as a polynomial
     */
    public static <C extends FieldElement<C>> MultivariatePolynomial<C> variable(List<Symbol> symbols, int index, C one) {
        Objects.checkIndex(index, symbols.size());
        MultivariatePolynomial<C> result = zero(symbols, one.zero());
        List<Integer> exponents = new ArrayList<>(zeroExponents(symbols.size()));
        exponents.set(index, 1);
        result.terms.put(List.copyOf(exponents), one);
        return result;
    }

    private static List<Integer> zeroExponents(int size) {
        return List.copyOf(Collections.nCopies(size, 0));
    }

    public List<Symbol> symbols() {
        return symbols;
    }

    /**
     * Returns the total degree, or -1 for zero.
     */
    public int totalDegree() {
        int degree = -1;
        for (List<Integer> exponents : terms.keySet()) {
            degree = Math.max(degree, exponents.stream().mapToInt(Integer::intValue).sum());
        }
        return degree;
    }

    public C constantTerm() {
        return terms.getOrDefault(zeroExponents(symbols.size()), coefficientZero);
    }

    /**
     * Returns the coefficient of the degree-one monomial in the {@code index}-th symbol.
     */
    public C linearCoefficient(int index) {
        List<Integer> exponents = new ArrayList<>(zeroExponents(symbols.size()));
        exponents.set(index, 1);
        return terms.getOrDefault(exponents, coefficientZero);
    }

    /**
     * Evaluates with every symbol replaced by the value at the same position.
     *
     * @param values one value per symbol
     * @return the value
     */
    public C evaluate(List<C> values) {
        if (values.size() != symbols.size()) {
            throw new IllegalArgumentException(
                "expected " + symbols.size() + " values, got " + values.size());
        }
        C result = coefficientZero;
        for (Map.Entry<List<Integer>, C> term : terms.entrySet()) {
            C monomial = term.getValue();
            List<Integer> exponents = term.getKey();
            for (int i = 0; i < exponents.size(); i++) {
                if (exponents.get(i) > 0) {
                    monomial = monomial.multiply(values.get(i).pow(exponents.get(i)));
                }
            }
            result = result.add(monomial);
        }
        return result;
    }

    // ==================== Ring Operations ====================

    @Override
    public MultivariatePolynomial<C> add(MultivariatePolynomial<C> other) {
        checkSymbols(other);
        if (other.isZero()) return this;
        if (isZero()) return other;
        TreeMap<List<Integer>, C> sum = new TreeMap<>(terms);
        other.terms.forEach((exponents, c) -> accumulate(sum, exponents, c));
        return new MultivariatePolynomial<>(symbols, coefficientZero, sum);
    }

    @Override
    public MultivariatePolynomial<C> multiply(MultivariatePolynomial<C> other) {
        checkSymbols(other);
        TreeMap<List<Integer>, C> product = new TreeMap<>(EXPONENT_ORDER);
        for (Map.Entry<List<Integer>, C> a : terms.entrySet()) {
            for (Map.Entry<List<Integer>, C> b : other.terms.entrySet()) {
                List<Integer> exponents = new ArrayList<>(symbols.size());
                for (int i = 0; i < symbols.size(); i++) {
                    exponents.add(a.getKey().get(i) + b.getKey().get(i));
                }
                accumulate(product, List.copyOf(exponents), a.getValue().multiply(b.getValue()));
            }
        }
        return new MultivariatePolynomial<>(symbols, coefficientZero, product);
    }

    private static <C extends FieldElement<C>> void accumulate(TreeMap<List<Integer>, C> terms,
                                                               List<Integer> exponents, C value) {
        C existing = terms.get(exponents);
        C updated = existing == null ? value : existing.add(value);
        if (updated.isZero()) {
            terms.remove(exponents);
        } else {
            terms.put(exponents, updated);
        }
    }

    @Override
    public MultivariatePolynomial<C> multiply(long factor) {
        return mapCoefficients(c -> c.multiply(factor));
    }

    @Override
    public MultivariatePolynomial<C> negate() {
        return mapCoefficients(C::negate);
    }

    /**
     * Divides by a constant polynomial.
     *
     * @throws ArithmeticException if the divisor is zero or not constant
     */
    @Override
    public MultivariatePolynomial<C> exactQuotient(MultivariatePolynomial<C> divisor) {
        if (divisor.totalDegree() != 0) {
            throw new ArithmeticException("Multivariate division is only supported by nonzero constants, got " + divisor);
        }
        C inverse = divisor.constantTerm().inverse();
        return mapCoefficients(c -> c.multiply(inverse));
    }

    private MultivariatePolynomial<C> mapCoefficients(Function<C, C> f) {
        TreeMap<List<Integer>, C> mapped = new TreeMap<>(EXPONENT_ORDER);
        terms.forEach((exponents, c) -> {
            C value = f.apply(c);
            if (!value.isZero()) mapped.put(exponents, value);
        });
        return new MultivariatePolynomial<>(symbols, coefficientZero, mapped);
    }

    @Override
    public boolean isZero() {
        return terms.isEmpty();
    }

    @Override
    public boolean isOne() {
        return totalDegree() == 0 && constantTerm().isOne();
    }

    @Override
    public MultivariatePolynomial<C> zero() {
        return zero(symbols, coefficientZero);
    }

    @Override
    public MultivariatePolynomial<C> one() {
        return constant(symbols, coefficientZero.one());
    }

    private void checkSymbols(MultivariatePolynomial<C> other) {
        if (!symbols.equals(other.symbols)) {
            throw new IllegalArgumentException("Polynomials over different symbols: " + symbols + " and " + other.symbols);
        }
    }

    /**
     * Converts to an expression in the symbols.
     */
    public Expression toExpression(Function<C, Expression> coefficientToExpression) {
        List<Expression> monomials = new ArrayList<>(terms.size());
        for (Map.Entry<List<Integer>, C> term : terms.descendingMap().entrySet()) {
            List<Expression> factors = new ArrayList<>();
            factors.add(coefficientToExpression.apply(term.getValue()));
            for (int i = 0; i < symbols.size(); i++) {
                factors.add(Expressions.power(symbols.get(i), term.getKey().get(i)));
            }
            monomials.add(Expressions.multiply(factors));
        }
        return Expressions.add(monomials);
    }

    // ==================== Object ====================

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof MultivariatePolynomial)) return false;
        MultivariatePolynomial<?> that = (MultivariatePolynomial<?>) obj;
        return symbols.equals(that.symbols) && terms.equals(that.terms);
    }

    @Override
    public int hashCode() {
        return Objects.hash(symbols, terms);
    }

    @Override
    public String toString() {
        if (isZero()) {
            return "0";
        }
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<List<Integer>, C> term : terms.descendingMap().entrySet()) {
            if (sb.length() > 0) sb.append(" + ");
            sb.append("(").append(term.getValue()).append(")");
            for (int i = 0; i < symbols.size(); i++) {
                int e = term.getKey().get(i);
                if (e == 0) continue;
                sb.append("*").append(symbols.get(i));
                if (e > 1) sb.append("^").append(e);
            }
        }
        return sb.toString();
    }
}
