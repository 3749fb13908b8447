package com.ratint.integration;

import com.ratint.exception.IntegrationInvariantException;
import com.ratint.expression.Symbol;
import com.ratint.polynomial.Polynomial;
import com.ratint.polynomial.Polynomials;
import com.ratint.polynomial.SquareFreeDecomposition;
import com.ratint.polynomial.Subresultants;
import com.ratint.types.FieldElement;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lazard-Rioboo-Trager algorithm for the logarithmic part of a rational integral.
 *
 * <p>For a proper fraction {@code f/g} with {@code g} square-free, the resultant
 * {@code R(t) = res_x(g, f - g't)} vanishes exactly at the residues of
 * {@code f/g}. Each square-free factor {@code qᵢ} of {@code R} with multiplicity
 * {@code i} pairs with the subresultant of degree {@code i}, made monic in x
 * modulo {@code qᵢ}:
 * <pre>
 *   ∫ f/g dx = Σᵢ Σ_{a : qᵢ(a) = 0} a * log(hᵢ(a, x))
 * </pre>
 * No algebraic numbers are introduced: every computation stays in {@code K[t]}.
 */
public final class LogarithmicPartExtractor {

    private static final Logger logger = LoggerFactory.getLogger(LogarithmicPartExtractor.class);

    private static final String STAGE = "log-part";

    private LogarithmicPartExtractor() {}

    /**
     * Computes the logarithmic part of {@code ∫ f/g dx}.
     *
     * @param f the numerator, {@code deg f < deg g}, coprime to {@code g}
     * @param g the square-free denominator
     * @param t the parameter variable of the result
     * @param <C> the coefficient field
     * @return the log terms
     * @throws IntegrationInvariantException if the subresultant sequence is inconsistent
     */
    public static <C extends FieldElement<C>> LogPart<C> extract(Polynomial<C> f, Polynomial<C> g, Symbol t) {
        if (g.isZero() || f.degree() >= g.degree()) {
            throw new IllegalArgumentException("Logarithmic part needs deg f < deg g, got " + f + " / " + g);
        }
        C zero = g.coefficientZero();
        Polynomial<C> zeroInT = Polynomial.zero(t, zero);
        Polynomial<C> tPolynomial = Polynomial.identity(t, zero.one());

        Polynomial<Polynomial<C>> a = g.mapCoefficients(c -> Polynomial.constant(t, c), zeroInT);
        Polynomial<Polynomial<C>> b = f.mapCoefficients(c -> Polynomial.constant(t, c), zeroInT)
            .subtract(g.derivative().mapCoefficients(c -> tPolynomial.scale(c), zeroInT));

        Subresultants.Sequence<Polynomial<C>> prs = Subresultants.sequence(a, b);
        Polynomial<C> resultant = Subresultants.resultant(a, b, prs);
        if (resultant.isZero()) {
            throw new IntegrationInvariantException(
                "Resultant of " + g + " and " + b + " vanishes; denominator is not square-free or not coprime", STAGE);
        }

        Map<Integer, Polynomial<Polynomial<C>>> byDegree = new HashMap<>();
        for (Polynomial<Polynomial<C>> member : prs.remainders()) {
            byDegree.put(member.degree(), member);
        }

        SquareFreeDecomposition<C> factorization = Polynomials.squareFree(resultant);
        List<LogTerm<C>> terms = new ArrayList<>();
        for (SquareFreeDecomposition.Factor<C> factor : factorization.factors()) {
            Polynomial<C> q = factor.polynomial();
            int i = factor.multiplicity();
            if (i == g.degree()) {
                terms.add(new LogTerm<>(a, q));
                continue;
            }
            Polynomial<Polynomial<C>> h = byDegree.get(i);
            if (h == null) {
                throw new IntegrationInvariantException(
                    "No subresultant of degree " + i + " for resultant factor " + q, STAGE);
            }
            h = removeContent(h, q);
            terms.add(new LogTerm<>(monicModulo(h, q), q));
        }
        logger.debug("Logarithmic part of {} / {}: {} terms", f, g, terms.size());
        return new LogPart<>(terms);
    }

    /**
     * Divides {@code h} by the factors of its leading coefficient that it shares
     * with {@code q}, as often as their multiplicity allows and the division is exact.
     */
    private static <C extends FieldElement<C>> Polynomial<Polynomial<C>> removeContent(
            Polynomial<Polynomial<C>> h, Polynomial<C> q) {
        Polynomial<C> lead = h.leadingCoefficient();
        if (lead.degree() <= 0) {
            return h;
        }
        for (SquareFreeDecomposition.Factor<C> factor : Polynomials.squareFree(lead).factors()) {
            Polynomial<C> common = Polynomials.gcd(factor.polynomial(), q);
            if (common.degree() <= 0) {
                continue;
            }
            for (int k = 0; k < factor.multiplicity() && dividesAll(common, h); k++) {
                h = h.exactQuotientByCoefficient(common);
            }
        }
        return h;
    }

    private static <C extends FieldElement<C>> boolean dividesAll(Polynomial<C> divisor, Polynomial<Polynomial<C>> h) {
        for (Polynomial<C> coefficient : h.coefficients()) {
            if (!Polynomials.remainder(coefficient, divisor).isZero()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Multiplies {@code h} by the inverse of its leading coefficient modulo
     * {@code q} and reduces every coefficient modulo {@code q}.
     */
    private static <C extends FieldElement<C>> Polynomial<Polynomial<C>> monicModulo(
            Polynomial<Polynomial<C>> h, Polynomial<C> q) {
        Polynomial<C> inverse;
        try {
            inverse = Polynomials.invert(h.leadingCoefficient(), q);
        } catch (ArithmeticException e) {
            throw new IntegrationInvariantException(
                "Leading coefficient " + h.leadingCoefficient() + " is not invertible modulo " + q, e, STAGE);
        }
        List<Polynomial<C>> coefficients = new ArrayList<>(h.degree() + 1);
        for (int k = 0; k < h.degree(); k++) {
            coefficients.add(Polynomials.remainder(inverse.multiply(h.coefficient(k)), q));
        }
        coefficients.add(q.one());
        return Polynomial.of(h.variable(), q.zero(), coefficients);
    }
}
