package com.ratint.integration;

import com.ratint.exception.IntegrationInvariantException;
import com.ratint.exception.UnsolvableSystemException;
import com.ratint.expression.Symbol;
import com.ratint.polynomial.MultivariatePolynomial;
import com.ratint.polynomial.Polynomial;
import com.ratint.polynomial.Polynomials;
import com.ratint.polynomial.RationalFunction;
import com.ratint.solver.LinearSolver;
import com.ratint.types.FieldElement;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hermite reduction in the Horowitz-Ostrogradsky formulation.
 *
 * <p>For a proper fraction {@code f/g} with {@code gcd(f, g) = 1}, write
 * {@code g = u*v} with {@code u = gcd(g, g')}. Then
 * <pre>
 *   f/g = d/dx(A/u) + B/v,    deg A &lt; deg u,  deg B &lt; deg v
 * </pre>
 * and {@code v} is square-free. The coefficients of {@code A} and {@code B} are
 * found by solving the linear system obtained from
 * <pre>
 *   f - A'v + A(u'v/u) - Bu = 0
 * </pre>
 * coefficient by coefficient in x; Hermite's theorem guarantees a unique solution.
 */
public final class HermiteReducer {

    private static final Logger logger = LoggerFactory.getLogger(HermiteReducer.class);

    private HermiteReducer() {}

    /**
     * Reduces {@code f/g}.
     *
     * @param f the numerator, {@code deg f < deg g}
     * @param g the denominator, coprime to {@code f}
     * @param context source of the unknown coefficients
     * @param <C> the coefficient field
     * @return the rational part and the residual with square-free denominator
     * @throws IllegalArgumentException if the preconditions do not hold
     * @throws IntegrationInvariantException if the linear system has no solution
     */
    public static <C extends FieldElement<C>> HermiteReduction<C> reduce(
            Polynomial<C> f, Polynomial<C> g, IntegrationContext context) {
        if (g.isZero() || f.degree() >= g.degree()) {
            throw new IllegalArgumentException("Hermite reduction needs deg f < deg g, got " + f + " / " + g);
        }
        if (Polynomials.gcd(f, g).degree() > 0) {
            throw new IllegalArgumentException("Hermite reduction needs coprime f and g, got " + f + " / " + g);
        }

        Symbol x = g.variable();
        C zero = g.coefficientZero();
        C one = zero.one();
        Polynomial<C> u = Polynomials.gcd(g, g.derivative());
        Polynomial<C> v = g.exactQuotient(u);
        int n = u.degree();
        int m = v.degree();

        if (n == 0) {
            logger.debug("Denominator is square-free; no rational part");
            return new HermiteReduction<>(RationalFunction.constant(x, zero), RationalFunction.of(f, g));
        }

        List<Symbol> unknowns = new ArrayList<>(n + m);
        for (int i = 0; i < n; i++) {
            unknowns.add(context.fresh("A"));
        }
        for (int j = 0; j < m; j++) {
            unknowns.add(context.fresh("B"));
        }
        logger.debug("Hermite reduction: deg u = {}, deg v = {}, {} unknowns", n, m, n + m);

        MultivariatePolynomial<C> ringZero = MultivariatePolynomial.zero(unknowns, zero);
        List<MultivariatePolynomial<C>> aCoefficients = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            aCoefficients.add(MultivariatePolynomial.variable(unknowns, i, one));
        }
        List<MultivariatePolynomial<C>> bCoefficients = new ArrayList<>(m);
        for (int j = 0; j < m; j++) {
            bCoefficients.add(MultivariatePolynomial.variable(unknowns, n + j, one));
        }
        Polynomial<MultivariatePolynomial<C>> a = Polynomial.of(x, ringZero, aCoefficients);
        Polynomial<MultivariatePolynomial<C>> b = Polynomial.of(x, ringZero, bCoefficients);

        Function<C, MultivariatePolynomial<C>> lift = c -> MultivariatePolynomial.constant(unknowns, c);
        Polynomial<C> w = u.derivative().multiply(v).exactQuotient(u);

        Polynomial<MultivariatePolynomial<C>> residual = f.mapCoefficients(lift, ringZero)
            .subtract(a.derivative().multiply(v.mapCoefficients(lift, ringZero)))
            .add(a.multiply(w.mapCoefficients(lift, ringZero)))
            .subtract(b.multiply(u.mapCoefficients(lift, ringZero)));

        Map<Symbol, C> solution;
        try {
            solution = LinearSolver.solve(residual.coefficients(), unknowns, zero);
        } catch (UnsolvableSystemException e) {
            throw new IntegrationInvariantException(
                "Hermite system for " + f + " / " + g + " has no solution", e, "hermite");
        }

        List<C> values = new ArrayList<>(solution.values());
        Polynomial<C> aSolved = Polynomial.of(x, zero, values.subList(0, n));
        Polynomial<C> bSolved = Polynomial.of(x, zero, values.subList(n, n + m));
        return new HermiteReduction<>(RationalFunction.of(aSolved, u), RationalFunction.of(bSolved, v));
    }
}
