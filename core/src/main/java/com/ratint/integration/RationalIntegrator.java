package com.ratint.integration;

import com.ratint.config.DomainMode;
import com.ratint.config.IntegrationOptions;
import com.ratint.domain.CoefficientDomain;
import com.ratint.domain.ParametricDomain;
import com.ratint.domain.RadicalDomain;
import com.ratint.domain.RationalFunctionConverter;
import com.ratint.exception.IntegrationInvariantException;
import com.ratint.exception.InvalidIntegrandException;
import com.ratint.expression.Constant;
import com.ratint.expression.Expression;
import com.ratint.expression.ExpressionUtils;
import com.ratint.expression.Expressions;
import com.ratint.expression.Sum;
import com.ratint.expression.Symbol;
import com.ratint.polynomial.DivisionResult;
import com.ratint.polynomial.Polynomial;
import com.ratint.polynomial.Polynomials;
import com.ratint.polynomial.RationalFunction;
import com.ratint.types.FieldElement;
import com.ratint.types.Rational;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes antiderivatives of rational functions.
 *
 * <p>The pipeline for {@code ∫ p/q dx}:
 * <ol>
 *   <li>reduce {@code p/q} to lowest terms and split off the polynomial part,
 *       which integrates termwise;</li>
 *   <li>{@link HermiteReducer} yields the rational part and a residual with
 *       square-free denominator;</li>
 *   <li>{@link LogarithmicPartExtractor} turns the residual into log terms
 *       indexed by the roots of polynomials in a parameter t;</li>
 *   <li>each log term is written with its single root substituted, as real
 *       logarithms and arctangents, or as a {@code RootSum}.</li>
 * </ol>
 *
 * <p>Coefficients are exact. Symbols other than x become parameters of nested
 * rational-function fields, so {@code 1/(x^2 + a)} is integrated over Q(a).
 *
 * <p>Instances are stateless and thread-safe; every call creates its own
 * {@link IntegrationContext}.
 *
 * <p>Example:
 * <pre>
 *   RationalIntegrator integrator = new RationalIntegrator();
 *   Symbol x = Symbol.of("x");
 *   Expression result = integrator.integrate(Constant.ONE,
 *       Expressions.add(Expressions.power(x, 2), Constant.ONE), x);
 *   // atan(x)
 * </pre>
 */
public final class RationalIntegrator {

    private static final Logger logger = LoggerFactory.getLogger(RationalIntegrator.class);

    /**
     * Integrates {@code f} with default options.
     *
     * @param f a rational function of {@code x}
     * @param x the integration variable
     * @return an antiderivative
     * @throws InvalidIntegrandException if {@code f} is not a rational function of {@code x}
     */
    public Expression integrate(Expression f, Symbol x) {
        return integrate(f, x, IntegrationOptions.defaults());
    }

    /**
     * Integrates {@code f}, given as a single expression that is split into
     * numerator and denominator during conversion.
     *
     * @param f a rational function of {@code x}
     * @param x the integration variable
     * @param options symbol name and output domain
     * @return an antiderivative
     * @throws InvalidIntegrandException if {@code f} is not a rational function of {@code x}
     */
    public Expression integrate(Expression f, Symbol x, IntegrationOptions options) {
        Objects.requireNonNull(f, "f must not be null");
        return integrate(f, Constant.ONE, x, options);
    }

    /**
     * Integrates {@code p/q} with default options.
     *
     * @param p the numerator
     * @param q the denominator
     * @param x the integration variable
     * @return an antiderivative
     * @throws InvalidIntegrandException if the input is invalid
     */
    public Expression integrate(Expression p, Expression q, Symbol x) {
        return integrate(p, q, x, IntegrationOptions.defaults());
    }

    /**
     * Integrates {@code p/q}.
     *
     * @param p the numerator, a polynomial or rational function of {@code x}
     * @param q the denominator, a nonzero polynomial or rational function of {@code x}
     * @param x the integration variable
     * @param options symbol name and output domain
     * @return an antiderivative whose derivative is {@code p/q}
     * @throws InvalidIntegrandException if {@code q} is zero or the input is not rational in {@code x}
     * @throws IntegrationInvariantException if an internal invariant fails
     */
    public Expression integrate(Expression p, Expression q, Symbol x, IntegrationOptions options) {
        Objects.requireNonNull(p, "p must not be null");
        Objects.requireNonNull(q, "q must not be null");
        Objects.requireNonNull(x, "x must not be null");
        Objects.requireNonNull(options, "options must not be null");

        boolean real = resolveReal(options.mode(), p, q, x);
        List<Symbol> parameters = parameters(p, q, x);
        logger.debug("Integrating ({}) / ({}) d{}: real={}, parameters={}", p, q, x, real, parameters);

        Request request = new Request(p, q, x, options, real, new IntegrationContext());
        return integrateOver(RadicalDomain.get(), parameters, request);
    }

    /** Inputs of one call, carried through the domain recursion. */
    private record Request(Expression p, Expression q, Symbol x, IntegrationOptions options,
                           boolean real, IntegrationContext context) {
    }

    private static boolean resolveReal(DomainMode mode, Expression p, Expression q, Symbol x) {
        return switch (mode) {
            case REAL -> true;
            case COMPLEX -> false;
            case AUTO -> ExpressionUtils.hasOnlyRealAtoms(p, x) && ExpressionUtils.hasOnlyRealAtoms(q, x);
        };
    }

    private static List<Symbol> parameters(Expression p, Expression q, Symbol x) {
        Set<Symbol> symbols = ExpressionUtils.freeSymbols(p);
        symbols.addAll(ExpressionUtils.freeSymbols(q));
        symbols.remove(x);
        List<Symbol> sorted = new ArrayList<>(symbols);
        sorted.sort(Comparator.comparing(Symbol::name));
        return sorted;
    }

    /** Wraps one parametric field per remaining parameter, then integrates. */
    private static <C extends FieldElement<C>> Expression integrateOver(
            CoefficientDomain<C> domain, List<Symbol> parameters, Request request) {
        if (!parameters.isEmpty()) {
            return integrateOver(new ParametricDomain<>(domain, parameters.get(0)),
                parameters.subList(1, parameters.size()), request);
        }
        RationalFunctionConverter<C> converter = new RationalFunctionConverter<>(domain, request.x());
        RationalFunction<C> numerator = converter.convert(request.p());
        RationalFunction<C> denominator = converter.convert(request.q());
        if (denominator.isZero()) {
            throw new InvalidIntegrandException("Integrand has a zero denominator",
                request.p().format() + " / " + request.q().format());
        }
        return integrateFunction(numerator.divide(denominator), domain, request);
    }

    private static <C extends FieldElement<C>> Expression integrateFunction(
            RationalFunction<C> f, CoefficientDomain<C> domain, Request request) {
        if (f.isZero()) {
            return Constant.ZERO;
        }
        // f is in lowest terms with monic denominator; c makes the numerator monic too
        C c = f.numerator().leadingCoefficient();
        Polynomial<C> numerator = Polynomials.monic(f.numerator());
        Polynomial<C> denominator = f.denominator();

        List<Expression> terms = new ArrayList<>();
        DivisionResult<C> division = Polynomials.divide(numerator, denominator);
        terms.add(integratePolynomial(division.quotient(), domain));
        Polynomial<C> proper = division.remainder();
        if (proper.isZero()) {
            return distribute(domain.toExpression(c), terms);
        }

        HermiteReduction<C> hermite = HermiteReducer.reduce(proper, denominator, request.context());
        terms.add(hermite.rationalPart().toExpression(domain::toExpression));
        RationalFunction<C> residual = hermite.logResidual();
        DivisionResult<C> residualDivision = Polynomials.divide(residual.numerator(), residual.denominator());
        terms.add(integratePolynomial(residualDivision.quotient(), domain));
        if (residualDivision.remainder().isZero()) {
            return distribute(domain.toExpression(c), terms);
        }

        Symbol t = request.context().parameter(request.options().symbolName());
        LogPart<C> logPart = LogarithmicPartExtractor.extract(
            residualDivision.remainder(), residual.denominator(), t);
        for (LogTerm<C> term : logPart.terms()) {
            terms.add(logTerm(term, domain, request));
        }
        return distribute(domain.toExpression(c), terms);
    }

    private static <C extends FieldElement<C>> Expression logTerm(
            LogTerm<C> term, CoefficientDomain<C> domain, Request request) {
        Polynomial<C> q = term.q();
        if (term.isLinear()) {
            return atRoots(term, List.of(q.constantTerm().negate().divide(q.leadingCoefficient())), domain);
        }
        if (request.real()) {
            Optional<RealLogConverter<C>> converter = realLogConverter(domain);
            if (converter.isPresent()) {
                Optional<Expression> converted = converter.get().convert(term, request.context());
                if (converted.isPresent()) {
                    return converted.get();
                }
            }
            logger.debug("No certified real form for log term over {}; using root sum", q);
        } else {
            Optional<List<C>> roots = domain.closedFormRoots(q);
            if (roots.isPresent()) {
                return atRoots(term, roots.get(), domain);
            }
        }
        return rootSum(term, domain);
    }

    /** Only numeric coefficients have a real form; parametric fields keep their root sums. */
    @SuppressWarnings("unchecked")
    private static <C extends FieldElement<C>> Optional<RealLogConverter<C>> realLogConverter(
            CoefficientDomain<C> domain) {
        if (domain instanceof RadicalDomain) {
            return Optional.of((RealLogConverter<C>) (RealLogConverter<?>) ComplexLogToReal.get());
        }
        return Optional.empty();
    }

    /** {@code Σ a*log(h(a, x))} over the given roots. */
    private static <C extends FieldElement<C>> Expression atRoots(
            LogTerm<C> term, List<C> roots, CoefficientDomain<C> domain) {
        C zero = domain.zero();
        List<Expression> terms = new ArrayList<>(roots.size());
        for (C root : roots) {
            Polynomial<C> argument = term.h().mapCoefficients(c -> c.evaluate(root), zero);
            terms.add(Expressions.multiply(domain.toExpression(root),
                Expressions.log(argument.toExpression(domain::toExpression))));
        }
        return Expressions.add(terms);
    }

    private static <C extends FieldElement<C>> Expression rootSum(LogTerm<C> term, CoefficientDomain<C> domain) {
        Symbol t = term.q().variable();
        List<Expression> coefficients = new ArrayList<>(term.q().degree() + 1);
        for (C coefficient : term.q().coefficients()) {
            coefficients.add(domain.toExpression(coefficient));
        }
        Expression argument = term.h().toExpression(c -> c.toExpression(domain::toExpression));
        return Expressions.rootSum(coefficients, t, Expressions.multiply(t, Expressions.log(argument)));
    }

    /** {@code Σ cₖ x^(k+1)/(k+1)}. */
    private static <C extends FieldElement<C>> Expression integratePolynomial(
            Polynomial<C> p, CoefficientDomain<C> domain) {
        if (p.isZero()) {
            return Constant.ZERO;
        }
        List<C> coefficients = new ArrayList<>(p.degree() + 2);
        coefficients.add(domain.zero());
        for (int k = 0; k <= p.degree(); k++) {
            coefficients.add(p.coefficient(k).multiply(domain.fromRational(Rational.of(1, k + 1))));
        }
        return Polynomial.of(p.variable(), domain.zero(), coefficients).toExpression(domain::toExpression);
    }

    /** Multiplies every term by {@code c}, so that no product of a constant and a sum remains. */
    private static Expression distribute(Expression c, List<Expression> terms) {
        List<Expression> scaled = new ArrayList<>(terms.size());
        for (Expression term : terms) {
            scaled.add(scale(c, term));
        }
        return Expressions.add(scaled);
    }

    private static Expression scale(Expression c, Expression term) {
        if (term instanceof Sum sum) {
            List<Expression> scaled = new ArrayList<>(sum.terms().size());
            for (Expression inner : sum.terms()) {
                scaled.add(scale(c, inner));
            }
            return Expressions.add(scaled);
        }
        return Expressions.multiply(c, term);
    }
}
