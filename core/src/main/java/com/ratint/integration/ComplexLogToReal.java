package com.ratint.integration;

import com.ratint.domain.RadicalDomain;
import com.ratint.expression.Expression;
import com.ratint.expression.Expressions;
import com.ratint.expression.Symbol;
import com.ratint.polynomial.Polynomial;
import com.ratint.polynomial.Polynomials;
import com.ratint.polynomial.Subresultants;
import com.ratint.roots.ComplexRoot;
import com.ratint.roots.ComplexRootFinder;
import com.ratint.roots.RealRootFinder;
import com.ratint.types.RadicalNumber;
import com.ratint.types.Rational;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts {@code Σ_{a : q(a) = 0} a*log(h(a, x))} into real logarithms and
 * arctangents.
 *
 * <p>With {@code t = u + I*v}, split {@code q = C + I*D} and {@code h = A + I*B}
 * into real polynomials. The non-real roots of {@code q} are the common real
 * solutions {@code (u, v)} of {@code C = D = 0} with {@code v ≠ 0}; each
 * conjugate pair contributes
 * <pre>
 *   u*log(A² + B²) + v*(arctangent form of I*log((A + I*B)/(A - I*B)))
 * </pre>
 * and each real root {@code r} of {@code q} contributes {@code r*log(h(r, x))}.
 *
 * <p>When {@link ComplexRootFinder} solves {@code q} outright, the pairs
 * {@code (u, v)} are its roots. Otherwise they come from the real roots u of
 * {@code res_v(C, D)} and the common real roots v of {@code C(u, v)} and
 * {@code D(u, v)}. Every root set used on that path is certified complete. When
 * a closed form for some root is missing, the conversion gives up and returns
 * empty; the caller then keeps the root sum.
 */
public final class ComplexLogToReal implements RealLogConverter<RadicalNumber> {

    private static final Logger logger = LoggerFactory.getLogger(ComplexLogToReal.class);

    private static final ComplexLogToReal INSTANCE = new ComplexLogToReal();

    private ComplexLogToReal() {}

    public static ComplexLogToReal get() {
        return INSTANCE;
    }

    /**
     * Real and imaginary part of a polynomial evaluated at {@code u + I*v}, each a
     * polynomial in v with coefficients in {@code Q[u]}.
     */
    private record ComplexSplit(Polynomial<Polynomial<RadicalNumber>> real,
                                Polynomial<Polynomial<RadicalNumber>> imaginary) {
    }

    @Override
    public Optional<Expression> convert(LogTerm<RadicalNumber> term, IntegrationContext context) {
        Polynomial<Polynomial<RadicalNumber>> h = term.h();
        Polynomial<RadicalNumber> q = term.q();
        if (!isReal(q) || h.coefficients().stream().anyMatch(c -> !isReal(c))) {
            logger.debug("Log term over non-real coefficients; keeping root sum for {}", q);
            return Optional.empty();
        }

        Symbol u = context.freshReal("u");
        Symbol v = context.freshReal("v");
        ComplexSplit qSplit = split(q, u, v);
        List<ComplexSplit> hSplit = new ArrayList<>(h.degree() + 1);
        for (Polynomial<RadicalNumber> coefficient : h.coefficients()) {
            hSplit.add(split(coefficient, u, v));
        }

        Optional<List<ComplexRoot>> roots = ComplexRootFinder.roots(q);
        if (roots.isPresent()) {
            List<Expression> terms = new ArrayList<>();
            for (ComplexRoot root : roots.get()) {
                if (root.isReal()) {
                    terms.add(realRootTerm(h, root.real()));
                } else if (root.imaginary().signum() > 0) {
                    terms.addAll(conjugatePairTerms(hSplit, root.real(), root.imaginary(), h.variable()));
                }
            }
            logger.debug("Converted log term over {} from its {} closed-form roots", q, roots.get().size());
            return Optional.of(Expressions.add(terms));
        }
        return fromResultant(h, q, qSplit, hSplit);
    }

    /** Finds the real and imaginary parts of the roots through {@code res_v(C, D)}. */
    private static Optional<Expression> fromResultant(Polynomial<Polynomial<RadicalNumber>> h,
            Polynomial<RadicalNumber> q, ComplexSplit qSplit, List<ComplexSplit> hSplit) {
        Polynomial<RadicalNumber> resultant = Subresultants.resultant(qSplit.real(), qSplit.imaginary());
        if (resultant.isZero()) {
            logger.debug("Resultant of the real and imaginary parts of {} vanishes", q);
            return Optional.empty();
        }
        Optional<List<RadicalNumber>> realParts = RealRootFinder.certifiedRealRoots(resultant);
        if (realParts.isEmpty()) {
            return Optional.empty();
        }

        List<Expression> terms = new ArrayList<>();
        for (RadicalNumber ru : realParts.get()) {
            Polynomial<RadicalNumber> cSlice = atFirst(qSplit.real(), ru);
            Polynomial<RadicalNumber> dSlice = atFirst(qSplit.imaginary(), ru);
            if (cSlice.isZero() && dSlice.isZero()) {
                logger.debug("Both parts of {} vanish at u = {}", q, ru);
                return Optional.empty();
            }
            // the imaginary parts at u = ru are the common real roots of C(ru, v) and D(ru, v)
            Polynomial<RadicalNumber> slice = cSlice.isZero() ? dSlice
                : dSlice.isZero() ? cSlice : Polynomials.gcd(cSlice, dSlice);
            Optional<List<RadicalNumber>> imaginaryParts = RealRootFinder.certifiedRealRoots(slice);
            if (imaginaryParts.isEmpty()) {
                return Optional.empty();
            }
            for (RadicalNumber rv : imaginaryParts.get()) {
                if (rv.signum() <= 0 || !cSlice.evaluate(rv).isZero() || !dSlice.evaluate(rv).isZero()) {
                    continue;
                }
                terms.addAll(conjugatePairTerms(hSplit, ru, rv, h.variable()));
            }
        }

        Optional<List<RadicalNumber>> realRoots = RealRootFinder.certifiedRealRoots(q);
        if (realRoots.isEmpty()) {
            return Optional.empty();
        }
        for (RadicalNumber r : realRoots.get()) {
            terms.add(realRootTerm(h, r));
        }
        logger.debug("Converted log term over {} into {} real terms", q, terms.size());
        return Optional.of(Expressions.add(terms));
    }

    /** {@code u*log(A^2 + B^2) + v*atan-form(A, B)} for the pair {@code u ± I*v}. */
    private static List<Expression> conjugatePairTerms(
            List<ComplexSplit> hSplit, RadicalNumber ru, RadicalNumber rv, Symbol x) {
        RadicalDomain domain = RadicalDomain.get();
        Polynomial<RadicalNumber> a = atPoint(hSplit, ComplexSplit::real, ru, rv, x);
        Polynomial<RadicalNumber> b = atPoint(hSplit, ComplexSplit::imaginary, ru, rv, x);
        List<Expression> terms = new ArrayList<>(2);
        Expression modulus = a.multiply(a).add(b.multiply(b)).toExpression(domain::toExpression);
        terms.add(Expressions.multiply(domain.toExpression(ru), Expressions.log(modulus)));
        if (!b.isZero()) {
            terms.add(Expressions.multiply(domain.toExpression(rv), ComplexLogToArctan.convert(a, b, domain)));
        }
        return terms;
    }

    private static Expression realRootTerm(Polynomial<Polynomial<RadicalNumber>> h, RadicalNumber r) {
        RadicalDomain domain = RadicalDomain.get();
        Polynomial<RadicalNumber> atRoot = h.mapCoefficients(c -> c.evaluate(r), RadicalNumber.ZERO);
        return Expressions.multiply(domain.toExpression(r), Expressions.log(atRoot.toExpression(domain::toExpression)));
    }

    private static boolean isReal(Polynomial<RadicalNumber> p) {
        return p.coefficients().stream().allMatch(RadicalNumber::isReal);
    }

    /**
     * Expands {@code p(u + I*v) = Σ pₖ Σⱼ binom(k, j) u^(k-j) (I*v)^j}.
     */
    private static ComplexSplit split(Polynomial<RadicalNumber> p, Symbol u, Symbol v) {
        int size = Math.max(p.degree(), 0) + 1;
        Polynomial<RadicalNumber> zeroInU = Polynomial.zero(u, RadicalNumber.ZERO);
        List<Polynomial<RadicalNumber>> real = new ArrayList<>(Collections.nCopies(size, zeroInU));
        List<Polynomial<RadicalNumber>> imaginary = new ArrayList<>(Collections.nCopies(size, zeroInU));
        for (int k = 0; k <= p.degree(); k++) {
            RadicalNumber pk = p.coefficient(k);
            if (pk.isZero()) continue;
            BigInteger binomial = BigInteger.ONE;
            for (int j = 0; j <= k; j++) {
                Polynomial<RadicalNumber> monomial =
                    Polynomial.monomial(u, pk.scale(Rational.of(binomial)), k - j);
                switch (j % 4) {
                    case 0 -> real.set(j, real.get(j).add(monomial));
                    case 1 -> imaginary.set(j, imaginary.get(j).add(monomial));
                    case 2 -> real.set(j, real.get(j).subtract(monomial));
                    default -> imaginary.set(j, imaginary.get(j).subtract(monomial));
                }
                binomial = binomial.multiply(BigInteger.valueOf(k - j)).divide(BigInteger.valueOf(j + 1));
            }
        }
        return new ComplexSplit(Polynomial.of(v, zeroInU, real), Polynomial.of(v, zeroInU, imaginary));
    }

    /** Substitutes {@code u = ru}, leaving a polynomial in v. */
    private static Polynomial<RadicalNumber> atFirst(Polynomial<Polynomial<RadicalNumber>> p, RadicalNumber ru) {
        return p.mapCoefficients(c -> c.evaluate(ru), RadicalNumber.ZERO);
    }

    /** Evaluates one part of every x-coefficient of h at {@code (ru, rv)}. */
    private static Polynomial<RadicalNumber> atPoint(
            List<ComplexSplit> splits, Function<ComplexSplit, Polynomial<Polynomial<RadicalNumber>>> part,
            RadicalNumber ru, RadicalNumber rv, Symbol x) {
        List<RadicalNumber> coefficients = new ArrayList<>(splits.size());
        for (ComplexSplit split : splits) {
            coefficients.add(atFirst(part.apply(split), ru).evaluate(rv));
        }
        return Polynomial.of(x, RadicalNumber.ZERO, coefficients);
    }
}
