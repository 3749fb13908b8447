package com.ratint.test;

import com.ratint.expression.Constant;
import com.ratint.expression.Expression;
import com.ratint.expression.Expressions;
import com.ratint.expression.Symbol;
import com.ratint.polynomial.Polynomial;
import com.ratint.types.RadicalNumber;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class for ratint tests: logging of test steps and small builders for
 * polynomials and expressions.
 */
public abstract class TestBase {

    protected final Logger logger = LoggerFactory.getLogger(getClass());

    protected static final Symbol X = Symbol.of("x");

    @BeforeEach
    void logTestName(TestInfo info) {
        logger.info("Running {}", info.getDisplayName());
    }

    protected void logStep(String step) {
        logger.info("  step: {}", step);
    }

    /** Polynomial in x over Q, coefficients from the constant term up. */
    protected static Polynomial<RadicalNumber> poly(long... coefficients) {
        return poly(X, coefficients);
    }

    protected static Polynomial<RadicalNumber> poly(Symbol variable, long... coefficients) {
        List<RadicalNumber> values = new ArrayList<>(coefficients.length);
        for (long c : coefficients) {
            values.add(RadicalNumber.of(c));
        }
        return Polynomial.of(variable, RadicalNumber.ZERO, values);
    }

    /** Expression {@code Σ cᵢ xⁱ}, coefficients from the constant term up. */
    protected static Expression expr(long... coefficients) {
        List<Expression> terms = new ArrayList<>(coefficients.length);
        for (int i = 0; i < coefficients.length; i++) {
            terms.add(Expressions.multiply(Constant.of(coefficients[i]), Expressions.power(X, i)));
        }
        return Expressions.add(terms);
    }
}
