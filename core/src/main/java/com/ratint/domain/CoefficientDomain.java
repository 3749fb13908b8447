package com.ratint.domain;

import com.ratint.expression.Expression;
import com.ratint.polynomial.Polynomial;
import com.ratint.types.FieldElement;
import com.ratint.types.Rational;
import java.util.List;
import java.util.Optional;

/**
 * A coefficient field together with its conversions to and from expressions.
 *
 * <p>The integration algorithms are generic in the field; the domain is what
 * ties a concrete field to the expression layer. Two kinds exist:
 * <ul>
 *   <li>{@link RadicalDomain} - exact numbers of Q(i, √2, √3, ...)</li>
 *   <li>{@link ParametricDomain} - rational functions of one symbolic parameter
 *       over another domain, nesting to any depth</li>
 * </ul>
 *
 * @param <C> the field element type
 */
public interface CoefficientDomain<C extends FieldElement<C>> {

    C zero();

    C one();

    C fromRational(Rational value);

    /**
     * Converts an expression that does not involve the integration variable.
     *
     * @param e the expression
     * @return the field element
     * @throws com.ratint.exception.InvalidIntegrandException if {@code e} has no
     *         representation in this field
     */
    C fromExpression(Expression e);

    Expression toExpression(C value);

    /**
     * Returns every root of the square-free polynomial {@code p} when all of them
     * have a closed form in this field.
     *
     * @param p a square-free polynomial of positive degree
     * @return the {@code deg p} roots, or empty
     */
    default Optional<List<C>> closedFormRoots(Polynomial<C> p) {
        return Optional.empty();
    }
}
