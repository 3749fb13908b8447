package com.ratint.integration;

import com.ratint.polynomial.RationalFunction;
import com.ratint.types.FieldElement;

/**
 * Result of Hermite reduction: {@code f/g = d/dx(rationalPart) + logResidual}, with
 * the denominator of {@code logResidual} square-free.
 *
 * @param rationalPart the integrated rational part, in lowest terms
 * @param logResidual the remaining proper fraction, in lowest terms
 * @param <C> the coefficient field
 */
public record HermiteReduction<C extends FieldElement<C>>(
        RationalFunction<C> rationalPart, RationalFunction<C> logResidual) {
}
