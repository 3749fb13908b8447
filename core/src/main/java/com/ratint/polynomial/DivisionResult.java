package com.ratint.polynomial;

import com.ratint.types.RingElement;

/**
 * Quotient and remainder of a polynomial division: {@code dividend = quotient * divisor + remainder}
 * with {@code deg remainder < deg divisor}.
 *
 * @param quotient the quotient
 * @param remainder the remainder
 * @param <C> the coefficient type
 */
public record DivisionResult<C extends RingElement<C>>(Polynomial<C> quotient, Polynomial<C> remainder) {
}
