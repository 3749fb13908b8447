package com.ratint.polynomial;

import com.ratint.types.RingElement;

/**
 * Bezout coefficients: {@code s*a + t*b = gcd} with {@code gcd} monic.
 *
 * @param s the coefficient of the first argument
 * @param t the coefficient of the second argument
 * @param gcd the monic greatest common divisor
 * @param <C> the coefficient type
 */
public record ExtendedGcd<C extends RingElement<C>>(Polynomial<C> s, Polynomial<C> t, Polynomial<C> gcd) {
}
