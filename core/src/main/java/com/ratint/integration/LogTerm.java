package com.ratint.integration;

import com.ratint.polynomial.Polynomial;
import com.ratint.types.FieldElement;
import java.util.Objects;

/**
 * One pair of a logarithmic part: the sum of {@code a*log(h(a, x))} over the roots
 * {@code a} of {@code q}.
 *
 * <p>{@code h} is a polynomial in x whose coefficients are polynomials in the
 * parameter t, the variable of {@code q}; it is monic in x.
 *
 * @param h the logarithm argument, in {@code K[t][x]}
 * @param q the square-free, monic annihilating polynomial, in {@code K[t]}
 * @param <C> the coefficient field
 */
public record LogTerm<C extends FieldElement<C>>(Polynomial<Polynomial<C>> h, Polynomial<C> q) {

    public LogTerm {
        Objects.requireNonNull(h, "h must not be null");
        Objects.requireNonNull(q, "q must not be null");
        if (q.degree() < 1) {
            throw new IllegalArgumentException("annihilating polynomial must have positive degree: " + q);
        }
    }

    /**
     * Returns true when {@code q} has a single root, so the term can be written
     * without a root sum.
     *
     * @return whether {@code q} is linear
     */
    public boolean isLinear() {
        return q.degree() == 1;
    }
}
