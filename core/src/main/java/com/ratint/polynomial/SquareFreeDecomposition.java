package com.ratint.polynomial;

import com.ratint.types.RingElement;
import java.util.List;

/**
 * Square-free factorization {@code f = content * Π factorᵢ^multiplicityᵢ}.
 *
 * <p>Every factor is monic, square-free, of positive degree, and the factors are
 * pairwise coprime. They are listed by increasing multiplicity.
 *
 * @param content the leading coefficient of the factored polynomial
 * @param factors the factors
 * @param <C> the coefficient type
 */
public record SquareFreeDecomposition<C extends RingElement<C>>(C content, List<Factor<C>> factors) {

    public SquareFreeDecomposition {
        factors = List.copyOf(factors);
    }

    /**
     * One factor and its multiplicity.
     *
     * @param polynomial the monic square-free factor
     * @param multiplicity the multiplicity, at least 1
     * @param <C> the coefficient type
     */
    public record Factor<C extends RingElement<C>>(Polynomial<C> polynomial, int multiplicity) {
    }
}
