package com.ratint.integration;

import com.ratint.expression.Expression;
import com.ratint.types.FieldElement;
import java.util.Optional;

/**
 * Rewrites a logarithmic term as real logarithms and arctangents.
 *
 * @param <C> the coefficient field
 */
@FunctionalInterface
public interface RealLogConverter<C extends FieldElement<C>> {

    /**
     * Converts {@code term}, or reports that no certified real form was found.
     *
     * @param term the term to convert
     * @param context the per-call symbol source
     * @return the real form, or empty; never a partial result
     */
    Optional<Expression> convert(LogTerm<C> term, IntegrationContext context);
}
