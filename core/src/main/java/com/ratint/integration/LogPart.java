package com.ratint.integration;

import com.ratint.types.FieldElement;
import java.util.List;

/**
 * Transcendental part of an antiderivative: the sum of all its {@link LogTerm}s.
 *
 * @param terms the terms, in order of increasing resultant multiplicity
 * @param <C> the coefficient field
 */
public record LogPart<C extends FieldElement<C>>(List<LogTerm<C>> terms) {

    public LogPart {
        terms = List.copyOf(terms);
    }

    public boolean isEmpty() {
        return terms.isEmpty();
    }
}
