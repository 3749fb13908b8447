package com.ratint.expression;

import java.util.Collections;
import java.util.List;

/**
 * Sum of at least two terms.
 *
 * <p>Terms are never sums themselves, no two terms differ only by a rational
 * coefficient, and at most one term is a {@link Constant} (placed last).
 * Equality ignores term order.
 */
public final class Sum implements Expression {

    private final List<Expression> terms;

    Sum(List<Expression> terms) {
        if (terms.size() < 2) {
            throw new IllegalArgumentException("a sum needs at least two terms, got " + terms.size());
        }
        this.terms = Collections.unmodifiableList(terms);
    }

    public List<Expression> terms() {
        return terms;
    }

    @Override
    public List<Expression> children() {
        return terms;
    }

    @Override
    public String format() {
        StringBuilder sb = new StringBuilder();
        for (Expression term : terms) {
            if (sb.length() == 0) {
                sb.append(term.format());
            } else if (isNegative(term)) {
                sb.append(" - ").append(NodeSupport.wrap(Expressions.negate(term), NodeSupport.PRODUCT));
            } else {
                sb.append(" + ").append(NodeSupport.wrap(term, NodeSupport.PRODUCT));
            }
        }
        return sb.toString();
    }

    private static boolean isNegative(Expression term) {
        if (term instanceof Constant c) {
            return c.value().signum() < 0;
        }
        return term instanceof Product p
            && p.factors().get(0) instanceof Constant c
            && c.value().signum() < 0;
    }

    @Override
    public String toString() {
        return format();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Sum)) return false;
        return NodeSupport.sameElements(terms, ((Sum) obj).terms);
    }

    @Override
    public int hashCode() {
        return 31 * NodeSupport.unorderedHash(terms) + 1;
    }
}
