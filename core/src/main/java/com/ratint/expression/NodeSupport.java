package com.ratint.expression;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Formatting precedence and multiset comparison shared by the node classes.
 */
final class NodeSupport {

    static final int SUM = 1;
    static final int PRODUCT = 2;
    static final int POWER = 3;
    static final int ATOM = 5;

    private NodeSupport() {}

    static int precedence(Expression e) {
        if (e instanceof Sum) return SUM;
        if (e instanceof Product) return PRODUCT;
        if (e instanceof Power) return POWER;
        if (e instanceof Constant c) {
            return (c.value().signum() < 0 || !c.value().isInteger()) ? PRODUCT : ATOM;
        }
        return ATOM;
    }

    static String wrap(Expression e, int minimum) {
        String text = e.format();
        return precedence(e) < minimum ? "(" + text + ")" : text;
    }

    /** Order-insensitive comparison of operand lists. */
    static boolean sameElements(List<Expression> a, List<Expression> b) {
        if (a.size() != b.size()) {
            return false;
        }
        Map<Expression, Integer> counts = new HashMap<>();
        for (Expression e : a) {
            counts.merge(e, 1, Integer::sum);
        }
        for (Expression e : b) {
            Integer count = counts.get(e);
            if (count == null || count == 0) {
                return false;
            }
            counts.put(e, count - 1);
        }
        return true;
    }

    static int unorderedHash(List<Expression> operands) {
        int hash = 0;
        for (Expression e : operands) {
            hash += e.hashCode();
        }
        return hash;
    }
}
