package com.ratint.expression;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Utility methods for inspecting and rewriting expressions.
 */
public final class ExpressionUtils {

    private ExpressionUtils() {}

    /**
     * Returns true if {@code target} occurs anywhere in {@code e}.
     *
     * @param e the expression to search
     * @param target the subexpression to find
     * @return true if found
     */
    public static boolean contains(Expression e, Expression target) {
        if (e.equals(target)) {
            return true;
        }
        if (e instanceof RootSum rootSum && rootSum.variable().equals(target)) {
            return false;
        }
        for (Expression child : e.children()) {
            if (contains(child, target)) return true;
        }
        return false;
    }

    /**
     * Returns the symbols of {@code e} in order of first occurrence, excluding the
     * bound variables of root sums.
     *
     * @param e the expression
     * @return the free symbols
     */
    public static Set<Symbol> freeSymbols(Expression e) {
        Set<Symbol> symbols = new LinkedHashSet<>();
        collectFreeSymbols(e, symbols);
        return symbols;
    }

    private static void collectFreeSymbols(Expression e, Set<Symbol> symbols) {
        if (e instanceof Symbol s) {
            symbols.add(s);
            return;
        }
        if (e instanceof RootSum rootSum) {
            Set<Symbol> inner = new LinkedHashSet<>();
            for (Expression child : rootSum.children()) {
                collectFreeSymbols(child, inner);
            }
            inner.remove(rootSum.variable());
            symbols.addAll(inner);
            return;
        }
        for (Expression child : e.children()) {
            collectFreeSymbols(child, symbols);
        }
    }

    /**
     * Returns the leaves of {@code e}: constants, symbols and the imaginary unit.
     *
     * @param e the expression
     * @return the atoms in order of first occurrence
     */
    public static Set<Expression> atoms(Expression e) {
        Set<Expression> atoms = new LinkedHashSet<>();
        collectAtoms(e, atoms);
        return atoms;
    }

    private static void collectAtoms(Expression e, Set<Expression> atoms) {
        if (e.children().isEmpty()) {
            atoms.add(e);
            return;
        }
        for (Expression child : e.children()) {
            collectAtoms(child, atoms);
        }
    }

    /**
     * Replaces symbols by expressions and rebuilds through the simplifying factories.
     *
     * <p>The bound variable of a root sum is never replaced inside it.
     *
     * @param e the expression
     * @param replacements symbol to replacement
     * @return the rewritten expression
     */
    public static Expression substitute(Expression e, Map<Symbol, ? extends Expression> replacements) {
        if (replacements.isEmpty()) {
            return e;
        }
        if (e instanceof Symbol s) {
            Expression replacement = replacements.get(s);
            return replacement != null ? replacement : s;
        }
        if (e instanceof Constant || e instanceof ImaginaryUnit) {
            return e;
        }
        if (e instanceof Sum sum) {
            return Expressions.add(substituteAll(sum.terms(), replacements));
        }
        if (e instanceof Product product) {
            return Expressions.multiply(substituteAll(product.factors(), replacements));
        }
        if (e instanceof Power power) {
            return Expressions.power(substitute(power.base(), replacements),
                                     substitute(power.exponent(), replacements));
        }
        if (e instanceof Log log) {
            return Expressions.log(substitute(log.argument(), replacements));
        }
        if (e instanceof Atan atan) {
            return Expressions.atan(substitute(atan.argument(), replacements));
        }
        RootSum rootSum = (RootSum) e;
        Map<Symbol, ? extends Expression> inner = replacements;
        if (replacements.containsKey(rootSum.variable())) {
            Map<Symbol, Expression> copy = new HashMap<>(replacements);
            copy.remove(rootSum.variable());
            inner = copy;
        }
        return Expressions.rootSum(substituteAll(rootSum.coefficients(), inner),
                                   rootSum.variable(),
                                   substitute(rootSum.body(), inner));
    }

    private static List<Expression> substituteAll(List<Expression> operands,
                                                  Map<Symbol, ? extends Expression> replacements) {
        List<Expression> result = new ArrayList<>(operands.size());
        for (Expression operand : operands) {
            result.add(substitute(operand, replacements));
        }
        return result;
    }

    /**
     * Returns true if every atom of {@code e} other than {@code variable} is real.
     *
     * <p>The imaginary unit, symbols not assumed real, and non-integer powers of
     * negative constants count as non-real.
     *
     * @param e the expression
     * @param variable the integration variable, ignored
     * @return true if all constants and parameters of {@code e} are real
     */
    public static boolean hasOnlyRealAtoms(Expression e, Symbol variable) {
        if (e instanceof ImaginaryUnit) {
            return false;
        }
        if (e instanceof Symbol s) {
            return s.equals(variable) || s.isReal();
        }
        if (e instanceof Power power
                && power.base() instanceof Constant base && base.value().signum() < 0
                && !(power.exponent() instanceof Constant exponent && exponent.value().isInteger())) {
            return false;
        }
        for (Expression child : e.children()) {
            if (!hasOnlyRealAtoms(child, variable)) return false;
        }
        return true;
    }
}
