package com.ratint.expression;

import java.util.List;

/**
 * Sealed interface for all nodes of the symbolic expression tree.
 *
 * <p>The tree is what the integrator consumes and produces:
 * <ul>
 *   <li>Atoms: {@link Constant}, {@link Symbol}, {@link ImaginaryUnit}</li>
 *   <li>Arithmetic: {@link Sum}, {@link Product}, {@link Power}</li>
 *   <li>Elementary functions: {@link Log}, {@link Atan}</li>
 *   <li>Formal sums over polynomial roots: {@link RootSum}</li>
 * </ul>
 *
 * <p>Nodes are immutable and structurally shared. They are built through the
 * simplifying factories in {@link Expressions}, which keep sums and products
 * flat and fold constants; constructors are not public.
 */
public sealed interface Expression
    permits Constant, Symbol, ImaginaryUnit, Sum, Product, Power, Log, Atan, RootSum {

    /**
     * Returns the direct subexpressions of this node.
     *
     * <p>A {@link RootSum} reports its polynomial coefficients followed by its
     * body; the bound variable is not a child.
     *
     * @return the children, empty for atoms
     */
    List<Expression> children();

    /**
     * Returns a human-readable infix form, such as {@code -4*log(x + 1)}.
     *
     * @return the formatted expression
     */
    String format();
}
