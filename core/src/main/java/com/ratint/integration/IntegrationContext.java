package com.ratint.integration;

import com.ratint.expression.Symbol;

/**
 * Per-call source of auxiliary symbols.
 *
 * <p>One context is created for every top-level integration call and threaded
 * through the algorithms. Every symbol it hands out is a dummy, equal only to
 * itself, so unknowns of one call can never collide with those of another call
 * or with the user's symbols, even when display names repeat.
 */
public final class IntegrationContext {

    private int counter;

    /**
     * Returns a new unknown named {@code prefix} followed by a per-call index.
     *
     * @param prefix the display prefix
     * @return a fresh dummy symbol
     */
    public Symbol fresh(String prefix) {
        return Symbol.dummy(prefix + counter++, false);
    }

    /**
     * Returns a new unknown that is assumed real.
     *
     * @param prefix the display prefix
     * @return a fresh real dummy symbol
     */
    public Symbol freshReal(String prefix) {
        return Symbol.dummy(prefix + counter++, true);
    }

    /**
     * Returns a new dummy displayed exactly as {@code name}, for bound variables
     * that appear in results.
     *
     * @param name the display name
     * @return a fresh dummy symbol
     */
    public Symbol parameter(String name) {
        counter++;
        return Symbol.dummy(name, false);
    }

    /**
     * Returns how many symbols this context has created.
     *
     * @return the symbol count
     */
    public int symbolCount() {
        return counter;
    }
}
