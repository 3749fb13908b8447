package com.ratint.expression;

import java.util.List;
import java.util.Objects;

/**
 * Named symbol.
 *
 * <p>User symbols are equal when their names and realness agree. Dummy symbols,
 * created for auxiliary unknowns and bound variables, are equal only to
 * themselves: two dummies with the same name never collide.
 *
 * <p>Realness is an assumption: {@link #real(String)} declares a symbol that
 * only takes real values, {@link #of(String)} makes no such claim.
 */
public final class Symbol implements Expression {

    private final String name;
    private final boolean real;
    private final boolean dummy;

    private Symbol(String name, boolean real, boolean dummy) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        this.real = real;
        this.dummy = dummy;
    }

    public static Symbol of(String name) {
        return new Symbol(name, false, false);
    }

    public static Symbol real(String name) {
        return new Symbol(name, true, false);
    }

    /**
     * Creates a symbol that is distinct from every other symbol, whatever its name.
     *
     * @param name the display name
     * @param real whether the symbol is assumed real
     * @return a new dummy symbol
     */
    public static Symbol dummy(String name, boolean real) {
        return new Symbol(name, real, true);
    }

    public String name() {
        return name;
    }

    public boolean isReal() {
        return real;
    }

    public boolean isDummy() {
        return dummy;
    }

    @Override
    public List<Expression> children() {
        return List.of();
    }

    @Override
    public String format() {
        return name;
    }

    @Override
    public String toString() {
        return name;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (dummy || !(obj instanceof Symbol)) return false;
        Symbol that = (Symbol) obj;
        return !that.dummy && name.equals(that.name) && real == that.real;
    }

    @Override
    public int hashCode() {
        return dummy ? System.identityHashCode(this) : Objects.hash(name, real);
    }
}
