package com.ratint.expression;

import java.util.List;
import java.util.Objects;

/**
 * Arctangent.
 */
public final class Atan implements Expression {

    private final Expression argument;

    Atan(Expression argument) {
        this.argument = Objects.requireNonNull(argument, "argument must not be null");
    }

    public Expression argument() {
        return argument;
    }

    @Override
    public List<Expression> children() {
        return List.of(argument);
    }

    @Override
    public String format() {
        return "atan(" + argument.format() + ")";
    }

    @Override
    public String toString() {
        return format();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Atan)) return false;
        return argument.equals(((Atan) obj).argument);
    }

    @Override
    public int hashCode() {
        return 31 * argument.hashCode() + 4;
    }
}
