package com.ratint.expression;

import java.util.List;
import java.util.Objects;

/**
 * Natural logarithm.
 */
public final class Log implements Expression {

    private final Expression argument;

    Log(Expression argument) {
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
        return "log(" + argument.format() + ")";
    }

    @Override
    public String toString() {
        return format();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Log)) return false;
        return argument.equals(((Log) obj).argument);
    }

    @Override
    public int hashCode() {
        return 31 * argument.hashCode() + 3;
    }
}
