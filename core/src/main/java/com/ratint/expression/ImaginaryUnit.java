package com.ratint.expression;

import java.util.List;

/**
 * The imaginary unit {@code I}, with {@code I^2 = -1}.
 */
public final class ImaginaryUnit implements Expression {

    private static final ImaginaryUnit INSTANCE = new ImaginaryUnit();

    private ImaginaryUnit() {}

    public static ImaginaryUnit get() {
        return INSTANCE;
    }

    @Override
    public List<Expression> children() {
        return List.of();
    }

    @Override
    public String format() {
        return "I";
    }

    @Override
    public String toString() {
        return "I";
    }
}
