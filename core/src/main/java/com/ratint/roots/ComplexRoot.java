package com.ratint.roots;

import com.ratint.types.RadicalNumber;

/**
 * A root {@code real + I*imaginary} with both parts real radical numbers.
 */
public record ComplexRoot(RadicalNumber real, RadicalNumber imaginary) {

    public static ComplexRoot real(RadicalNumber value) {
        return new ComplexRoot(value, RadicalNumber.ZERO);
    }

    public boolean isReal() {
        return imaginary.isZero();
    }

    @Override
    public String toString() {
        return isReal() ? real.toString() : real + " + I*(" + imaginary + ")";
    }
}
