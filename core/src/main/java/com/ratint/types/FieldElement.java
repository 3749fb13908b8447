package com.ratint.types;

/**
 * Element of a field: a ring in which every nonzero element is invertible.
 *
 * @param <E> the concrete element type
 */
public interface FieldElement<E extends FieldElement<E>> extends RingElement<E> {

    /**
     * Returns the multiplicative inverse.
     *
     * @return {@code 1 / this}
     * @throws ArithmeticException if this element is zero
     */
    E inverse();

    default E divide(E divisor) {
        return multiply(divisor.inverse());
    }

    @Override
    default E exactQuotient(E divisor) {
        return divide(divisor);
    }
}
