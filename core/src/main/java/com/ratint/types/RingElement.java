package com.ratint.types;

/**
 * Element of a commutative ring with unity.
 *
 * <p>Every algebraic value in ratint implements this interface: exact numbers,
 * polynomials (whose coefficients are themselves ring elements) and
 * multivariate polynomials. Implementations are immutable; every operation
 * returns a new value.
 *
 * <p>The ring is identified through its elements: {@link #zero()} and
 * {@link #one()} return the neutral elements of the ring {@code this} belongs
 * to, so generic code never needs a separate factory object.
 *
 * @param <E> the concrete element type
 */
public interface RingElement<E extends RingElement<E>> {

    E add(E other);

    default E subtract(E other) {
        return add(other.negate());
    }

    E multiply(E other);

    /**
     * Multiplies by an integer (repeated addition).
     *
     * @param factor the integer factor
     * @return {@code factor * this}
     */
    E multiply(long factor);

    E negate();

    /**
     * Divides by {@code divisor} when the quotient exists in the ring.
     *
     * @param divisor the divisor
     * @return the exact quotient
     * @throws ArithmeticException if {@code divisor} is zero or does not divide {@code this}
     */
    E exactQuotient(E divisor);

    boolean isZero();

    boolean isOne();

    E zero();

    E one();

    /**
     * Raises this element to a non-negative integer power by repeated squaring.
     *
     * @param exponent the exponent, at least zero
     * @return {@code this^exponent}
     */
    @SuppressWarnings("unchecked")
    default E pow(int exponent) {
        if (exponent < 0) {
            throw new IllegalArgumentException("exponent must be non-negative: " + exponent);
        }
        E result = one();
        E base = (E) this;
        int e = exponent;
        while (e > 0) {
            if ((e & 1) == 1) {
                result = result.multiply(base);
            }
            e >>= 1;
            if (e > 0) {
                base = base.multiply(base);
            }
        }
        return result;
    }
}
