package com.ratint.config;

import java.math.BigInteger;

/**
 * Bounds for the exact number and root-finding routines.
 *
 * <p>None of these limits can make a result wrong: when a bound is reached the
 * routine reports that it could not produce a closed form, and the integrator
 * degrades to a {@code RootSum}.
 */
public final class IntegrationLimits {

    private IntegrationLimits() {} // Utility class

    /** Largest trial divisor used when extracting square factors from an integer. */
    public static final int TRIAL_DIVISION_LIMIT = 100_000;

    /** Largest magnitude whose divisors are enumerated for the rational root test. */
    public static final BigInteger MAX_FACTORABLE_MAGNITUDE = BigInteger.TEN.pow(12);

    /** Maximum number of rational root candidates tried for one polynomial. */
    public static final int MAX_RATIONAL_ROOT_CANDIDATES = 20_000;

    /** Decimal digits used for the first attempt at certifying the sign of a radical number. */
    public static final int SIGN_INITIAL_PRECISION = 32;

    /** Precision at which sign certification gives up (unreachable for nonzero values in practice). */
    public static final int SIGN_MAX_PRECISION = 1 << 16;

    /**
     * Returns the trial-division bound cubed: cofactors below it that survive trial
     * division and are not perfect squares are certainly square-free.
     *
     * @return {@code TRIAL_DIVISION_LIMIT^3}
     */
    public static BigInteger squareFreeCertificationBound() {
        return BigInteger.valueOf(TRIAL_DIVISION_LIMIT).pow(3);
    }
}
