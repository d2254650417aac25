package com.polynomialarithmetic;

import java.util.Arrays;
import java.util.Objects;

/**
 * Establishes the canonical form of a coefficient sequence: no trailing
 * zeros, and the empty sequence for the zero polynomial.  Entries equal to
 * {@code -0.0} are stored as {@code 0.0} so that array equality and hashing
 * agree with numeric equality.
 */
public final class CoefficientNormalizer {

    private CoefficientNormalizer() { }

    /** Returns a fresh canonical copy; the argument is never modified. */
    public static double[] normalize(double[] coefficients) {
        Objects.requireNonNull(coefficients, "coefficients");
        int n = coefficients.length;
        while (n > 0 && coefficients[n - 1] == 0.0) {
            n--;
        }
        double[] out = Arrays.copyOf(coefficients, n);
        for (int i = 0; i < n; i++) {
            if (out[i] == 0.0) out[i] = 0.0; // drops the sign of -0.0
        }
        return out;
    }

    /** True iff the sequence is empty or ends in a non-zero entry. */
    public static boolean isCanonical(double[] coefficients) {
        Objects.requireNonNull(coefficients, "coefficients");
        return coefficients.length == 0 || coefficients[coefficients.length - 1] != 0.0;
    }
}
