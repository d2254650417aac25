package com.polynomialarithmetic;

import java.util.Objects;

/**
 * Euclidean division and the Euclidean gcd algorithm.
 *
 * <p>Division is long division: while the remainder has degree
 * {@code n >= m = deg(divisor)}, the correction monomial
 * {@code (lead(r) / lead(divisor)) * X^(n-m)} is added to the quotient and
 * {@code correction * divisor} is subtracted from the remainder.  The
 * eliminated coefficient is stored as an exact zero, so every step lowers
 * the degree of the remainder and the loop runs at most
 * {@code deg(dividend) - deg(divisor) + 1} times.
 */
public final class PolynomialDivision {

    private PolynomialDivision() { }

    /**
     * Returns {@code (q, r)} with {@code dividend == q * divisor + r} and
     * {@code deg(r) < deg(divisor)}.  Both results use the dividend's variable.
     */
    public static QuotientRemainder divide(Polynomial dividend, Polynomial divisor) {
        Objects.requireNonNull(dividend, "dividend");
        Objects.requireNonNull(divisor, "divisor");
        if (divisor.isZero()) throw new PolynomialDivisionByZeroException();

        String v = dividend.variable();
        Polynomial none = new Polynomial(new double[0], v);
        if (dividend.isZero()) return new QuotientRemainder(none, none);

        int n = dividend.length() - 1;
        int m = divisor.length() - 1;
        if (n < m) return new QuotientRemainder(none, dividend);

        double[] r = dividend.coefficients();
        double[] d = divisor.coefficients();
        double lead = d[m];
        double[] q = new double[n - m + 1];

        for (int k = n; k >= m; k--) {
            if (r[k] == 0.0) continue;
            double t = r[k] / lead;
            int shift = k - m;
            q[shift] = t;
            for (int j = 0; j < m; j++) {
                r[shift + j] -= t * d[j];
            }
            r[k] = 0.0;
        }
        return new QuotientRemainder(new Polynomial(q, v), new Polynomial(r, v));
    }

    /** True iff {@code divisor} divides {@code p} with zero remainder. */
    public static boolean divides(Polynomial divisor, Polynomial p) {
        return divide(p, divisor).remainder().isZero();
    }

    /**
     * Greatest common divisor, normalized to be monic; {@code gcd(0, 0) = 0}.
     * With floating-point coefficients a common factor may come back
     * perturbed by rounding error.
     */
    public static Polynomial gcd(Polynomial p, Polynomial q) {
        Objects.requireNonNull(p, "p");
        Objects.requireNonNull(q, "q");
        Polynomial a = p;
        Polynomial b = q;
        while (true) {
            if (a.isZero() && b.isZero()) return a;
            if (a.isZero()) return b.makeMonic();
            if (b.isZero()) return a.makeMonic();
            if (a.degree().isLessThan(b.degree())) {
                Polynomial t = a;
                a = b;
                b = t;
                continue;
            }
            Polynomial r = divide(a, b).remainder();
            a = b;
            b = r;
        }
    }
}
