package com.polynomialarithmetic;

import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable univariate polynomial with {@code double} coefficients.
 *
 * <p>The coefficient array {@code [a0, a1, a2, ...]} represents
 * {@code a0 + a1*X + a2*X^2 + ...} and is always canonical (see
 * {@link CoefficientNormalizer}); the zero polynomial has no coefficients.
 * The variable is used for printing only: equality and hashing look at the
 * coefficients alone.
 *
 * <p>Coefficients are IEEE doubles, so results carry the usual rounding
 * error.  Integer-valued inputs of moderate size stay exact under addition,
 * multiplication and division by monic divisors.
 */
public final class Polynomial {
    public static final String DEFAULT_VARIABLE = "X";
    /** Largest degree whose coefficient array the JVM can allocate. */
    public static final int MAX_DEGREE = Integer.MAX_VALUE - 9;

    private static final Polynomial ZERO = new Polynomial(new double[0]);
    private static final Polynomial ONE  = new Polynomial(1.0);

    private final double[] c;        // canonical, owned exclusively
    private final String variable;

    public Polynomial(double... coefficients) {
        this(coefficients, DEFAULT_VARIABLE);
    }

    public Polynomial(double[] coefficients, String variable) {
        this.c = CoefficientNormalizer.normalize(coefficients);
        this.variable = PolynomialFormat.checkVariable(variable);
    }

    /** Factories */
    public static Polynomial of(double... coefficients) { return new Polynomial(coefficients); }
    public static Polynomial zero() { return ZERO; }
    public static Polynomial one()  { return ONE; }
    public static Polynomial constant(double value) { return new Polynomial(value); }
    public static Polynomial x() { return x(1); }

    /** The monomial {@code X^n}. */
    public static Polynomial x(int n) { return monomial(1.0, n); }

    /** The monomial {@code coefficient * X^n}. */
    public static Polynomial monomial(double coefficient, int n) {
        if (n < 0) throw new InvalidExponentException(n);
        if (n > MAX_DEGREE) throw new IllegalArgumentException("Degree " + n + " exceeds " + MAX_DEGREE);
        double[] a = new double[n + 1];
        a[n] = coefficient;
        return new Polynomial(a);
    }

    public static Polynomial parse(String text) { return PolynomialFormat.DEFAULT.parse(text); }

    public static Polynomial parse(String text, String variable) {
        return PolynomialFormat.builder().variable(variable).build().parse(text);
    }

    public static Polynomial gcd(Polynomial p, Polynomial q) { return PolynomialDivision.gcd(p, q); }

    // ---- accessors ----

    /** A copy of the canonical coefficient sequence. */
    public double[] coefficients() { return c.clone(); }

    /** Coefficient of {@code X^i}; zero beyond the stored length. */
    public double coefficient(int i) {
        if (i < 0) throw new IndexOutOfBoundsException("Negative index " + i);
        return i < c.length ? c[i] : 0.0;
    }

    public int length()        { return c.length; }
    public String variable()   { return variable; }
    public boolean isZero()    { return c.length == 0; }

    public Degree degree() {
        return c.length == 0 ? Degree.NEGATIVE_INFINITY : Degree.of(c.length - 1);
    }

    public Polynomial withVariable(String v) { return new Polynomial(c, v); }

    public Polynomial copy() { return new Polynomial(c, variable); }

    /** Value at {@code x}; the zero polynomial evaluates to 0 everywhere. */
    public double evaluate(double x) {
        if (c.length == 0) return 0.0;
        double acc = c[c.length - 1];
        for (int k = c.length - 2; k >= 0; k--) {
            acc = acc * x + c[k];
        }
        return acc;
    }

    // ---- arithmetic ----

    public Polynomial negate() { return scale(-1.0); }

    public Polynomial scale(double u) {
        double[] a = new double[c.length];
        for (int i = 0; i < c.length; i++) a[i] = u * c[i];
        return new Polynomial(a, variable);
    }

    public Polynomial add(Polynomial o) {
        Objects.requireNonNull(o, "other");
        int n = Math.max(c.length, o.c.length);
        double[] a = new double[n];
        for (int i = 0; i < n; i++) a[i] = coefficient(i) + o.coefficient(i);
        return new Polynomial(a, variable);
    }

    public Polynomial subtract(Polynomial o) {
        Objects.requireNonNull(o, "other");
        return add(o.negate());
    }

    /** Convolution of the two coefficient sequences. */
    public Polynomial multiply(Polynomial o) {
        Objects.requireNonNull(o, "other");
        if (isZero() || o.isZero()) return new Polynomial(new double[0], variable);
        int n = c.length - 1;
        int m = o.c.length - 1;
        double[] a = new double[n + m + 1];
        for (int k = 0; k <= n + m; k++) {
            double sum = 0.0;
            for (int i = Math.max(0, k - m); i <= Math.min(k, n); i++) {
                sum += c[i] * o.c[k - i];
            }
            a[k] = sum;
        }
        return new Polynomial(a, variable);
    }

    /** {@code this^n}; {@code p^0} is the constant 1 for every p, zero included. */
    public Polynomial pow(int n) {
        if (n < 0) throw new InvalidExponentException(n);
        Polynomial result = new Polynomial(new double[] { 1.0 }, variable);
        for (int i = 0; i < n; i++) {
            result = multiply(result);
        }
        return result;
    }

    public double leadCoefficient() {
        if (isZero()) throw new ZeroPolynomialException("The zero polynomial has no lead coefficient");
        return c[c.length - 1];
    }

    /** The zero polynomial is not monic. */
    public boolean isMonic() { return !isZero() && leadCoefficient() == 1.0; }

    /**
     * Divides through by the lead coefficient.  The lead coefficient of the
     * result is exactly 1 even where {@code a * (1/a)} would round.
     */
    public Polynomial makeMonic() {
        if (isZero()) throw new ZeroPolynomialException("The zero polynomial cannot be made monic");
        double inv = 1.0 / leadCoefficient();
        double[] a = new double[c.length];
        for (int i = 0; i < c.length - 1; i++) a[i] = inv * c[i];
        a[c.length - 1] = 1.0;
        return new Polynomial(a, variable);
    }

    public Polynomial derivative() { return derivative(1); }

    /** The {@code n}-th derivative; {@code derivative(0)} is this polynomial. */
    public Polynomial derivative(int n) {
        if (n < 0) throw new InvalidExponentException(n);
        double[] a = c;
        for (int step = 0; step < n && a.length > 0; step++) {
            double[] d = new double[a.length - 1];
            for (int k = 0; k < d.length; k++) d[k] = (k + 1) * a[k + 1];
            a = CoefficientNormalizer.normalize(d);
        }
        return a == c ? this : new Polynomial(a, variable);
    }

    // ---- division ----

    public QuotientRemainder divide(Polynomial divisor) { return PolynomialDivision.divide(this, divisor); }

    public Polynomial remainder(Polynomial divisor) { return divide(divisor).remainder(); }

    // ---- Object ----

    @Override public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Polynomial)) return false;
        return Arrays.equals(c, ((Polynomial) obj).c);
    }

    @Override public int hashCode() { return Arrays.hashCode(c); }

    /** Canonical print form, e.g. {@code "+ 1*X^0 - 4*X^1 + 2*X^3"}; {@code "0"} for zero. */
    @Override public String toString() {
        return PolynomialFormat.builder().variable(variable).build().format(this);
    }
}
