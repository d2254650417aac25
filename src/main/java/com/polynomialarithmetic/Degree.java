package com.polynomialarithmetic;

/**
 * Degree of a polynomial.  Finite degrees are non-negative integers; the
 * zero polynomial has degree {@link #NEGATIVE_INFINITY}, which orders below
 * every finite degree.
 */
public final class Degree implements Comparable<Degree> {
    public static final Degree NEGATIVE_INFINITY = new Degree(-1);

    private final int n;        // -1 encodes -infinity

    private Degree(int n) { this.n = n; }

    public static Degree of(int n) {
        if (n < 0) throw new IllegalArgumentException("Finite degree must be non-negative: " + n);
        return new Degree(n);
    }

    public boolean isFinite() { return n >= 0; }

    /** The finite degree; the sentinel has no integer value. */
    public int value() {
        if (n < 0) throw new ArithmeticException("Degree of the zero polynomial is -infinity");
        return n;
    }

    public boolean isLessThan(Degree o) { return compareTo(o) < 0; }

    @Override public int compareTo(Degree o) { return Integer.compare(n, o.n); }

    @Override public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Degree)) return false;
        return n == ((Degree) obj).n;
    }

    @Override public int hashCode() { return Integer.hashCode(n); }

    @Override public String toString() { return n < 0 ? "-inf" : Integer.toString(n); }
}
