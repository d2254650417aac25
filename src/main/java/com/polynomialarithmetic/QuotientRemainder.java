package com.polynomialarithmetic;

import java.util.Objects;

/** Result of Euclidean division: {@code dividend == quotient * divisor + remainder}. */
public final class QuotientRemainder {
    private final Polynomial quotient;
    private final Polynomial remainder;

    public QuotientRemainder(Polynomial quotient, Polynomial remainder) {
        this.quotient = Objects.requireNonNull(quotient, "quotient");
        this.remainder = Objects.requireNonNull(remainder, "remainder");
    }

    public Polynomial quotient()  { return quotient; }
    public Polynomial remainder() { return remainder; }

    @Override public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof QuotientRemainder)) return false;
        QuotientRemainder o = (QuotientRemainder) obj;
        return quotient.equals(o.quotient) && remainder.equals(o.remainder);
    }

    @Override public int hashCode() { return quotient.hashCode() * 31 + remainder.hashCode(); }

    @Override public String toString() { return "(" + quotient + ", " + remainder + ")"; }
}
