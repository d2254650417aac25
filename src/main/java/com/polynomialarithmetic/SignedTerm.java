package com.polynomialarithmetic;

import java.util.Objects;

/** One {@code (operator, term)} pair produced by {@link OperatorTokenizer}. */
public final class SignedTerm {
    private final char operator;
    private final String term;

    public SignedTerm(char operator, String term) {
        this.operator = operator;
        this.term = Objects.requireNonNull(term, "term");
    }

    public char operator() { return operator; }
    public String term()   { return term; }

    @Override public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof SignedTerm)) return false;
        SignedTerm o = (SignedTerm) obj;
        return operator == o.operator && term.equals(o.term);
    }

    @Override public int hashCode() { return operator * 31 + term.hashCode(); }

    @Override public String toString() { return "(" + operator + ", " + term + ")"; }
}
