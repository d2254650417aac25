package com.polynomialarithmetic;

/**
 * Thrown when text cannot be read as a polynomial.  {@link #term()} holds the
 * offending term (possibly empty), or the whole input for structural errors.
 */
public class PolynomialParseException extends IllegalArgumentException {
    private final String term;

    public PolynomialParseException(String message, String term) {
        super(message);
        this.term = term;
    }

    public PolynomialParseException(String message, String term, Throwable cause) {
        super(message, cause);
        this.term = term;
    }

    public String term() { return term; }
}
