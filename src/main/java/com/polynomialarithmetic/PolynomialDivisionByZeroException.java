package com.polynomialarithmetic;

/** Thrown when the divisor of a polynomial division is the zero polynomial. */
public class PolynomialDivisionByZeroException extends ArithmeticException {
    public PolynomialDivisionByZeroException() {
        super("Polynomial division is not allowed for the zero polynomial");
    }
}
