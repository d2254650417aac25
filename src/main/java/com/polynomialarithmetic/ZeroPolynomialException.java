package com.polynomialarithmetic;

/** Thrown by operations that are undefined for the zero polynomial. */
public class ZeroPolynomialException extends ArithmeticException {
    public ZeroPolynomialException(String message) { super(message); }
}
