package com.polynomialarithmetic;

/** Thrown for a negative exponent or derivative order. */
public class InvalidExponentException extends IllegalArgumentException {
    private final int exponent;

    public InvalidExponentException(int exponent) {
        super("Exponent needs to be non-negative, got " + exponent);
        this.exponent = exponent;
    }

    public int exponent() { return exponent; }
}
