package com.polynomialarithmetic;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Reads and writes the textual form of a polynomial.
 *
 * <p>Input is a sum of signed monomials {@code c*X^k}, where {@code c*} may be
 * omitted (coefficient 1), {@code X} alone means {@code X^1} and a bare
 * numeral is a constant; whitespace is ignored and terms with equal
 * exponents are summed, so {@code "2*X^2 - 2*X^2"} reads as zero.  Output
 * writes every non-zero term as {@code "<sign> <|c|>*X^k"}, the first one
 * included, e.g. {@code "+ 1*X^0 - 4*X^1 + 2*X^3"}; zero prints as
 * {@code "0"}.
 */
public final class PolynomialFormat {
    public static final PolynomialFormat DEFAULT = builder().build();

    private static final Pattern NUMBER = Pattern.compile("(\\d+\\.?\\d*|\\.\\d+)([eE]\\d+)?");
    private static final Pattern DIGITS = Pattern.compile("\\d+");
    private static final double LARGEST_EXACT_INTEGER = 0x1p53;

    private final String variable;

    private PolynomialFormat(Builder b) {
        this.variable = b.variable;
    }

    public static Builder builder() { return new Builder(); }

    public String variable() { return variable; }

    public static final class Builder {
        private String variable = Polynomial.DEFAULT_VARIABLE;

        public Builder variable(String v){ this.variable = checkVariable(v); return this; }
        public PolynomialFormat build(){ return new PolynomialFormat(this); }
    }

    /** Variables are non-empty, do not start with a digit or '.', and avoid the grammar's symbols. */
    static String checkVariable(String v) {
        Objects.requireNonNull(v, "variable");
        if (v.isEmpty()) throw new IllegalArgumentException("Variable must not be empty");
        char first = v.charAt(0);
        if (Character.isDigit(first) || first == '.') {
            throw new IllegalArgumentException("Variable must not start with a digit or '.': " + v);
        }
        for (int i = 0; i < v.length(); i++) {
            char ch = v.charAt(i);
            if (Character.isWhitespace(ch) || "+-*^".indexOf(ch) >= 0) {
                throw new IllegalArgumentException("Illegal character '" + ch + "' in variable: " + v);
            }
        }
        return v;
    }

    // ---- parsing ----

    /**
     * Parses {@code text} into a polynomial in this format's variable.
     *
     * @throws PolynomialParseException on empty input, a non-numeric
     *         coefficient, a malformed power or a foreign variable
     */
    public Polynomial parse(String text) {
        Objects.requireNonNull(text, "text");
        if (text.isBlank()) throw new PolynomialParseException("Cannot parse an empty string", text);

        double[] coeffs = new double[1];
        List<SignedTerm> terms = OperatorTokenizer.SIGNS.tokenize(text, '+');
        for (SignedTerm t : terms) {
            int sign = t.operator() == '-' ? -1 : 1;
            String term = t.term();
            int exponent;
            double coeff;
            if (NUMBER.matcher(term).matches()) {
                exponent = 0;
                coeff = parseCoefficient(term);
            } else {
                String power;
                int star = term.indexOf('*');
                if (star >= 0) {
                    if (term.indexOf('*', star + 1) >= 0) {
                        throw new PolynomialParseException("Term '" + term + "' has more than one '*'", term);
                    }
                    coeff = parseCoefficient(term.substring(0, star));
                    power = term.substring(star + 1);
                } else {
                    coeff = 1.0;
                    power = term;
                }
                exponent = parseExponent(power);
            }
            if (exponent >= coeffs.length) coeffs = Arrays.copyOf(coeffs, exponent + 1);
            coeffs[exponent] += sign * coeff;
        }
        return new Polynomial(coeffs, variable);
    }

    private static double parseCoefficient(String s) {
        if (!NUMBER.matcher(s).matches()) {
            throw new PolynomialParseException("Coefficient '" + s + "' is not a number", s);
        }
        return Double.parseDouble(s);
    }

    private int parseExponent(String power) {
        if (power.equals(variable)) return 1;
        String prefix = variable + "^";
        String digits = power.startsWith(prefix) ? power.substring(prefix.length()) : "";
        if (!DIGITS.matcher(digits).matches()) {
            throw new PolynomialParseException("'" + power + "' is not a valid power of " + variable, power);
        }
        int exponent;
        try {
            exponent = Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            throw new PolynomialParseException("Exponent '" + digits + "' is too large", power, e);
        }
        if (exponent > Polynomial.MAX_DEGREE) {
            throw new PolynomialParseException("Exponent '" + digits + "' exceeds " + Polynomial.MAX_DEGREE, power);
        }
        return exponent;
    }

    // ---- printing ----

    public String format(Polynomial p) {
        Objects.requireNonNull(p, "polynomial");
        if (p.isZero()) return "0";
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < p.length(); i++) {
            double a = p.coefficient(i);
            if (a == 0.0) continue;
            if (sb.length() > 0) sb.append(' ');
            sb.append(a < 0 ? '-' : '+').append(' ')
              .append(formatMagnitude(Math.abs(a)))
              .append('*').append(variable).append('^').append(i);
        }
        return sb.toString();
    }

    /** Integers print without a fraction; everything else in plain decimal notation. */
    static String formatMagnitude(double a) {
        if (Double.isNaN(a) || Double.isInfinite(a)) return Double.toString(a);
        if (a == Math.rint(a) && a < LARGEST_EXACT_INTEGER) return Long.toString((long) a);
        return BigDecimal.valueOf(a).toPlainString();
    }
}
