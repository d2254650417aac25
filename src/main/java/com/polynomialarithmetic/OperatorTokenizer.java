package com.polynomialarithmetic;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Splits a string of signed terms by a fixed set of single-character unary
 * operators.  For example {@code "- x + y - z"} with operators {@code "+-"}
 * becomes {@code [(-, x), (+, y), (-, z)]}.  Term content is not checked.
 */
public final class OperatorTokenizer {
    public static final OperatorTokenizer SIGNS = new OperatorTokenizer("+-");

    private final String operators;

    public OperatorTokenizer(String operators) {
        Objects.requireNonNull(operators, "operators");
        if (operators.isEmpty()) throw new IllegalArgumentException("At least one operator is required");
        this.operators = operators;
    }

    public String operators() { return operators; }

    public boolean isOperator(char ch) { return operators.indexOf(ch) >= 0; }

    /** Removes every whitespace character. */
    public static String removeWhitespace(String text) {
        Objects.requireNonNull(text, "text");
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (!Character.isWhitespace(ch)) sb.append(ch);
        }
        return sb.toString();
    }

    /**
     * Prepends {@code defaultOperator} unless the text (ignoring leading
     * whitespace) already starts with an operator: {@code "x + y"} becomes
     * {@code "+x + y"}, {@code "- x + y"} is unchanged.
     */
    public String withDefaultOperator(String text, char defaultOperator) {
        Objects.requireNonNull(text, "text");
        if (!isOperator(defaultOperator)) {
            throw new IllegalArgumentException("'" + defaultOperator + "' is not one of " + operators);
        }
        String t = text.stripLeading();
        if (!t.isEmpty() && isOperator(t.charAt(0))) return text;
        return defaultOperator + text;
    }

    /**
     * Splits text in which every term carries an explicit operator.  Blank
     * text yields an empty list.
     *
     * @throws PolynomialParseException if text precedes the first operator
     */
    public List<SignedTerm> tokenize(String text) {
        return split(removeWhitespace(text));
    }

    /** Like {@link #tokenize(String)}, supplying {@code defaultOperator} to an unsigned first term. */
    public List<SignedTerm> tokenize(String text, char defaultOperator) {
        return split(withDefaultOperator(removeWhitespace(text), defaultOperator));
    }

    private List<SignedTerm> split(String txt) {
        List<SignedTerm> out = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        Character operator = null;
        for (int i = 0; i < txt.length(); i++) {
            char ch = txt.charAt(i);
            if (isOperator(ch)) {
                if (operator != null) {
                    out.add(new SignedTerm(operator, current.toString()));
                } else if (current.length() > 0) {
                    throw new PolynomialParseException(
                            "Term '" + current + "' is not preceded by one of " + operators, current.toString());
                }
                current.setLength(0);
                operator = ch;
            } else {
                current.append(ch);
            }
        }
        if (operator != null) {
            out.add(new SignedTerm(operator, current.toString()));
        } else if (current.length() > 0) {
            throw new PolynomialParseException(
                    "Term '" + current + "' is not preceded by one of " + operators, current.toString());
        }
        return out;
    }
}
