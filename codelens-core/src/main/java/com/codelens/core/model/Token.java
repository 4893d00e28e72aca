package com.codelens.core.model;

import java.util.Objects;
import java.util.Set;

/**
 * A maximal whitespace-delimited substring of the analyzed source.
 *
 * <p>A token is valid when it is purely alphanumeric or exactly one of the
 * fixed operator/punctuation symbols in {@link #OPERATORS}. Compound operators
 * such as {@code ==} or {@code ++} are reported as invalid.
 *
 * @param text token text, never blank
 * @param operator whether the text is one of the fixed operator/punctuation symbols
 */
public record Token(
    String text,
    boolean operator
) {
    /** Operator and punctuation symbols accepted as standalone tokens. */
    public static final Set<String> OPERATORS = Set.of("+", "-", "*", "/", "=", "(", ")", "{", "}", ";");

    /**
     * Compact constructor with validation.
     */
    public Token {
        Objects.requireNonNull(text, "text must not be null");
    }

    /**
     * Creates a token, classifying it against the operator set.
     *
     * @param text token text
     * @return classified token
     */
    public static Token of(String text) {
        return new Token(text, OPERATORS.contains(text));
    }

    /**
     * Returns true if every code point is a letter or a number.
     *
     * <p>Numbers include all numeric categories, so {@code x²} and {@code ½} are
     * alphanumeric. An empty text is not alphanumeric.
     *
     * @return true for identifiers and number literals
     */
    public boolean isAlphanumeric() {
        if (text.isEmpty()) {
            return false;
        }
        return text.codePoints().allMatch(Token::isLetterOrNumber);
    }

    private static boolean isLetterOrNumber(int codePoint) {
        if (Character.isLetterOrDigit(codePoint)) {
            return true;
        }
        int type = Character.getType(codePoint);
        return type == Character.LETTER_NUMBER || type == Character.OTHER_NUMBER;
    }

    /**
     * Returns true if the token is neither alphanumeric nor a fixed operator.
     *
     * @return true for lexical anomalies
     */
    public boolean isInvalid() {
        return !isAlphanumeric() && !operator;
    }
}
