package com.codelens.core.analysis;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Fixed keyword vocabulary shared by the analysis phases.
 *
 * <p>All matching in this package is plain-text containment or prefix matching
 * against these constants. No lexing of string literals or comments is performed.
 *
 * @since 1.0.0
 */
public final class SourcePatterns {

    // Declarations
    public static final String CLASS_HEADER = "public class";
    public static final String CLASS_KEYWORD = "class ";
    public static final String CLASS_WORD = "class";
    public static final String MAIN_METHOD_HEADER = "public static void main";
    public static final String MAIN_METHOD_NAME = "main";
    public static final String ACCESS_KEYWORD = "public";

    // Statements
    public static final String PRINT_STATEMENT = "System.out.println";
    public static final List<String> LOOP_KEYWORDS = List.of("for", "while");
    public static final String FOR_KEYWORD = "for";
    public static final String CONDITIONAL_KEYWORD = "if";
    public static final String TRY_KEYWORD = "try";
    public static final String CATCH_KEYWORD = "catch";
    public static final List<String> TYPE_KEYWORDS = List.of("int", "String", "float", "double");

    // Punctuation
    public static final char TERMINATOR = ';';
    public static final String OPEN_BRACE = "{";
    public static final String CLOSE_BRACE = "}";
    public static final String OPEN_PAREN = "(";
    public static final String CLOSE_PAREN = ")";
    public static final String CONCATENATION = "+";

    /**
     * Runs of whitespace separating tokens and words: Unicode white space, including
     * no-break spaces, plus the ASCII information separators U+001C to U+001F.
     */
    public static final Pattern WHITESPACE = Pattern.compile("[\\s\\x1C-\\x1F]+", Pattern.UNICODE_CHARACTER_CLASS);

    private SourcePatterns() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Splits text into whitespace-separated words, ignoring leading and trailing whitespace.
     *
     * @param text text to split
     * @return words in order; empty for blank text
     */
    public static List<String> words(String text) {
        return WHITESPACE.splitAsStream(text)
            .filter(word -> !word.isEmpty())
            .toList();
    }

    /**
     * Returns true if the text contains any loop keyword as a substring.
     *
     * @param text text to check
     * @return true if {@code for} or {@code while} occurs anywhere
     */
    public static boolean containsLoopKeyword(String text) {
        return LOOP_KEYWORDS.stream().anyMatch(text::contains);
    }

    /**
     * Returns true if the text starts with any of the given prefixes.
     *
     * @param text text to check
     * @param prefixes candidate prefixes
     * @return true on the first matching prefix
     */
    public static boolean startsWithAny(String text, List<String> prefixes) {
        return prefixes.stream().anyMatch(text::startsWith);
    }

    /**
     * Extracts a declared variable name from a declaration: the second word with
     * every {@code ;} and {@code =} removed.
     *
     * @param declaration declaration line
     * @return variable name, or {@code null} if the line has fewer than two words
     */
    public static String declaredName(String declaration) {
        List<String> words = words(declaration);
        if (words.size() < 2) {
            return null;
        }
        return words.get(1).replace(";", "").replace("=", "");
    }

    /**
     * Counts non-overlapping occurrences of a substring.
     *
     * @param text text to search
     * @param needle non-empty substring
     * @return occurrence count
     */
    public static int countOccurrences(String text, String needle) {
        int count = 0;
        int index = text.indexOf(needle);
        while (index >= 0) {
            count++;
            index = text.indexOf(needle, index + needle.length());
        }
        return count;
    }
}
