package com.codelens.core.analysis;

import com.codelens.core.model.AnalysisSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Produces natural-language sentences and improvement hints from plain-text pattern checks.
 *
 * <p>Each check is gated independently and looks at the whole source, except the method
 * and variable collectors, which work line by line. The final suggestion is always present.
 */
public class SummaryGenerator {

    private static final Logger log = LoggerFactory.getLogger(SummaryGenerator.class);

    static final String CLASS_SENTENCE = "This code defines a class named '%s'.";
    static final String MAIN_SENTENCE =
        "This program contains a main method, which is the entry point of the program.";
    static final String METHODS_SENTENCE = "The program defines the following methods: %s.";
    static final String VARIABLES_SENTENCE = "The program declares the following variables: %s.";
    static final String LOOPS_SENTENCE = "The program uses loops to iterate over data.";
    static final String CONDITIONALS_SENTENCE =
        "The program uses conditional statements (e.g., 'if' statements) for decision-making.";
    static final String PRINT_SENTENCE = "The program contains print statements to display the output.";

    public static final String NESTING_SUGGESTION = "Consider refactoring to reduce excessive nesting.";
    public static final String ENHANCED_FOR_SUGGESTION =
        "Consider using enhanced for-loop syntax where possible for better readability.";
    public static final String CONCATENATION_SUGGESTION =
        "Avoid using '+' for string concatenation inside loops. Use StringBuilder for better performance.";
    public static final String EXCEPTION_HANDLING_SUGGESTION =
        "Add proper exception handling with meaningful error messages.";
    public static final String SPLIT_METHODS_SUGGESTION =
        "Consider breaking large methods into smaller, more manageable ones.";

    private static final String LIST_SEPARATOR = ", ";

    /**
     * Summarizes the source. Never fails.
     *
     * @param source source text
     * @return summary sentences and suggestions
     */
    public AnalysisSummary summarize(String source) {
        Objects.requireNonNull(source, "source must not be null");
        List<String> lines = source.lines().toList();

        List<String> sentences = describe(source, lines);
        List<String> suggestions = suggest(source, lines);

        log.debug("Generated {} summary sentences and {} suggestions", sentences.size(), suggestions.size());
        return new AnalysisSummary(sentences, suggestions);
    }

    private List<String> describe(String source, List<String> lines) {
        List<String> sentences = new ArrayList<>();

        if (source.contains(SourcePatterns.CLASS_KEYWORD)) {
            sentences.add(String.format(CLASS_SENTENCE, extractClassName(source)));
        }

        if (source.contains(SourcePatterns.MAIN_METHOD_HEADER)) {
            sentences.add(MAIN_SENTENCE);
        }

        List<String> methods = extractMethodNames(lines);
        if (!methods.isEmpty()) {
            sentences.add(String.format(METHODS_SENTENCE, String.join(LIST_SEPARATOR, methods)));
        }

        List<String> variables = extractVariableNames(lines);
        if (!variables.isEmpty()) {
            sentences.add(String.format(VARIABLES_SENTENCE, String.join(LIST_SEPARATOR, variables)));
        }

        if (SourcePatterns.containsLoopKeyword(source)) {
            sentences.add(LOOPS_SENTENCE);
        }
        if (source.contains(SourcePatterns.CONDITIONAL_KEYWORD)) {
            sentences.add(CONDITIONALS_SENTENCE);
        }
        if (source.contains(SourcePatterns.PRINT_STATEMENT)) {
            sentences.add(PRINT_SENTENCE);
        }

        return sentences;
    }

    private List<String> suggest(String source, List<String> lines) {
        List<String> suggestions = new ArrayList<>();

        boolean braceLoop = lines.stream()
            .anyMatch(line -> line.contains(SourcePatterns.FOR_KEYWORD) && line.contains(SourcePatterns.OPEN_BRACE));
        if (braceLoop) {
            suggestions.add(NESTING_SUGGESTION);
            suggestions.add(ENHANCED_FOR_SUGGESTION);
        }

        if (source.contains(SourcePatterns.CONCATENATION) && source.contains(SourcePatterns.PRINT_STATEMENT)) {
            suggestions.add(CONCATENATION_SUGGESTION);
        }

        if (!source.contains(SourcePatterns.TRY_KEYWORD) && !source.contains(SourcePatterns.CATCH_KEYWORD)) {
            suggestions.add(EXCEPTION_HANDLING_SUGGESTION);
        }

        suggestions.add(SPLIT_METHODS_SUGGESTION);
        return suggestions;
    }

    /**
     * Returns the text after the first {@code "class "} up to the next {@code "class "}
     * or {@code "{"}, whichever comes first, trimmed.
     */
    static String extractClassName(String source) {
        int start = source.indexOf(SourcePatterns.CLASS_KEYWORD) + SourcePatterns.CLASS_KEYWORD.length();
        String rest = source.substring(start);

        int nextClass = rest.indexOf(SourcePatterns.CLASS_KEYWORD);
        if (nextClass >= 0) {
            rest = rest.substring(0, nextClass);
        }
        int brace = rest.indexOf(SourcePatterns.OPEN_BRACE);
        if (brace >= 0) {
            rest = rest.substring(0, brace);
        }
        return rest.strip();
    }

    /**
     * Collects the identifier before the first {@code (} on every public, non-class line
     * containing both parentheses.
     */
    static List<String> extractMethodNames(List<String> lines) {
        List<String> methods = new ArrayList<>();
        for (String line : lines) {
            if (line.strip().startsWith(SourcePatterns.ACCESS_KEYWORD)
                    && line.contains(SourcePatterns.OPEN_PAREN)
                    && line.contains(SourcePatterns.CLOSE_PAREN)
                    && !line.contains(SourcePatterns.CLASS_WORD)) {
                String header = line.substring(0, line.indexOf(SourcePatterns.OPEN_PAREN));
                List<String> words = SourcePatterns.words(header);
                if (!words.isEmpty()) {
                    methods.add(words.get(words.size() - 1));
                }
            }
        }
        return methods;
    }

    /**
     * Collects declared names from trimmed lines starting with a type keyword followed by a space.
     */
    static List<String> extractVariableNames(List<String> lines) {
        List<String> variables = new ArrayList<>();
        for (String line : lines) {
            String stripped = line.strip();
            boolean declaration = SourcePatterns.TYPE_KEYWORDS.stream()
                .anyMatch(keyword -> stripped.startsWith(keyword + " "));
            if (declaration) {
                String name = SourcePatterns.declaredName(stripped);
                if (name != null) {
                    variables.add(name);
                }
            }
        }
        return variables;
    }
}
