package com.codelens.core.analysis;

import com.codelens.core.model.AstNodeType;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * One entry of the ordered rule table used by {@link SyntaxTreeBuilder}.
 *
 * <p>A rule pairs a predicate over a trimmed statement with the node it creates.
 * Whether the node becomes the new insertion point is decided by
 * {@link AstNodeType#isContainer()}.
 *
 * @param type node type created on match
 * @param predicate match test applied to the trimmed statement text
 * @param nameExtractor derives the node name from the statement; may return {@code null}
 */
public record LineRule(
    AstNodeType type,
    Predicate<String> predicate,
    Function<String, String> nameExtractor
) {
    /**
     * Compact constructor with validation.
     */
    public LineRule {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(predicate, "predicate must not be null");
        Objects.requireNonNull(nameExtractor, "nameExtractor must not be null");
    }

    /**
     * Default rules in priority order: class header, entry-point method, loop,
     * variable declaration, print statement.
     *
     * @return ordered rule table
     */
    public static List<LineRule> defaults() {
        return List.of(
            new LineRule(
                AstNodeType.CLASS,
                line -> line.startsWith(SourcePatterns.CLASS_HEADER),
                LineRule::lastWord),
            new LineRule(
                AstNodeType.METHOD,
                line -> line.startsWith(SourcePatterns.MAIN_METHOD_HEADER),
                line -> SourcePatterns.MAIN_METHOD_NAME),
            new LineRule(
                AstNodeType.LOOP,
                SourcePatterns::containsLoopKeyword,
                line -> null),
            new LineRule(
                AstNodeType.VARIABLE,
                line -> SourcePatterns.startsWithAny(line, SourcePatterns.TYPE_KEYWORDS)
                    && SourcePatterns.declaredName(line) != null,
                SourcePatterns::declaredName),
            new LineRule(
                AstNodeType.PRINT,
                line -> line.startsWith(SourcePatterns.PRINT_STATEMENT),
                line -> null)
        );
    }

    public boolean matches(String statement) {
        return predicate.test(statement);
    }

    public String nameOf(String statement) {
        return nameExtractor.apply(statement);
    }

    private static String lastWord(String line) {
        List<String> words = SourcePatterns.words(line);
        return words.get(words.size() - 1);
    }
}
