package com.codelens.core.analysis;

import com.codelens.core.model.StructureError;
import com.codelens.core.model.StructureReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Stack-based bracket matcher over the raw character stream.
 *
 * <p>Every character is inspected, including characters inside string literals and
 * comments. Positions are code point offsets, so a supplementary character such as an
 * emoji counts once. A closing bracket always consumes the most recent opener, matching or not.
 * Openers left on the stack are reported outermost first. Independently, a source
 * without any {@code ;} gets a single missing-terminator error.
 *
 * <p><b>Example:</b> {@code "{ ( } )"} yields
 * {@code Mismatched '(' and '}' at position 4}, {@code Mismatched '{' and ')' at position 6}
 * and {@code Missing semicolon in the code.}
 */
public class StructureValidator {

    private static final Logger log = LoggerFactory.getLogger(StructureValidator.class);

    private static final Map<Character, Character> CLOSING_TO_OPENING = Map.of(
        ')', '(',
        '}', '{',
        ']', '['
    );

    private static final String OPENING_BRACKETS = "{([";

    /**
     * Validates bracket structure and terminator presence. Never fails.
     *
     * @param source source text
     * @return report with errors in emission order
     */
    public StructureReport validate(String source) {
        Objects.requireNonNull(source, "source must not be null");
        long start = System.nanoTime();

        Deque<OpenBracket> stack = new ArrayDeque<>();
        List<StructureError> errors = new ArrayList<>();

        // position counts code points, not UTF-16 units
        int position = 0;
        for (int i = 0; i < source.length(); position++) {
            int codePoint = source.codePointAt(i);
            i += Character.charCount(codePoint);
            if (!Character.isBmpCodePoint(codePoint)) {
                continue;
            }

            char c = (char) codePoint;
            if (OPENING_BRACKETS.indexOf(c) >= 0) {
                stack.push(new OpenBracket(c, position));
            } else if (CLOSING_TO_OPENING.containsKey(c)) {
                if (stack.isEmpty()) {
                    errors.add(StructureError.unmatchedClosing(c, position));
                } else {
                    OpenBracket last = stack.pop();
                    if (last.bracket() != CLOSING_TO_OPENING.get(c)) {
                        errors.add(StructureError.mismatched(last.bracket(), c, position));
                    }
                }
            }
        }

        // Deque iterates top-first; report in push order
        List<OpenBracket> unclosed = new ArrayList<>(stack);
        for (int i = unclosed.size() - 1; i >= 0; i--) {
            OpenBracket open = unclosed.get(i);
            errors.add(StructureError.unmatchedOpening(open.bracket(), open.position()));
        }

        if (source.indexOf(SourcePatterns.TERMINATOR) < 0) {
            errors.add(StructureError.missingTerminator());
        }

        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
        log.debug("Validated {} characters, {} structural errors in {}", source.length(), errors.size(), elapsed);

        return new StructureReport(errors, elapsed);
    }

    private record OpenBracket(char bracket, int position) {}
}
