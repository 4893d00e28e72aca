package com.codelens.core.model;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Output of the tokenizer phase.
 *
 * @param frequencies occurrence count per distinct token text, in first-occurrence order
 * @param invalidTokens token texts failing the validity test, in source order (duplicates kept)
 * @param elapsed wall-clock time spent tokenizing (diagnostic only)
 */
public record TokenReport(
    Map<String, Integer> frequencies,
    List<String> invalidTokens,
    Duration elapsed
) {
    /**
     * Compact constructor with validation; copies the collections.
     */
    public TokenReport {
        frequencies = frequencies == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(frequencies));
        invalidTokens = invalidTokens == null ? List.of() : List.copyOf(invalidTokens);
        elapsed = Objects.requireNonNullElse(elapsed, Duration.ZERO);
    }

    /**
     * Returns the total number of tokens, i.e. the sum of all frequencies.
     *
     * @return total token count
     */
    public int totalTokens() {
        return frequencies.values().stream().mapToInt(Integer::intValue).sum();
    }

    /**
     * Returns the number of distinct token texts.
     *
     * @return distinct token count
     */
    public int distinctTokens() {
        return frequencies.size();
    }

    /**
     * Returns the occurrence count of a token text.
     *
     * @param text token text
     * @return count, or 0 if the text never occurs
     */
    public int frequencyOf(String text) {
        return frequencies.getOrDefault(text, 0);
    }
}
