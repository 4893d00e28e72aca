package com.codelens.core.model;

import java.util.List;

/**
 * Natural-language description of the source and static improvement hints.
 *
 * @param sentences descriptive sentences about detected constructs, in fixed order
 * @param suggestions improvement hints, in fixed order; never empty
 */
public record AnalysisSummary(
    List<String> sentences,
    List<String> suggestions
) {
    /**
     * Compact constructor copying the collections.
     */
    public AnalysisSummary {
        sentences = sentences == null ? List.of() : List.copyOf(sentences);
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
    }
}
