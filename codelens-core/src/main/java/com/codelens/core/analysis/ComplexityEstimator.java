package com.codelens.core.analysis;

import com.codelens.core.model.ComplexityEstimate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Estimates time complexity from the number of loop keyword occurrences.
 *
 * <p>Occurrences are raw substring counts over the whole source, so {@code format}
 * or a {@code "while"} inside a string literal count as loops.
 */
public class ComplexityEstimator {

    private static final Logger log = LoggerFactory.getLogger(ComplexityEstimator.class);

    /**
     * Estimates the complexity. Never fails.
     *
     * @param source source text
     * @return O(1) for no loops, O(n) for one, O(n^k) for k >= 2
     */
    public ComplexityEstimate estimate(String source) {
        Objects.requireNonNull(source, "source must not be null");

        int loops = SourcePatterns.LOOP_KEYWORDS.stream()
            .mapToInt(keyword -> SourcePatterns.countOccurrences(source, keyword))
            .sum();

        ComplexityEstimate estimate = ComplexityEstimate.fromLoopCount(loops);
        log.debug("Counted {} loop keywords: {}", loops, estimate.label());
        return estimate;
    }
}
