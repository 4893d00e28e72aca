package com.codelens.core.model;

import java.util.Objects;

/**
 * Rough time-complexity label derived from the number of loop keywords.
 *
 * @param complexityClass asymptotic class
 * @param loopCount number of loop keyword occurrences; equals the polynomial degree for POLYNOMIAL
 */
public record ComplexityEstimate(
    ComplexityClass complexityClass,
    int loopCount
) {
    /**
     * Compact constructor with validation.
     */
    public ComplexityEstimate {
        Objects.requireNonNull(complexityClass, "complexityClass must not be null");
        if (loopCount < 0) {
            throw new IllegalArgumentException("loopCount must be >= 0: " + loopCount);
        }
    }

    /**
     * Maps a loop count to its complexity estimate.
     *
     * @param loopCount number of loop keyword occurrences
     * @return CONSTANT for 0, LINEAR for 1, POLYNOMIAL otherwise
     */
    public static ComplexityEstimate fromLoopCount(int loopCount) {
        ComplexityClass complexityClass = switch (loopCount) {
            case 0 -> ComplexityClass.CONSTANT;
            case 1 -> ComplexityClass.LINEAR;
            default -> ComplexityClass.POLYNOMIAL;
        };
        return new ComplexityEstimate(complexityClass, loopCount);
    }

    /**
     * Returns the polynomial degree: 0 for constant, 1 for linear, the loop count otherwise.
     *
     * @return degree
     */
    public int degree() {
        return complexityClass == ComplexityClass.CONSTANT ? 0 : loopCount;
    }

    /**
     * Returns the display label, e.g. {@code O(n^2) where 2 is the number of nested loops}.
     *
     * @return label
     */
    public String label() {
        return switch (complexityClass) {
            case CONSTANT -> "O(1)";
            case LINEAR -> "O(n)";
            case POLYNOMIAL -> "O(n^" + loopCount + ") where " + loopCount + " is the number of nested loops";
        };
    }
}
