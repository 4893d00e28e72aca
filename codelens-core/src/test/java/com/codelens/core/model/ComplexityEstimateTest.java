package com.codelens.core.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ComplexityEstimate}.
 */
class ComplexityEstimateTest {

    @Test
    void fromLoopCount_mapsCountsToClasses() {
        assertThat(ComplexityEstimate.fromLoopCount(0).complexityClass()).isEqualTo(ComplexityClass.CONSTANT);
        assertThat(ComplexityEstimate.fromLoopCount(1).complexityClass()).isEqualTo(ComplexityClass.LINEAR);
        assertThat(ComplexityEstimate.fromLoopCount(3).complexityClass()).isEqualTo(ComplexityClass.POLYNOMIAL);
    }

    @Test
    void label_polynomial_namesDegree() {
        assertThat(ComplexityEstimate.fromLoopCount(3).label())
            .isEqualTo("O(n^3) where 3 is the number of nested loops");
    }

    @Test
    void constructor_negativeLoopCount_throwsException() {
        assertThatThrownBy(() -> new ComplexityEstimate(ComplexityClass.CONSTANT, -1))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
