package com.codelens.core.model;

/**
 * Asymptotic classes produced by the complexity estimator.
 */
public enum ComplexityClass {
    /** No loop keywords: O(1) */
    CONSTANT,

    /** One loop keyword: O(n) */
    LINEAR,

    /** Two or more loop keywords: O(n^k) */
    POLYNOMIAL
}
