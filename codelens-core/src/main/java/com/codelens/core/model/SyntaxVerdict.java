package com.codelens.core.model;

/**
 * Overall outcome of structure validation.
 */
public enum SyntaxVerdict {
    CORRECT("Correct"),
    INCORRECT("Incorrect");

    private final String label;

    SyntaxVerdict(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
