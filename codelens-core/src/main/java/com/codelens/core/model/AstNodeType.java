package com.codelens.core.model;

/**
 * Node kinds recognized by the heuristic syntax tree builder.
 */
public enum AstNodeType {
    /** Unique entry point of every tree */
    ROOT(true),

    /** Class declaration; named after the last word of its header line */
    CLASS(true),

    /** Entry-point method; always named "main" */
    METHOD(true),

    /** {@code for} or {@code while} loop */
    LOOP(true),

    /** Primitive or String variable declaration */
    VARIABLE(false),

    /** Console print statement */
    PRINT(false);

    private final boolean container;

    AstNodeType(boolean container) {
        this.container = container;
    }

    /**
     * Returns true if nodes of this type open a nesting level.
     *
     * @return true for containers, false for leaves
     */
    public boolean isContainer() {
        return container;
    }
}
