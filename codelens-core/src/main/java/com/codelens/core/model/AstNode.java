package com.codelens.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A node of a {@link SyntaxTree}.
 *
 * <p>Nodes are addressed by their index in the owning tree. Children are stored as
 * indices, in insertion order; the parent is the only owner of a child.
 *
 * @param id index of this node in the tree
 * @param type node kind
 * @param name node name for named kinds (class, method, variable), otherwise {@code null}
 * @param parentId index of the parent node, or {@link #NO_PARENT} for the root
 * @param children indices of child nodes in insertion order
 */
public record AstNode(
    int id,
    AstNodeType type,
    String name,
    int parentId,
    List<Integer> children
) {
    /** Parent index of the root node. */
    public static final int NO_PARENT = -1;

    /**
     * Compact constructor with validation.
     */
    public AstNode {
        Objects.requireNonNull(type, "type must not be null");
        if (id < 0) {
            throw new IllegalArgumentException("id must be >= 0: " + id);
        }
        children = children == null ? List.of() : List.copyOf(children);
    }

    /**
     * Returns the display label of this node, e.g. {@code Class: Main} or {@code Loop}.
     *
     * @return display label
     */
    public String label() {
        return switch (type) {
            case ROOT -> "Root";
            case CLASS -> "Class: " + name;
            case METHOD -> "Method: " + name;
            case LOOP -> "Loop";
            case VARIABLE -> "Variable: " + name;
            case PRINT -> "Print Statement";
        };
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }
}
