package com.codelens.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.BiConsumer;

/**
 * Heuristic abstract syntax tree stored as an arena of nodes.
 *
 * <p>Node {@code 0} is always the {@link AstNodeType#ROOT}. Every other node has exactly
 * one parent with a smaller index, so the structure is a tree without sharing or cycles.
 *
 * @param nodes all nodes, indexed by {@link AstNode#id()}
 */
public record SyntaxTree(
    List<AstNode> nodes
) {
    /**
     * Compact constructor with validation.
     */
    public SyntaxTree {
        Objects.requireNonNull(nodes, "nodes must not be null");
        nodes = List.copyOf(nodes);
        if (nodes.isEmpty() || nodes.get(0).type() != AstNodeType.ROOT) {
            throw new IllegalArgumentException("node 0 must be the root");
        }
        for (int i = 0; i < nodes.size(); i++) {
            AstNode node = nodes.get(i);
            if (node.id() != i) {
                throw new IllegalArgumentException("node at index " + i + " has id " + node.id());
            }
            if (i > 0 && (node.parentId() < 0 || node.parentId() >= i)) {
                throw new IllegalArgumentException("node " + i + " has invalid parent " + node.parentId());
            }
        }
    }

    /**
     * Creates a tree containing only the root node.
     *
     * @return degenerate tree
     */
    public static SyntaxTree empty() {
        return new SyntaxTree(List.of(new AstNode(0, AstNodeType.ROOT, null, AstNode.NO_PARENT, List.of())));
    }

    public AstNode root() {
        return nodes.get(0);
    }

    public AstNode node(int id) {
        return nodes.get(id);
    }

    public int size() {
        return nodes.size();
    }

    /**
     * Returns the children of a node in insertion order.
     *
     * @param node parent node
     * @return child nodes
     */
    public List<AstNode> children(AstNode node) {
        return node.children().stream().map(nodes::get).toList();
    }

    /**
     * Visits every node depth-first, parents before children.
     *
     * @param visitor receives each node and its depth (root = 0)
     */
    public void walk(BiConsumer<AstNode, Integer> visitor) {
        walk(root(), 0, visitor);
    }

    private void walk(AstNode node, int depth, BiConsumer<AstNode, Integer> visitor) {
        visitor.accept(node, depth);
        for (AstNode child : children(node)) {
            walk(child, depth + 1, visitor);
        }
    }

    /**
     * Returns all nodes of a given type in depth-first order.
     *
     * @param type node type
     * @return matching nodes
     */
    public List<AstNode> findAll(AstNodeType type) {
        List<AstNode> found = new ArrayList<>();
        walk((node, depth) -> {
            if (node.type() == type) {
                found.add(node);
            }
        });
        return found;
    }

    /**
     * Renders the tree as an indented outline, one node label per line.
     *
     * @return outline text
     */
    public String toOutline() {
        StringBuilder sb = new StringBuilder();
        walk((node, depth) -> sb.append("  ".repeat(depth)).append(node.label()).append('\n'));
        return sb.toString();
    }
}
