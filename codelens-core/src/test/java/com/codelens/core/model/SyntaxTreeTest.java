package com.codelens.core.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link SyntaxTree} and {@link AstNode}.
 */
class SyntaxTreeTest {

    private static SyntaxTree sampleTree() {
        return new SyntaxTree(List.of(
            new AstNode(0, AstNodeType.ROOT, null, AstNode.NO_PARENT, List.of(1, 3)),
            new AstNode(1, AstNodeType.CLASS, "Main", 0, List.of(2)),
            new AstNode(2, AstNodeType.PRINT, null, 1, List.of()),
            new AstNode(3, AstNodeType.VARIABLE, "x", 0, List.of())));
    }

    @Test
    void walk_visitsParentsBeforeChildrenWithDepth() {
        List<String> visited = new ArrayList<>();

        sampleTree().walk((node, depth) -> visited.add(depth + ":" + node.label()));

        assertThat(visited).containsExactly("0:Root", "1:Class: Main", "2:Print Statement", "1:Variable: x");
    }

    @Test
    void toOutline_indentsByDepth() {
        assertThat(sampleTree().toOutline())
            .isEqualTo("Root\n  Class: Main\n    Print Statement\n  Variable: x\n");
    }

    @Test
    void findAll_returnsNodesOfType() {
        assertThat(sampleTree().findAll(AstNodeType.VARIABLE))
            .extracting(AstNode::name)
            .containsExactly("x");
    }

    @Test
    void empty_containsOnlyRoot() {
        SyntaxTree tree = SyntaxTree.empty();

        assertThat(tree.size()).isEqualTo(1);
        assertThat(tree.root().label()).isEqualTo("Root");
    }

    @Test
    void constructor_withoutRoot_throwsException() {
        assertThatThrownBy(() -> new SyntaxTree(List.of(
            new AstNode(0, AstNodeType.LOOP, null, AstNode.NO_PARENT, List.of()))))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("root");
    }

    @Test
    void constructor_withForwardParent_throwsException() {
        assertThatThrownBy(() -> new SyntaxTree(List.of(
            new AstNode(0, AstNodeType.ROOT, null, AstNode.NO_PARENT, List.of(1)),
            new AstNode(1, AstNodeType.LOOP, null, 2, List.of()),
            new AstNode(2, AstNodeType.LOOP, null, 0, List.of()))))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("invalid parent");
    }

    @Test
    void astNode_labels() {
        assertThat(new AstNode(1, AstNodeType.METHOD, "main", 0, null).label()).isEqualTo("Method: main");
        assertThat(new AstNode(1, AstNodeType.LOOP, null, 0, null).label()).isEqualTo("Loop");
    }

    @Test
    void astNodeType_containers() {
        assertThat(AstNodeType.CLASS.isContainer()).isTrue();
        assertThat(AstNodeType.METHOD.isContainer()).isTrue();
        assertThat(AstNodeType.LOOP.isContainer()).isTrue();
        assertThat(AstNodeType.VARIABLE.isContainer()).isFalse();
        assertThat(AstNodeType.PRINT.isContainer()).isFalse();
    }
}
