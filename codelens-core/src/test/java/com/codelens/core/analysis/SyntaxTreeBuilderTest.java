package com.codelens.core.analysis;

import com.codelens.core.model.AstNode;
import com.codelens.core.model.AstNodeType;
import com.codelens.core.model.SyntaxTree;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link SyntaxTreeBuilder}.
 */
class SyntaxTreeBuilderTest {

    private SyntaxTreeBuilder builder;

    @BeforeEach
    void setUp() {
        builder = new SyntaxTreeBuilder();
    }

    @Test
    void build_declarationAndPrintOnOneLine_createsTwoLeavesUnderRoot() {
        SyntaxTree tree = builder.build("int x = 5; System.out.println(x);");

        assertThat(tree.children(tree.root()))
            .extracting(AstNode::label)
            .containsExactly("Variable: x", "Print Statement");
    }

    @Test
    void build_containerAfterLeafOnSameLine_isNotOpened() {
        SyntaxTree tree = builder.build("""
            int x; public static void main(String[] a) {
            String s; public class Inner {
            System.out.println(s);
            }
            """);

        assertThat(tree.toOutline()).isEqualTo("""
            Root
              Variable: x
              Variable: s
              Print Statement
            """);
        assertThat(tree.findAll(AstNodeType.METHOD)).isEmpty();
        assertThat(tree.findAll(AstNodeType.CLASS)).isEmpty();
    }

    @Test
    void build_completeProgram_nestsContainers() {
        String source = """
            public class Main {
                public static void main(String[] args) {
                    int total = 0;
                    for (int i = 0; i < 3; i++) {
                        System.out.println(i);
                    }
                    String done = "ok";
                }
            }
            """;

        SyntaxTree tree = builder.build(source);

        assertThat(tree.toOutline()).isEqualTo("""
            Root
              Class: {
                Method: main
                  Variable: total
                  Loop
                    Print Statement
                  Variable: done
            """);
    }

    @Test
    void build_classHeaderWithoutBrace_usesLastWordAsName() {
        SyntaxTree tree = builder.build("public class Main\n{\n}");

        assertThat(tree.findAll(AstNodeType.CLASS))
            .extracting(AstNode::name)
            .containsExactly("Main");
    }

    @Test
    void build_strayClosingBrace_doesNotUnderflow() {
        SyntaxTree tree = builder.build("}\n}\nint y = 1;");

        assertThat(tree.children(tree.root()))
            .extracting(AstNode::label)
            .containsExactly("Variable: y");
    }

    @Test
    void build_closingBraceReturnsToEnclosingContainer() {
        String source = """
            while (running) {
            int a = 1;
            }
            int b = 2;
            """;

        SyntaxTree tree = builder.build(source);

        AstNode loop = tree.findAll(AstNodeType.LOOP).get(0);
        assertThat(tree.children(loop)).extracting(AstNode::label).containsExactly("Variable: a");
        assertThat(tree.children(tree.root())).extracting(AstNode::label).containsExactly("Loop", "Variable: b");
    }

    @Test
    void build_singleLineLoopWithClosingBrace_opensAndClosesOnSameLine() {
        SyntaxTree tree = builder.build("if (x > 0) { for (int i=0;i<n;i++) { } }\nint z = 3;");

        assertThat(tree.children(tree.root()))
            .extracting(AstNode::label)
            .containsExactly("Loop", "Variable: z");
    }

    @Test
    void build_typeKeywordWithoutName_createsNoNode() {
        SyntaxTree tree = builder.build("int\nString");

        assertThat(tree.size()).isEqualTo(1);
    }

    @Test
    void build_variableNameStripsTerminatorAndAssignment() {
        SyntaxTree tree = builder.build("double rate=0.5;\nint count;");

        assertThat(tree.findAll(AstNodeType.VARIABLE))
            .extracting(AstNode::name)
            .containsExactly("rate0.5", "count");
    }

    @Test
    void build_typeKeywordPrefixWithoutSpace_isStillAVariable() {
        SyntaxTree tree = builder.build("integer value = 1;");

        assertThat(tree.findAll(AstNodeType.VARIABLE))
            .extracting(AstNode::name)
            .containsExactly("value");
    }

    @Test
    void build_emptyInput_returnsRootOnly() {
        SyntaxTree tree = builder.build("");

        assertThat(tree.size()).isEqualTo(1);
        assertThat(tree.root().isLeaf()).isTrue();
    }

    @Test
    void build_customRules_areAppliedInOrder() {
        SyntaxTreeBuilder printOnly = new SyntaxTreeBuilder(List.of(
            new LineRule(AstNodeType.PRINT, line -> line.contains("print"), line -> null)));

        SyntaxTree tree = printOnly.build("int x = 1;\nprint(x);");

        assertThat(tree.children(tree.root())).extracting(AstNode::type).containsExactly(AstNodeType.PRINT);
    }

    @Test
    void build_parentsPrecedeChildren() {
        SyntaxTree tree = builder.build("public class A {\nfor (;;) {\nint q = 1;\n}\n}");

        for (AstNode node : tree.nodes()) {
            if (node.id() > 0) {
                assertThat(node.parentId()).isLessThan(node.id());
            }
        }
    }
}
