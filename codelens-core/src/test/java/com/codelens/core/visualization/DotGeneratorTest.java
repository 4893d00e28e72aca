package com.codelens.core.visualization;

import com.codelens.core.analysis.SyntaxTreeBuilder;
import com.codelens.core.model.SyntaxTree;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link DotGenerator}.
 */
class DotGeneratorTest {

    private DotGenerator generator;

    @BeforeEach
    void setUp() {
        generator = new DotGenerator();
    }

    @Test
    void metadata() {
        assertThat(generator.getId()).isEqualTo("dot");
        assertThat(generator.getDisplayName()).isEqualTo("Graphviz DOT Generator");
        assertThat(generator.getFileExtension()).isEqualTo("dot");
    }

    @Test
    void generate_emitsOneNodePerTreeNodeAndOneEdgePerChild() {
        SyntaxTree tree = new SyntaxTreeBuilder().build("int x = 5; System.out.println(x);");

        GeneratedDiagram diagram = generator.generate(tree, GeneratorConfig.defaults());

        assertThat(diagram.content()).isEqualTo("""
            // AST
            digraph {
              graph [dpi="300" size="10,10"]
              n0 [label="Root"]
              n1 [label="Variable: x"]
              n2 [label="Print Statement"]
              n0 -> n1
              n0 -> n2
            }
            """);
        assertThat(diagram.fileExtension()).isEqualTo("dot");
    }

    @Test
    void generate_usesConfiguredResolution() {
        GeneratedDiagram diagram = generator.generate(SyntaxTree.empty(), new GeneratorConfig("Tree", 96, "4,3"));

        assertThat(diagram.content())
            .startsWith("// Tree\n")
            .contains("graph [dpi=\"96\" size=\"4,3\"]");
    }

    @Test
    void quote_escapesQuotesAndBackslashes() {
        assertThat(DotGenerator.quote("Class: \"A\\B\"")).isEqualTo("\"Class: \\\"A\\\\B\\\"\"");
    }

    @Test
    void generate_withNullTree_throwsException() {
        assertThatThrownBy(() -> generator.generate(null, GeneratorConfig.defaults()))
            .isInstanceOf(NullPointerException.class);
    }
}
