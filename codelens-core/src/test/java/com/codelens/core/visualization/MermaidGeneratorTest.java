package com.codelens.core.visualization;

import com.codelens.core.analysis.SyntaxTreeBuilder;
import com.codelens.core.model.SyntaxTree;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link MermaidGenerator}.
 */
class MermaidGeneratorTest {

    private MermaidGenerator generator;

    @BeforeEach
    void setUp() {
        generator = new MermaidGenerator();
    }

    @Test
    void getId_returnsCorrectId() {
        assertThat(generator.getId()).isEqualTo("mermaid");
        assertThat(generator.getFileExtension()).isEqualTo("md");
    }

    @Test
    void generate_wrapsFlowchartInMarkdown() {
        SyntaxTree tree = new SyntaxTreeBuilder().build("while (true) {\nSystem.out.println(1);\n}");

        GeneratedDiagram diagram = generator.generate(tree, GeneratorConfig.defaults());

        assertThat(diagram.content()).isEqualTo("""
            # AST

            ```mermaid
            graph TD
              n0["Root"]
              n1["Loop"]
              n2["Print Statement"]
              n0 --> n1
              n1 --> n2
            ```
            """);
    }

    @Test
    void escapeLabel_replacesDoubleQuotes() {
        assertThat(MermaidGenerator.escapeLabel("Variable: \"x\"")).isEqualTo("Variable: #quot;x#quot;");
    }
}
