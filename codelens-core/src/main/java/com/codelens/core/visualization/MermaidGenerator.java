package com.codelens.core.visualization;

import com.codelens.core.model.AstNode;
import com.codelens.core.model.SyntaxTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Generates Mermaid flowcharts of syntax trees embedded in Markdown.
 *
 * <p>Output renders directly on GitHub, GitLab and in the Mermaid Live Editor, so no
 * external renderer is needed.
 *
 * @see <a href="https://mermaid.js.org/">Mermaid Documentation</a>
 */
public class MermaidGenerator implements TreeDiagramGenerator {

    private static final Logger log = LoggerFactory.getLogger(MermaidGenerator.class);

    private static final String GENERATOR_ID = "mermaid";
    private static final String GENERATOR_DISPLAY_NAME = "Mermaid Diagram Generator";
    private static final String FILE_EXTENSION = "md";

    // Markdown formatting
    private static final String MARKDOWN_HEADER_PREFIX = "# ";
    private static final String CODE_BLOCK_START = "```mermaid\n";
    private static final String CODE_BLOCK_END = "```\n";
    private static final String GRAPH_TD = "graph TD\n";

    @Override
    public String getId() {
        return GENERATOR_ID;
    }

    @Override
    public String getDisplayName() {
        return GENERATOR_DISPLAY_NAME;
    }

    @Override
    public String getFileExtension() {
        return FILE_EXTENSION;
    }

    @Override
    public GeneratedDiagram generate(SyntaxTree tree, GeneratorConfig config) {
        Objects.requireNonNull(tree, "tree must not be null");
        Objects.requireNonNull(config, "config must not be null");

        StringBuilder sb = new StringBuilder();
        sb.append(MARKDOWN_HEADER_PREFIX).append(config.title()).append("\n\n");
        sb.append(CODE_BLOCK_START);
        sb.append(GRAPH_TD);

        for (AstNode node : tree.nodes()) {
            sb.append("  n").append(node.id()).append("[\"").append(escapeLabel(node.label())).append("\"]\n");
        }
        for (AstNode node : tree.nodes()) {
            for (int child : node.children()) {
                sb.append("  n").append(node.id()).append(" --> n").append(child).append('\n');
            }
        }

        sb.append(CODE_BLOCK_END);

        log.debug("Generated Mermaid flowchart with {} nodes", tree.size());
        return new GeneratedDiagram(GENERATOR_ID, sb.toString(), FILE_EXTENSION);
    }

    /**
     * Escapes characters that break quoted Mermaid labels.
     */
    static String escapeLabel(String label) {
        return label.replace("\"", "#quot;");
    }
}
