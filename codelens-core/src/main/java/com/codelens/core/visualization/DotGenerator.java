package com.codelens.core.visualization;

import com.codelens.core.model.AstNode;
import com.codelens.core.model.SyntaxTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Generates Graphviz DOT descriptions of syntax trees.
 *
 * <p>Node identifiers are derived from arena indices ({@code n0} is the root), so labels
 * may repeat without clashing. Resolution and size are emitted as graph attributes.
 *
 * <p><b>Example output:</b>
 * <pre>{@code
 * // AST
 * digraph {
 *   graph [dpi="300" size="10,10"]
 *   n0 [label="Root"]
 *   n1 [label="Variable: x"]
 *   n0 -> n1
 * }
 * }</pre>
 */
public class DotGenerator implements TreeDiagramGenerator {

    private static final Logger log = LoggerFactory.getLogger(DotGenerator.class);

    public static final String ID = "dot";
    private static final String GENERATOR_DISPLAY_NAME = "Graphviz DOT Generator";
    private static final String FILE_EXTENSION = "dot";

    private static final String NODE_PREFIX = "n";
    private static final String INDENT = "  ";

    @Override
    public String getId() {
        return ID;
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
        sb.append("// ").append(config.title()).append('\n');
        sb.append("digraph {\n");
        sb.append(INDENT).append("graph [dpi=").append(quote(String.valueOf(config.dpi())))
            .append(" size=").append(quote(config.size())).append("]\n");

        for (AstNode node : tree.nodes()) {
            sb.append(INDENT).append(NODE_PREFIX).append(node.id())
                .append(" [label=").append(quote(node.label())).append("]\n");
        }
        for (AstNode node : tree.nodes()) {
            for (int child : node.children()) {
                sb.append(INDENT).append(NODE_PREFIX).append(node.id())
                    .append(" -> ").append(NODE_PREFIX).append(child).append('\n');
            }
        }
        sb.append("}\n");

        log.debug("Generated DOT description with {} nodes", tree.size());
        return new GeneratedDiagram(ID, sb.toString(), FILE_EXTENSION);
    }

    /**
     * Quotes a DOT string, escaping backslashes and double quotes.
     */
    static String quote(String value) {
        return "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }
}
