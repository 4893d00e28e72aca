package com.codelens.core.visualization;

import com.codelens.core.model.SyntaxTree;

/**
 * Interface for generators that describe a {@link SyntaxTree} as a graph in some diagram syntax.
 *
 * <p>Generated descriptions contain one node per tree node and one edge per parent-child
 * relation. Turning a description into an image is left to a {@link TreeVisualizer}.
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.codelens.core.visualization.TreeDiagramGenerator}
 *
 * @see GeneratedDiagram
 * @see GeneratorConfig
 */
public interface TreeDiagramGenerator {

    /**
     * Returns unique identifier for this generator.
     *
     * <p>Used for referencing the generator in configuration (e.g., "dot", "mermaid").
     *
     * @return unique generator identifier
     */
    String getId();

    /**
     * Returns human-readable display name for this generator.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Returns file extension for generated descriptions, without leading dot.
     *
     * @return file extension
     */
    String getFileExtension();

    /**
     * Generates a graph description of the tree.
     *
     * @param tree tree to describe
     * @param config generation settings
     * @return generated description
     */
    GeneratedDiagram generate(SyntaxTree tree, GeneratorConfig config);
}
