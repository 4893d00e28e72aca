package com.codelens.core.visualization;

import com.codelens.core.model.SyntaxTree;
import com.codelens.core.model.VisualizationReference;

/**
 * External collaborator that turns a syntax tree into a viewable artifact.
 *
 * <p>Output format, resolution and location are collaborator-side configuration.
 */
public interface TreeVisualizer {

    /**
     * Renders the tree.
     *
     * @param tree tree to render
     * @param artifactId unique identifier naming the artifact of this invocation
     * @return reference to the rendered artifact
     * @throws com.codelens.core.execution.CollaboratorUnavailableException if rendering fails
     */
    VisualizationReference visualize(SyntaxTree tree, String artifactId);
}
