package com.codelens.core.visualization;

import com.codelens.core.execution.CollaboratorUnavailableException;
import com.codelens.core.model.SyntaxTree;
import com.codelens.core.model.VisualizationReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Writes the diagram description itself as the visualization artifact.
 *
 * <p>Used with text-rendered formats such as Mermaid, which need no external binary.
 */
public class DiagramFileVisualizer implements TreeVisualizer {

    private static final Logger log = LoggerFactory.getLogger(DiagramFileVisualizer.class);

    private final TreeDiagramGenerator generator;
    private final GeneratorConfig config;
    private final Path outputDirectory;

    public DiagramFileVisualizer(TreeDiagramGenerator generator, GeneratorConfig config, Path outputDirectory) {
        this.generator = Objects.requireNonNull(generator, "generator must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.outputDirectory = Objects.requireNonNull(outputDirectory, "outputDirectory must not be null");
    }

    @Override
    public VisualizationReference visualize(SyntaxTree tree, String artifactId) {
        Objects.requireNonNull(tree, "tree must not be null");
        Objects.requireNonNull(artifactId, "artifactId must not be null");

        GeneratedDiagram diagram = generator.generate(tree, config);
        String fileName = diagram.fileName(artifactId);
        Path target = outputDirectory.resolve(fileName);

        try {
            Files.createDirectories(outputDirectory);
            Files.writeString(target, diagram.content(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new CollaboratorUnavailableException(GraphvizTreeVisualizer.COLLABORATOR,
                "Failed to write " + target + ": " + e.getMessage(), e);
        }

        log.info("Wrote {} diagram to {}", generator.getId(), target);
        return new VisualizationReference(artifactId, fileName, diagram.fileExtension());
    }
}
