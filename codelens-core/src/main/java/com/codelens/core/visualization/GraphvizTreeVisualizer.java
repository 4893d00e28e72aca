package com.codelens.core.visualization;

import com.codelens.core.execution.CollaboratorUnavailableException;
import com.codelens.core.execution.CommandExecutor;
import com.codelens.core.execution.CommandResult;
import com.codelens.core.model.SyntaxTree;
import com.codelens.core.model.VisualizationReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Renders syntax trees to images with the Graphviz {@code dot} binary.
 *
 * <p>Writes {@code <artifactId>.dot} to the output directory, runs
 * {@code dot -T<format> -o <artifactId>.<format> <artifactId>.dot} and removes the DOT
 * source afterwards. The returned reference holds the image file name.
 */
public class GraphvizTreeVisualizer implements TreeVisualizer {

    private static final Logger log = LoggerFactory.getLogger(GraphvizTreeVisualizer.class);

    static final String COLLABORATOR = "visualization";

    private final DotGenerator generator;
    private final GeneratorConfig config;
    private final CommandExecutor executor;
    private final Path outputDirectory;
    private final String dotExecutable;
    private final String format;
    private final Duration timeout;

    /**
     * @param generator DOT generator
     * @param config generator settings (title, dpi, size)
     * @param executor process runner
     * @param outputDirectory directory receiving images; created if missing
     * @param dotExecutable Graphviz binary, e.g. {@code dot}
     * @param format image format, e.g. {@code png}
     * @param timeout renderer timeout
     */
    public GraphvizTreeVisualizer(DotGenerator generator, GeneratorConfig config, CommandExecutor executor,
                                  Path outputDirectory, String dotExecutable, String format, Duration timeout) {
        this.generator = Objects.requireNonNull(generator, "generator must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.outputDirectory = Objects.requireNonNull(outputDirectory, "outputDirectory must not be null");
        this.dotExecutable = Objects.requireNonNull(dotExecutable, "dotExecutable must not be null");
        this.format = Objects.requireNonNull(format, "format must not be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
    }

    @Override
    public VisualizationReference visualize(SyntaxTree tree, String artifactId) {
        Objects.requireNonNull(tree, "tree must not be null");
        Objects.requireNonNull(artifactId, "artifactId must not be null");

        GeneratedDiagram diagram = generator.generate(tree, config);
        String sourceName = diagram.fileName(artifactId);
        String imageName = artifactId + "." + format;
        Path sourceFile = outputDirectory.resolve(sourceName);

        try {
            Files.createDirectories(outputDirectory);
            Files.writeString(sourceFile, diagram.content(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new CollaboratorUnavailableException(COLLABORATOR,
                "Failed to write " + sourceFile + ": " + e.getMessage(), e);
        }

        try {
            CommandResult result = executor.execute(
                List.of(dotExecutable, "-T" + format, "-o", imageName, sourceName), outputDirectory, timeout);

            if (result.timedOut()) {
                throw new CollaboratorUnavailableException(COLLABORATOR,
                    "Graphviz exceeded the timeout of " + timeout.toSeconds() + " seconds");
            }
            if (result.exitCode() != 0) {
                throw new CollaboratorUnavailableException(COLLABORATOR,
                    "Graphviz exited with code " + result.exitCode() + ": " + result.stderr().strip());
            }
        } finally {
            deleteSource(sourceFile);
        }

        log.info("Rendered syntax tree to {}", outputDirectory.resolve(imageName));
        return new VisualizationReference(artifactId, imageName, format);
    }

    private void deleteSource(Path sourceFile) {
        try {
            Files.deleteIfExists(sourceFile);
        } catch (IOException e) {
            log.warn("Failed to remove DOT source {}: {}", sourceFile, e.getMessage());
        }
    }
}
