package com.codelens.core.renderer;

import com.codelens.core.report.GeneratedReport;
import com.codelens.core.visualization.GeneratedDiagram;

import java.util.Objects;

/**
 * A file produced by an analysis run, ready to be rendered.
 *
 * @param relativePath path relative to the render target, e.g. {@code analysis-3f2a.json}
 * @param content file content
 * @param contentType media type, may be null
 */
public record GeneratedFile(
    String relativePath,
    String content,
    String contentType
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratedFile {
        Objects.requireNonNull(relativePath, "relativePath must not be null");
        Objects.requireNonNull(content, "content must not be null");
    }

    public static GeneratedFile of(GeneratedReport report) {
        return new GeneratedFile(report.fileName(), report.content(), report.contentType());
    }

    /**
     * Wraps a diagram description as a file.
     *
     * @param diagram generated diagram
     * @param baseName file name without extension
     * @return file named by {@link GeneratedDiagram#fileName(String)}
     */
    public static GeneratedFile of(GeneratedDiagram diagram, String baseName) {
        return new GeneratedFile(diagram.fileName(baseName), diagram.content(), "text/plain");
    }
}
