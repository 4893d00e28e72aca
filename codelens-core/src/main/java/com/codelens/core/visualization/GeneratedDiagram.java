package com.codelens.core.visualization;

import java.util.Objects;

/**
 * Diagram source produced for one syntax tree.
 *
 * @param generatorId id of the producing {@link TreeDiagramGenerator}
 * @param content diagram source (DOT, Mermaid, ...)
 * @param fileExtension extension of the source file, without the dot
 */
public record GeneratedDiagram(
    String generatorId,
    String content,
    String fileExtension
) {
    public GeneratedDiagram {
        Objects.requireNonNull(generatorId, "generatorId must not be null");
        Objects.requireNonNull(content, "content must not be null");
        Objects.requireNonNull(fileExtension, "fileExtension must not be null");
    }

    /**
     * Returns the file name for this diagram's source.
     *
     * @param baseName name without extension, e.g. an artifact id
     * @return {@code <baseName>.<fileExtension>}
     */
    public String fileName(String baseName) {
        return baseName + "." + fileExtension;
    }
}
