package com.codelens.core.model;

import java.util.Objects;

/**
 * Reference to a rendered syntax tree image (or diagram source).
 *
 * @param artifactId per-invocation unique identifier, e.g. {@code ast_6f1c...}
 * @param location file name or path of the rendered artifact, or {@code null} if nothing was rendered
 * @param format artifact format, e.g. {@code png}, {@code dot}, {@code md}
 */
public record VisualizationReference(
    String artifactId,
    String location,
    String format
) {
    /**
     * Compact constructor with validation.
     */
    public VisualizationReference {
        Objects.requireNonNull(artifactId, "artifactId must not be null");
    }

    /**
     * Creates a reference for a visualization that was not produced.
     *
     * @param artifactId identifier reserved for the attempt
     * @return reference without a location
     */
    public static VisualizationReference unavailable(String artifactId) {
        return new VisualizationReference(artifactId, null, null);
    }

    public boolean isAvailable() {
        return location != null;
    }
}
