package com.codelens.core.visualization;

import com.codelens.core.config.CodeLensConfig;

import java.util.Objects;

/**
 * Configuration for diagram generation.
 *
 * @param title diagram title
 * @param dpi image resolution hint
 * @param size image size hint in inches, e.g. {@code 10,10}
 */
public record GeneratorConfig(
    String title,
    int dpi,
    String size
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratorConfig {
        Objects.requireNonNull(title, "title must not be null");
        if (dpi <= 0) {
            dpi = 300;
        }
        if (size == null || size.isBlank()) {
            size = "10,10";
        }
    }

    /**
     * Creates a default configuration.
     *
     * @return default generator config
     */
    public static GeneratorConfig defaults() {
        return new GeneratorConfig("AST", 300, "10,10");
    }

    /**
     * Creates a configuration from the visualization settings.
     *
     * @param settings visualization settings
     * @return generator config
     */
    public static GeneratorConfig from(CodeLensConfig.VisualizationSettings settings) {
        return new GeneratorConfig("AST", settings.dpi(), settings.size());
    }
}
