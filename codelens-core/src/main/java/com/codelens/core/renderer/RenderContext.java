package com.codelens.core.renderer;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Where and how a renderer delivers files.
 *
 * @param outputDirectory target directory for file-based renderers
 * @param settings renderer flags, e.g. {@code console.colors=true}
 */
public record RenderContext(
    Path outputDirectory,
    Map<String, String> settings
) {
    public RenderContext {
        Objects.requireNonNull(outputDirectory, "outputDirectory must not be null");
        settings = settings == null ? Map.of() : Map.copyOf(settings);
    }

    public static RenderContext of(Path outputDirectory) {
        return new RenderContext(outputDirectory, Map.of());
    }

    /**
     * Returns whether a boolean setting is switched on. Absent settings are off.
     *
     * @param key setting key
     * @return true only for the value {@code "true"}, ignoring case
     */
    public boolean isEnabled(String key) {
        return Boolean.parseBoolean(settings.get(key));
    }
}
