package com.codelens.core.renderer;

import java.util.List;

/**
 * Delivers the files of one analysis run (a report, optionally diagram sources).
 *
 * <p>Looked up by {@link #getId()} through {@code META-INF/services/com.codelens.core.renderer.OutputRenderer}.
 */
public interface OutputRenderer {

    /**
     * @return lowercase id used on the command line, e.g. {@code console}
     */
    String getId();

    /**
     * Delivers the files in list order.
     *
     * @param files files to deliver
     * @param context target directory and renderer flags
     * @throws IllegalStateException if a file cannot be written
     */
    void render(List<GeneratedFile> files, RenderContext context);
}
