package com.codelens.core.renderer.impl;

import com.codelens.core.renderer.GeneratedFile;
import com.codelens.core.renderer.RenderContext;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link FileSystemRenderer}.
 */
class FileSystemRendererTest {

    @TempDir
    Path tempDir;

    private final FileSystemRenderer renderer = new FileSystemRenderer();

    @Test
    void getId_returnsFilesystem() {
        assertThat(renderer.getId()).isEqualTo("filesystem");
    }

    @Test
    void render_writesFilesCreatingDirectories() throws IOException {
        Path outputDir = tempDir.resolve("reports");
        List<GeneratedFile> output = List.of(
            new GeneratedFile("analysis.json", "{}", "application/json"),
            new GeneratedFile("diagrams/ast.dot", "digraph {}", "text/plain"));

        renderer.render(output, RenderContext.of(outputDir));

        assertThat(Files.readString(outputDir.resolve("analysis.json"))).isEqualTo("{}");
        assertThat(Files.readString(outputDir.resolve("diagrams/ast.dot"))).isEqualTo("digraph {}");
    }

    @Test
    void render_overwritesExistingFile() throws IOException {
        Files.writeString(tempDir.resolve("analysis.json"), "old");

        renderer.render(List.of(new GeneratedFile("analysis.json", "new", null)),
            RenderContext.of(tempDir));

        assertThat(Files.readString(tempDir.resolve("analysis.json"))).isEqualTo("new");
    }

    @Test
    void render_pathEscapingOutputDirectory_throwsException() {
        List<GeneratedFile> output = List.of(new GeneratedFile("../escape.txt", "x", null));

        assertThatThrownBy(() -> renderer.render(output, RenderContext.of(tempDir.resolve("out"))))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("escapes");
    }
}
