package com.codelens.core.renderer.impl;

import com.codelens.core.renderer.GeneratedFile;
import com.codelens.core.renderer.RenderContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ConsoleRenderer}.
 */
class ConsoleRendererTest {

    private StringWriter buffer;
    private ConsoleRenderer renderer;

    @BeforeEach
    void setUp() {
        buffer = new StringWriter();
        renderer = new ConsoleRenderer(new PrintWriter(buffer));
    }

    @Test
    void getId_returnsConsole() {
        assertThat(renderer.getId()).isEqualTo("console");
    }

    @Test
    void render_singleFileWithoutHeaders_printsContentVerbatim() {
        renderer.render(List.of(new GeneratedFile("a.json", "{\n}\n", "application/json")),
            RenderContext.of(Path.of(".")));

        assertThat(buffer.toString()).isEqualTo("{\n}\n");
    }

    @Test
    void render_multipleFilesWithHeaders_separatesFiles() {
        List<GeneratedFile> output = List.of(
            new GeneratedFile("first.md", "one", null),
            new GeneratedFile("second.md", "two", null));

        renderer.render(output, new RenderContext(Path.of("."), Map.of(ConsoleRenderer.HEADERS_SETTING, "true")));

        String lineSeparator = System.lineSeparator();
        assertThat(buffer.toString())
            .startsWith("first.md" + lineSeparator + "one" + lineSeparator)
            .contains("-".repeat(80))
            .contains("second.md" + lineSeparator + "two");
    }

    @Test
    void render_withColors_wrapsHeadersInAnsiCodes() {
        renderer.render(List.of(new GeneratedFile("a.md", "x", null)),
            new RenderContext(Path.of("."), Map.of("console.colors", "true", ConsoleRenderer.HEADERS_SETTING, "true")));

        assertThat(buffer.toString()).contains("\u001B[1m\u001B[36ma.md\u001B[0m");
    }
}
