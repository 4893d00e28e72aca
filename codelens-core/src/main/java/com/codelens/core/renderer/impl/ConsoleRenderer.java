package com.codelens.core.renderer.impl;

import com.codelens.core.renderer.GeneratedFile;
import com.codelens.core.renderer.OutputRenderer;
import com.codelens.core.renderer.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.util.List;
import java.util.Objects;

/**
 * Renderer that prints generated files to a console stream.
 *
 * <p><b>Settings:</b>
 * <ul>
 *   <li>{@value #COLORS_SETTING} - ANSI colors for headers (default: off)</li>
 *   <li>{@value #HEADERS_SETTING} - print a header per file (default: off)</li>
 * </ul>
 *
 * <p>With headers off, a single file is printed verbatim so the output can be piped.
 */
public class ConsoleRenderer implements OutputRenderer {

    public static final String COLORS_SETTING = "console.colors";
    public static final String HEADERS_SETTING = "console.showHeaders";

    private static final Logger logger = LoggerFactory.getLogger(ConsoleRenderer.class);

    // ANSI color codes
    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_BOLD = "\u001B[1m";
    private static final String ANSI_CYAN = "\u001B[36m";
    private static final String ANSI_YELLOW = "\u001B[33m";

    private static final String SEPARATOR = "-".repeat(80);

    private final PrintWriter out;

    public ConsoleRenderer() {
        this(new PrintWriter(System.out, true));
    }

    public ConsoleRenderer(PrintWriter out) {
        this.out = Objects.requireNonNull(out, "out must not be null");
    }

    @Override
    public String getId() {
        return "console";
    }

    @Override
    public void render(List<GeneratedFile> files, RenderContext context) {
        boolean useColors = context.isEnabled(COLORS_SETTING);
        boolean showHeaders = context.isEnabled(HEADERS_SETTING);
        logger.debug("Rendering {} files to console (colors: {}, headers: {})", files.size(), useColors, showHeaders);

        for (int i = 0; i < files.size(); i++) {
            GeneratedFile file = files.get(i);
            if (i > 0) {
                out.println(color(SEPARATOR, ANSI_YELLOW, useColors));
            }
            if (showHeaders) {
                out.println(color(file.relativePath(), ANSI_BOLD + ANSI_CYAN, useColors));
            }
            out.print(file.content());
            if (!file.content().endsWith("\n")) {
                out.println();
            }
        }
        out.flush();
    }

    private static String color(String text, String code, boolean useColors) {
        return useColors ? code + text + ANSI_RESET : text;
    }
}
