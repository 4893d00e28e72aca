package com.codelens.cli;

import com.codelens.core.util.FileUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Paths;

/**
 * Reads the source argument shared by all analysis commands.
 *
 * <p>The argument is a file path, or {@code -} for standard input.
 */
final class SourceInput {

    private SourceInput() {
        // Utility class
    }

    static String read(String source, InputStream stdin) throws IOException {
        if (FileUtils.STDIN.equals(source)) {
            return FileUtils.readSource(stdin);
        }
        return FileUtils.readSource(Paths.get(source));
    }

    static String describe(String source) {
        return FileUtils.STDIN.equals(source) ? "<stdin>" : source;
    }
}
