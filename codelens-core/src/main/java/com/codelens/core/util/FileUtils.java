package com.codelens.core.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Utility class for file operations.
 */
public final class FileUtils {

    private static final Logger log = LoggerFactory.getLogger(FileUtils.class);

    /** Source argument denoting standard input. */
    public static final String STDIN = "-";

    private FileUtils() {
        // Utility class
    }

    /**
     * Reads a source file as UTF-8 text.
     *
     * @param path path to file
     * @return file content
     * @throws IOException if reading fails
     */
    public static String readSource(Path path) throws IOException {
        return Files.readString(path, StandardCharsets.UTF_8);
    }

    /**
     * Reads all of a stream as UTF-8 text.
     *
     * @param input stream to drain; not closed
     * @return stream content
     * @throws IOException if reading fails
     */
    public static String readSource(InputStream input) throws IOException {
        return new String(input.readAllBytes(), StandardCharsets.UTF_8);
    }

    /**
     * Deletes a directory tree, logging instead of failing on individual entries.
     *
     * @param root directory to delete; ignored if it does not exist
     */
    public static void deleteRecursively(Path root) {
        if (root == null || !Files.exists(root)) {
            return;
        }
        List<Path> paths;
        try (Stream<Path> walk = Files.walk(root)) {
            paths = walk.sorted(Comparator.reverseOrder()).toList();
        } catch (IOException e) {
            log.warn("Failed to list {} for deletion: {}", root, e.getMessage());
            return;
        }
        for (Path path : paths) {
            try {
                Files.deleteIfExists(path);
            } catch (IOException e) {
                log.warn("Failed to delete {}: {}", path, e.getMessage());
            }
        }
    }
}
