package com.codelens.core.report;

import java.util.Objects;

/**
 * Rendered analysis report.
 *
 * @param fileName suggested file name, e.g. {@code analysis-3f2a9c.json}
 * @param content report content
 * @param contentType media type of the content
 */
public record GeneratedReport(
    String fileName,
    String content,
    String contentType
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratedReport {
        Objects.requireNonNull(fileName, "fileName must not be null");
        Objects.requireNonNull(content, "content must not be null");
        Objects.requireNonNull(contentType, "contentType must not be null");
    }
}
