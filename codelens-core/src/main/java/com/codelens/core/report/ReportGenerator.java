package com.codelens.core.report;

import com.codelens.core.model.AnalysisResult;

/**
 * Interface for generators that serialize an {@link AnalysisResult} into a report.
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.codelens.core.report.ReportGenerator}
 *
 * @see GeneratedReport
 */
public interface ReportGenerator {

    /**
     * Returns unique identifier for this generator (e.g., "json", "markdown").
     *
     * @return unique generator identifier
     */
    String getId();

    /**
     * Returns human-readable display name for this generator.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Returns file extension for generated reports, without leading dot.
     *
     * @return file extension
     */
    String getFileExtension();

    /**
     * Generates the report.
     *
     * @param result analysis result
     * @return generated report
     */
    GeneratedReport generate(AnalysisResult result);
}
