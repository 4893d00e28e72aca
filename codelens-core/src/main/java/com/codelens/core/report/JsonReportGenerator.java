package com.codelens.core.report;

import com.codelens.core.model.AnalysisResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serializes analysis results as pretty-printed JSON.
 *
 * <p>The document is a {@link ResultPayload}: execution status and output, token
 * frequencies, invalid tokens, syntax verdict and errors, complexity label, summary,
 * suggestions, visualization reference, the nested syntax tree and collaborator errors.
 */
public class JsonReportGenerator implements ReportGenerator {

    private static final Logger log = LoggerFactory.getLogger(JsonReportGenerator.class);

    private static final String GENERATOR_ID = "json";
    private static final String GENERATOR_DISPLAY_NAME = "JSON Report Generator";
    private static final String FILE_EXTENSION = "json";
    private static final String CONTENT_TYPE = "application/json";

    private final ObjectWriter writer = new ObjectMapper().writerWithDefaultPrettyPrinter();

    @Override
    public String getId() {
        return GENERATOR_ID;
    }

    @Override
    public String getDisplayName() {
        return GENERATOR_DISPLAY_NAME;
    }

    @Override
    public String getFileExtension() {
        return FILE_EXTENSION;
    }

    @Override
    public GeneratedReport generate(AnalysisResult result) {
        log.debug("Generating JSON report for source {}", result.sourceId());
        try {
            String content = writer.writeValueAsString(ResultPayload.from(result));
            return new GeneratedReport(ReportNames.fileName(result, FILE_EXTENSION), content, CONTENT_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize analysis result " + result.sourceId(), e);
        }
    }
}
