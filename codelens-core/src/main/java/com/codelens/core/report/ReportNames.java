package com.codelens.core.report;

import com.codelens.core.model.AnalysisResult;

/**
 * File naming shared by report generators.
 */
final class ReportNames {

    private static final String PREFIX = "analysis-";

    private ReportNames() {
    }

    static String fileName(AnalysisResult result, String extension) {
        return PREFIX + result.sourceId() + "." + extension;
    }
}
