package com.codelens.core.report;

import com.codelens.core.model.AnalysisResult;
import com.codelens.core.model.TokenReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Generates a human-readable Markdown report of an analysis result.
 *
 * <p>Sections: overview table, execution, tokens, structure, syntax tree, summary and
 * suggestions. Collaborator errors are listed last when present.
 */
public class MarkdownReportGenerator implements ReportGenerator {

    private static final Logger log = LoggerFactory.getLogger(MarkdownReportGenerator.class);

    private static final String GENERATOR_ID = "markdown";
    private static final String GENERATOR_DISPLAY_NAME = "Markdown Report Generator";
    private static final String FILE_EXTENSION = "md";
    private static final String CONTENT_TYPE = "text/markdown";

    // Markdown formatting constants
    private static final String H1 = "# ";
    private static final String H2 = "## ";
    private static final String CODE_FENCE = "```";
    private static final String BULLET = "- ";
    private static final String NEWLINE = "\n";
    private static final String PIPE = "|";

    // Section headers
    private static final String TITLE = "Code Analysis Report";
    private static final String EXECUTION_SECTION = "Execution";
    private static final String TOKENS_SECTION = "Tokens";
    private static final String STRUCTURE_SECTION = "Structure";
    private static final String TREE_SECTION = "Syntax Tree";
    private static final String SUMMARY_SECTION = "Summary";
    private static final String SUGGESTIONS_SECTION = "Suggestions";
    private static final String COLLABORATOR_SECTION = "Collaborator Errors";

    private static final String NONE = "None";

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
        log.debug("Generating Markdown report for source {}", result.sourceId());
        StringBuilder md = new StringBuilder();

        md.append(H1).append(TITLE).append(NEWLINE).append(NEWLINE);
        appendOverview(md, result);
        appendExecution(md, result);
        appendTokens(md, result.tokens());
        appendList(md, STRUCTURE_SECTION, result.structure().messages());
        appendTree(md, result);
        appendList(md, SUMMARY_SECTION, result.summary().sentences());
        appendList(md, SUGGESTIONS_SECTION, result.summary().suggestions());
        if (result.hasCollaboratorFailures()) {
            appendList(md, COLLABORATOR_SECTION, result.collaboratorFailures());
        }

        return new GeneratedReport(ReportNames.fileName(result, FILE_EXTENSION), md.toString(), CONTENT_TYPE);
    }

    private void appendOverview(StringBuilder md, AnalysisResult result) {
        md.append("| Metric | Value |").append(NEWLINE);
        md.append("|--------|-------|").append(NEWLINE);
        row(md, "Source", "`" + result.sourceId() + "`");
        row(md, "Syntax", result.verdict().label());
        row(md, "Time Complexity", result.complexity().label());
        row(md, "Execution", result.execution().status().label());
        row(md, "Tokens", result.tokens().totalTokens() + " (" + result.tokens().distinctTokens() + " distinct)");
        row(md, "AST Image", result.visualization().isAvailable() ? result.visualization().location() : NONE);
        md.append(NEWLINE);
    }

    private void appendExecution(StringBuilder md, AnalysisResult result) {
        md.append(H2).append(EXECUTION_SECTION).append(NEWLINE).append(NEWLINE);
        md.append("**Status:** ").append(result.execution().status().label()).append(NEWLINE).append(NEWLINE);
        if (!result.execution().output().isEmpty()) {
            appendFenced(md, result.execution().output().stripTrailing() + NEWLINE);
        }
    }

    private void appendTokens(StringBuilder md, TokenReport tokens) {
        md.append(H2).append(TOKENS_SECTION).append(NEWLINE).append(NEWLINE);
        if (tokens.frequencies().isEmpty()) {
            md.append(NONE).append(NEWLINE).append(NEWLINE);
            return;
        }
        md.append("| Token | Count |").append(NEWLINE);
        md.append("|-------|-------|").append(NEWLINE);
        for (Map.Entry<String, Integer> entry : tokens.frequencies().entrySet()) {
            row(md, "`" + escape(entry.getKey()) + "`", String.valueOf(entry.getValue()));
        }
        md.append(NEWLINE);
        md.append("**Invalid tokens:** ")
            .append(tokens.invalidTokens().isEmpty() ? NONE : String.join(", ", tokens.invalidTokens()))
            .append(NEWLINE).append(NEWLINE);
    }

    private void appendTree(StringBuilder md, AnalysisResult result) {
        md.append(H2).append(TREE_SECTION).append(NEWLINE).append(NEWLINE);
        appendFenced(md, result.syntaxTree().toOutline());
    }

    /**
     * Appends a code block whose fence is longer than any backtick run in the content.
     */
    private void appendFenced(StringBuilder md, String content) {
        int longestRun = 0;
        int run = 0;
        for (int i = 0; i < content.length(); i++) {
            run = content.charAt(i) == '`' ? run + 1 : 0;
            longestRun = Math.max(longestRun, run);
        }
        String fence = longestRun < CODE_FENCE.length() ? CODE_FENCE : "`".repeat(longestRun + 1);
        md.append(fence).append(NEWLINE);
        md.append(content);
        md.append(fence).append(NEWLINE).append(NEWLINE);
    }

    private void appendList(StringBuilder md, String title, List<String> items) {
        md.append(H2).append(title).append(NEWLINE).append(NEWLINE);
        if (items.isEmpty()) {
            md.append(NONE).append(NEWLINE).append(NEWLINE);
            return;
        }
        for (String item : items) {
            md.append(BULLET).append(item).append(NEWLINE);
        }
        md.append(NEWLINE);
    }

    private void row(StringBuilder md, String metric, String value) {
        md.append(PIPE).append(' ').append(metric).append(' ')
            .append(PIPE).append(' ').append(value).append(' ')
            .append(PIPE).append(NEWLINE);
    }

    private static String escape(String text) {
        return text.replace("|", "\\|");
    }
}
