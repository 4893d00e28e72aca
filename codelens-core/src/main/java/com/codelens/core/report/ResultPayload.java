package com.codelens.core.report;

import com.codelens.core.model.AnalysisResult;
import com.codelens.core.model.AstNode;
import com.codelens.core.model.SyntaxTree;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Flat, serialization-ready view of an {@link AnalysisResult}.
 *
 * <p>Timings are seconds rounded to four decimals. {@code ast_image} is {@code null} when
 * no visualization was produced.
 */
@JsonPropertyOrder({
    "source_id", "execution_status", "execution_output", "lexical", "invalid_tokens", "lexical_time",
    "syntax_result", "syntax_errors", "syntax_time", "time_complexity", "summary", "suggestions",
    "ast_image", "ast", "collaborator_errors"
})
public record ResultPayload(
    @JsonProperty("source_id") String sourceId,
    @JsonProperty("execution_status") String executionStatus,
    @JsonProperty("execution_output") String executionOutput,
    @JsonProperty("lexical") Map<String, Integer> lexical,
    @JsonProperty("invalid_tokens") List<String> invalidTokens,
    @JsonProperty("lexical_time") double lexicalTime,
    @JsonProperty("syntax_result") String syntaxResult,
    @JsonProperty("syntax_errors") List<String> syntaxErrors,
    @JsonProperty("syntax_time") double syntaxTime,
    @JsonProperty("time_complexity") String timeComplexity,
    @JsonProperty("summary") List<String> summary,
    @JsonProperty("suggestions") List<String> suggestions,
    @JsonProperty("ast_image") String astImage,
    @JsonProperty("ast") TreeNode ast,
    @JsonProperty("collaborator_errors") List<String> collaboratorErrors
) {

    /**
     * Nested syntax tree node.
     *
     * @param label node label, e.g. {@code Class: Main}
     * @param children child nodes in insertion order
     */
    public record TreeNode(
        @JsonProperty("label") String label,
        @JsonProperty("children") List<TreeNode> children
    ) {
        public TreeNode {
            children = children == null ? List.of() : List.copyOf(children);
        }
    }

    /**
     * Builds the payload for a result.
     *
     * @param result analysis result
     * @return payload
     */
    public static ResultPayload from(AnalysisResult result) {
        return new ResultPayload(
            result.sourceId(),
            result.execution().status().label(),
            result.execution().output(),
            result.tokens().frequencies(),
            result.tokens().invalidTokens(),
            seconds(result.tokens().elapsed()),
            result.verdict().label(),
            result.structure().messages(),
            seconds(result.structure().elapsed()),
            result.complexity().label(),
            result.summary().sentences(),
            result.summary().suggestions(),
            result.visualization().location(),
            toTreeNode(result.syntaxTree(), result.syntaxTree().root()),
            result.collaboratorFailures());
    }

    static double seconds(Duration elapsed) {
        return Math.round(elapsed.toNanos() / 100_000.0) / 10_000.0;
    }

    private static TreeNode toTreeNode(SyntaxTree tree, AstNode node) {
        List<TreeNode> children = tree.children(node).stream()
            .map(child -> toTreeNode(tree, child))
            .toList();
        return new TreeNode(node.label(), children);
    }
}
