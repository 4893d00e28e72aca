package com.codelens.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Aggregate result of one pipeline invocation.
 *
 * <p>Created fresh per invocation and immutable afterwards.
 *
 * @param sourceId deterministic fingerprint of the analyzed source
 * @param tokens tokenizer output
 * @param structure structure validator output
 * @param syntaxTree heuristic syntax tree
 * @param summary descriptive sentences and suggestions
 * @param complexity loop-based complexity estimate
 * @param execution execution collaborator outcome
 * @param visualization reference to the rendered tree
 * @param collaboratorFailures messages of collaborators that could not be invoked
 */
public record AnalysisResult(
    String sourceId,
    TokenReport tokens,
    StructureReport structure,
    SyntaxTree syntaxTree,
    AnalysisSummary summary,
    ComplexityEstimate complexity,
    ExecutionOutcome execution,
    VisualizationReference visualization,
    List<String> collaboratorFailures
) {
    /**
     * Compact constructor with validation.
     */
    public AnalysisResult {
        Objects.requireNonNull(sourceId, "sourceId must not be null");
        Objects.requireNonNull(tokens, "tokens must not be null");
        Objects.requireNonNull(structure, "structure must not be null");
        Objects.requireNonNull(syntaxTree, "syntaxTree must not be null");
        Objects.requireNonNull(summary, "summary must not be null");
        Objects.requireNonNull(complexity, "complexity must not be null");
        Objects.requireNonNull(execution, "execution must not be null");
        Objects.requireNonNull(visualization, "visualization must not be null");
        collaboratorFailures = collaboratorFailures == null ? List.of() : List.copyOf(collaboratorFailures);
    }

    public SyntaxVerdict verdict() {
        return structure.verdict();
    }

    public boolean hasCollaboratorFailures() {
        return !collaboratorFailures.isEmpty();
    }
}
