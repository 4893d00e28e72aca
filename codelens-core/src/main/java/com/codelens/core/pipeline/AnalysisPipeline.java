package com.codelens.core.pipeline;

import com.codelens.core.analysis.ComplexityEstimator;
import com.codelens.core.analysis.StructureValidator;
import com.codelens.core.analysis.SummaryGenerator;
import com.codelens.core.analysis.SyntaxTreeBuilder;
import com.codelens.core.analysis.Tokenizer;
import com.codelens.core.config.CodeLensConfig;
import com.codelens.core.execution.CollaboratorUnavailableException;
import com.codelens.core.execution.ExecutionService;
import com.codelens.core.execution.JavacExecutionService;
import com.codelens.core.execution.SystemCommandExecutor;
import com.codelens.core.model.AnalysisResult;
import com.codelens.core.model.AnalysisSummary;
import com.codelens.core.model.ComplexityEstimate;
import com.codelens.core.model.ExecutionOutcome;
import com.codelens.core.model.ExecutionStatus;
import com.codelens.core.model.StructureReport;
import com.codelens.core.model.SyntaxTree;
import com.codelens.core.model.TokenReport;
import com.codelens.core.model.VisualizationReference;
import com.codelens.core.util.IdGenerator;
import com.codelens.core.visualization.DiagramFileVisualizer;
import com.codelens.core.visualization.DotGenerator;
import com.codelens.core.visualization.GeneratorConfig;
import com.codelens.core.visualization.GraphvizTreeVisualizer;
import com.codelens.core.visualization.TreeDiagramGenerator;
import com.codelens.core.visualization.TreeVisualizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.ServiceLoader;

/**
 * Runs the analysis phases over one source text and assembles the {@link AnalysisResult}.
 *
 * <p><b>Phases:</b>
 * <ol>
 *   <li>Tokenizer</li>
 *   <li>Structure validator</li>
 *   <li>Execution collaborator, only for a {@code Correct} verdict; an {@code Incorrect}
 *       verdict yields {@code Incorrect Syntax} with the joined error messages</li>
 *   <li>Syntax tree builder, then the visualization collaborator</li>
 *   <li>Summary and suggestion generator</li>
 *   <li>Complexity estimator</li>
 * </ol>
 *
 * <p>Collaborator failures never abort the analysis. They are recorded in
 * {@link AnalysisResult#collaboratorFailures()} and the affected field degrades to
 * {@code Execution Unavailable} or an unavailable visualization reference.
 *
 * <p>Instances hold no per-invocation state and may be shared between threads.
 */
public class AnalysisPipeline {

    private static final Logger log = LoggerFactory.getLogger(AnalysisPipeline.class);

    static final String ARTIFACT_PREFIX = "ast";

    private final Tokenizer tokenizer;
    private final StructureValidator validator;
    private final SyntaxTreeBuilder treeBuilder;
    private final SummaryGenerator summaryGenerator;
    private final ComplexityEstimator complexityEstimator;
    private final ExecutionService executionService;
    private final TreeVisualizer visualizer;
    private final String entryPoint;

    /**
     * Creates a pipeline with the default analysis phases.
     *
     * @param executionService execution collaborator, or {@code null} to skip execution
     * @param visualizer visualization collaborator, or {@code null} to skip rendering
     * @param entryPoint class name handed to the execution collaborator
     */
    public AnalysisPipeline(ExecutionService executionService, TreeVisualizer visualizer, String entryPoint) {
        this(new Tokenizer(), new StructureValidator(), new SyntaxTreeBuilder(), new SummaryGenerator(),
            new ComplexityEstimator(), executionService, visualizer, entryPoint);
    }

    public AnalysisPipeline(Tokenizer tokenizer, StructureValidator validator, SyntaxTreeBuilder treeBuilder,
                            SummaryGenerator summaryGenerator, ComplexityEstimator complexityEstimator,
                            ExecutionService executionService, TreeVisualizer visualizer, String entryPoint) {
        this.tokenizer = Objects.requireNonNull(tokenizer, "tokenizer must not be null");
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
        this.treeBuilder = Objects.requireNonNull(treeBuilder, "treeBuilder must not be null");
        this.summaryGenerator = Objects.requireNonNull(summaryGenerator, "summaryGenerator must not be null");
        this.complexityEstimator = Objects.requireNonNull(complexityEstimator, "complexityEstimator must not be null");
        this.entryPoint = Objects.requireNonNull(entryPoint, "entryPoint must not be null");
        this.executionService = executionService;
        this.visualizer = visualizer;
    }

    /**
     * Wires a pipeline from configuration.
     *
     * <p>The {@code dot} generator renders images through Graphviz; any other generator id
     * registered as a {@link TreeDiagramGenerator} writes its diagram source as the artifact.
     *
     * @param config configuration
     * @return configured pipeline
     * @throws IllegalArgumentException if the configured diagram generator is unknown, or
     *         execution is enabled with an entry point that is not a class name
     */
    public static AnalysisPipeline fromConfig(CodeLensConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        CodeLensConfig.ExecutionSettings execution = config.execution();
        CodeLensConfig.VisualizationSettings visualization = config.visualization();

        ExecutionService executionService = null;
        if (execution.enabled()) {
            JavacExecutionService.requireValidEntryPoint(execution.entryPoint());
            executionService = new JavacExecutionService(
                new SystemCommandExecutor("execution"), execution.javaHome(), execution.timeout());
        }

        TreeVisualizer visualizer = null;
        if (visualization.enabled()) {
            visualizer = createVisualizer(visualization);
        }

        log.debug("Pipeline configured (execution: {}, visualization: {})",
            execution.enabled(), visualization.enabled() ? visualization.generator() : "off");
        return new AnalysisPipeline(executionService, visualizer, execution.entryPoint());
    }

    private static TreeVisualizer createVisualizer(CodeLensConfig.VisualizationSettings settings) {
        Path outputDirectory = Paths.get(settings.outputDirectory());
        GeneratorConfig generatorConfig = GeneratorConfig.from(settings);

        if (DotGenerator.ID.equals(settings.generator())) {
            return new GraphvizTreeVisualizer(new DotGenerator(), generatorConfig,
                new SystemCommandExecutor("visualization"), outputDirectory,
                settings.dotExecutable(), settings.format(), settings.timeout());
        }

        for (TreeDiagramGenerator generator : ServiceLoader.load(TreeDiagramGenerator.class)) {
            if (generator.getId().equals(settings.generator())) {
                return new DiagramFileVisualizer(generator, generatorConfig, outputDirectory);
            }
        }
        throw new IllegalArgumentException("Unknown diagram generator: " + settings.generator());
    }

    /**
     * Analyzes one source text.
     *
     * @param source source text; any string is accepted
     * @return aggregate result
     */
    public AnalysisResult analyze(String source) {
        Objects.requireNonNull(source, "source must not be null");
        String sourceId = IdGenerator.fingerprint(source);
        List<String> failures = new ArrayList<>();
        log.info("Analyzing source {} ({} characters)", sourceId, source.length());

        TokenReport tokens = tokenizer.tokenize(source);
        StructureReport structure = validator.validate(source);
        log.debug("Structure verdict for {}: {}", sourceId, structure.verdict().label());

        ExecutionOutcome execution = execute(source, structure, failures);

        SyntaxTree tree = treeBuilder.build(source);
        VisualizationReference visualization = visualize(tree, failures);

        AnalysisSummary summary = summaryGenerator.summarize(source);
        ComplexityEstimate complexity = complexityEstimator.estimate(source);

        log.info("Analysis of {} complete: {}, {}, {}", sourceId, structure.verdict().label(),
            complexity.label(), execution.status().label());
        return new AnalysisResult(sourceId, tokens, structure, tree, summary, complexity,
            execution, visualization, failures);
    }

    private ExecutionOutcome execute(String source, StructureReport structure, List<String> failures) {
        if (!structure.isCorrect()) {
            return new ExecutionOutcome(ExecutionStatus.INCORRECT_SYNTAX, String.join("\n", structure.messages()));
        }
        if (executionService == null) {
            return ExecutionOutcome.skipped();
        }
        try {
            return executionService.execute(source, entryPoint);
        } catch (CollaboratorUnavailableException e) {
            log.warn("Execution collaborator unavailable: {}", e.getMessage());
            failures.add(describe(e));
            return new ExecutionOutcome(ExecutionStatus.UNAVAILABLE, e.getMessage());
        }
    }

    private VisualizationReference visualize(SyntaxTree tree, List<String> failures) {
        String artifactId = IdGenerator.artifactId(ARTIFACT_PREFIX);
        if (visualizer == null) {
            return VisualizationReference.unavailable(artifactId);
        }
        try {
            return visualizer.visualize(tree, artifactId);
        } catch (CollaboratorUnavailableException e) {
            log.warn("Visualization collaborator unavailable: {}", e.getMessage());
            failures.add(describe(e));
            return VisualizationReference.unavailable(artifactId);
        }
    }

    private static String describe(CollaboratorUnavailableException e) {
        return e.getCollaborator() + ": " + e.getMessage();
    }
}
